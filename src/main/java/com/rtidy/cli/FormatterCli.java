package com.rtidy.cli;

import com.rtidy.api.FormatterResult;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.TidyException;
import com.rtidy.config.ConfigurationLoader;
import com.rtidy.config.FormatterConfig;
import com.rtidy.config.OptionResolver;
import com.rtidy.config.TidyOptions;
import com.rtidy.core.TidyFormatter;
import com.rtidy.io.ClipboardSourceReader;
import com.rtidy.io.ConsoleOutputWriter;
import com.rtidy.io.FileOutputWriter;
import com.rtidy.io.FileSourceReader;
import com.rtidy.io.OutputWriter;
import com.rtidy.io.SourceReader;
import com.rtidy.io.TextSourceReader;
import com.rtidy.plugins.FileType;
import com.rtidy.plugins.r.FunctionUsage;
import com.rtidy.plugins.r.RFormatterPlugin;
import com.rtidy.util.ErrorFormatter;
import com.rtidy.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface of the R formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    // boolean flags and the option each one sets
    private static final Map<String, Map.Entry<String, Boolean>> SWITCHES = new LinkedHashMap<>();
    // valued flags and the option (current or deprecated name) each one sets
    private static final Map<String, String> VALUED = new LinkedHashMap<>();

    static {
        SWITCHES.put("--no-comment", Map.entry(OptionResolver.COMMENT, false));
        SWITCHES.put("--no-blank", Map.entry(OptionResolver.BLANK, false));
        SWITCHES.put("--arrow", Map.entry(OptionResolver.ARROW, true));
        SWITCHES.put("--brace-newline", Map.entry(OptionResolver.BRACE_NEWLINE, true));

        VALUED.put("--indent", OptionResolver.INDENT);
        VALUED.put("--width", OptionResolver.WIDTH_CUTOFF);
        VALUED.put("--keep-comment", "keep.comment");
        VALUED.put("--keep-blank-line", "keep.blank.line");
        VALUED.put("--replace-assign", "replace.assign");
        VALUED.put("--left-brace-newline", "left.brace.newline");
        VALUED.put("--reindent-spaces", "reindent.spaces");
    }

    private final PrintStream out;
    private final ErrorFormatter errorFormatter;

    FormatterCli(PrintStream out, boolean useColors) {
        this.out = out;
        this.errorFormatter = new ErrorFormatter(useColors);
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args, System.out);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out) {
        FormatterCli cli = new FormatterCli(out, !_hasOption(args, "--no-color"));
        if (args.length < 1) {
            cli._printUsage();
            return EXIT_USAGE;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        }
        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.setLogFilePath(Paths.get(logFile));
        }

        try {
            switch (args[0]) {
                case "format":
                    return cli._formatPath(args, true);
                case "check":
                    return cli._formatPath(args, false);
                case "print":
                    return cli._print(args);
                case "usage":
                    return cli._usage(args);
                case "init":
                    return cli._initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("rtidy version " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    cli._printUsage();
                    return EXIT_OK;
                default:
                    cli._printError("Unknown command: " + args[0]);
                    cli._printUsage();
                    return EXIT_USAGE;
            }
        } catch (TidyException e) {
            cli._printError(cli.errorFormatter.formatError(FormatterError.of(e)));
            return EXIT_FAILURE;
        } catch (IOException e) {
            cli._printError("Error: " + e.getMessage());
            logger.log(Level.FINE, "I/O failure", e);
            return EXIT_FAILURE;
        }
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "rtidy v" + VERSION + ": tidy R source code"));
        out.println("Usage:");
        out.println("  rtidy format <path>                  - Tidy a file or directory in place");
        out.println("  rtidy check <path>                   - Report files that are not tidy");
        out.println("  rtidy print <file>                   - Print the tidy code of a file");
        out.println("  rtidy print --text=<code>            - Print the tidy code of the given text");
        out.println("  rtidy print --clipboard              - Print the tidy code on the clipboard");
        out.println("  rtidy usage <file> <function>        - Print the parameter list of a function");
        out.println("  rtidy init [--force]                 - Write a default " + ConfigurationLoader.CONFIG_FILE_NAME);
        out.println("  rtidy --help|-h                      - Show this help");
        out.println("  rtidy --version|-v                   - Show version information");
        out.println();
        out.println("Tidy options:");
        out.println("  --no-comment                         - Drop comments");
        out.println("  --no-blank                           - Drop blank lines");
        out.println("  --arrow                              - Replace = assignments with <-");
        out.println("  --brace-newline                      - Put { on its own line");
        out.println("  --indent=<n>                         - Spaces per indentation level (default: 4)");
        out.println("  --width=<n>                          - Line width, 20 to 500 (default: 80)");
        out.println("  --keep-comment=, --keep-blank-line=, --replace-assign=,");
        out.println("  --left-brace-newline=, --reindent-spaces=");
        out.println("                                       - Deprecated spellings of the options above");
        out.println();
        out.println("Other options:");
        out.println("  --config=<file>                      - Use specific config file (default: " + ConfigurationLoader.CONFIG_FILE_NAME + ")");
        out.println("  --recursive                          - Descend into subdirectories");
        out.println("  --threads=<n>                        - Number of threads to use (default: available processors)");
        out.println("  --output=<file> [--append]           - Write printed code to a file");
        out.println("  --verbose                            - Show detailed output");
        out.println("  --log-file=<file>                    - Also log to a file");
        out.println("  --no-color                           - Disable colored output");
        out.println("  --force                              - Force overwrite (with init command)");
    }

    private int _formatPath(String[] args, boolean write) throws IOException {
        List<String> positional = _positionalArguments(args);
        if (positional.size() < 2) {
            _printError("Error: Missing path argument");
            return EXIT_USAGE;
        }

        Path path = Paths.get(positional.get(1));
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + path);
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        FormatterConfig config = _loadConfig(args);
        Instant start = Instant.now();

        try (TidyFormatter formatter = _createFormatter(config)) {
            Map<Path, FormatterResult> results;
            Set<Path> changed;
            if (Files.isDirectory(path)) {
                results = formatter.formatDirectory(path, config.isRecursive(), config.getThreads(), write);
                changed = formatter.getChangedFiles();
            } else {
                String source = new FileSourceReader(path).read();
                FormatterResult result = formatter.formatFile(path, source);
                changed = result.isSuccessful() && result.changes(source) ? Set.of(path) : Set.of();
                if (write && !changed.isEmpty()) {
                    new FileOutputWriter(path, false).write(result.getFormattedCode());
                }
                results = Map.of(path, result);
            }
            return _report(results, changed, write, verbose, Duration.between(start, Instant.now()));
        } catch (TidyException | IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to close formatter: " + e.getMessage(), e);
        }
    }

    private int _report(Map<Path, FormatterResult> results, Set<Path> changedFiles,
                        boolean write, boolean verbose, Duration duration) {
        int changed = 0;
        int unchanged = 0;
        int failed = 0;
        Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();

        for (Map.Entry<Path, FormatterResult> entry : new TreeMap<>(results).entrySet()) {
            Path file = entry.getKey();
            FormatterResult result = entry.getValue();
            if (!result.isSuccessful()) {
                failed++;
                errorsByFile.put(file, result.getErrors());
                _printError((write ? "Failed to format: " : "Failed to check: ") + file);
                continue;
            }
            if (verbose) {
                result.getErrors().forEach(e -> out.println("  " + errorFormatter.formatFileError(file, e)));
            }
            if (changedFiles.contains(file)) {
                changed++;
                if (write) {
                    _printSuccess("Formatted: " + file);
                } else {
                    _printWarning("File needs formatting: " + file);
                }
            } else {
                unchanged++;
                if (verbose) {
                    _printInfo("  Already tidy: " + file);
                }
            }
        }

        out.println();
        out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ": "
                + errorFormatter.formatRunSummary(changed, unchanged, failed));
        if (!errorsByFile.isEmpty()) {
            out.println();
            out.println(errorFormatter.formatErrorSummary(errorsByFile));
        }

        if (failed > 0 || (!write && changed > 0)) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int _print(String[] args) throws IOException {
        List<String> positional = _positionalArguments(args);
        SourceReader reader;
        String text = _getOptionValue(args, "--text");
        if (text != null) {
            reader = new TextSourceReader(text);
        } else if (_hasOption(args, "--clipboard")) {
            reader = new ClipboardSourceReader();
        } else if (positional.size() >= 2) {
            reader = new FileSourceReader(Paths.get(positional.get(1)));
        } else {
            _printError("Error: Give a file, --text=<code> or --clipboard");
            return EXIT_USAGE;
        }

        FormatterConfig config = _loadConfig(args);
        RFormatterPlugin plugin = new RFormatterPlugin();
        plugin.initialize(config);
        FormatterResult result = plugin.format(Paths.get(reader.describe()), reader.read());
        if (!result.isSuccessful()) {
            result.getErrors().forEach(e -> _printError(errorFormatter.formatError(e)));
            return EXIT_FAILURE;
        }

        String output = _getOptionValue(args, "--output");
        OutputWriter writer = output != null
                ? new FileOutputWriter(Paths.get(output), _hasOption(args, "--append"))
                : new ConsoleOutputWriter(out);
        writer.write(result.getFormattedCode());
        return EXIT_OK;
    }

    private int _usage(String[] args) throws IOException {
        List<String> positional = _positionalArguments(args);
        if (positional.size() < 3) {
            _printError("Error: usage needs a file and a function name");
            return EXIT_USAGE;
        }
        String source = new FileSourceReader(Paths.get(positional.get(1))).read();
        TidyOptions options = _loadConfig(args).resolveTidyOptions().getOptions();
        out.println(FunctionUsage.usage(source, positional.get(2), options.getWidthCutoff()));
        return EXIT_OK;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : ConfigurationLoader.CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        ConfigurationLoader.writeDefaultConfig(configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    /**
     * Loads the configuration file and lays the command line options over it.
     */
    static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config = ConfigurationLoader.loadConfig(
                Paths.get(configFile != null ? configFile : ConfigurationLoader.CONFIG_FILE_NAME));

        Map<String, Object> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, Map.Entry<String, Boolean>> sw : SWITCHES.entrySet()) {
            if (_hasOption(args, sw.getKey())) {
                overrides.put(sw.getValue().getKey(), sw.getValue().getValue());
            }
        }
        for (Map.Entry<String, String> flag : VALUED.entrySet()) {
            String value = _getOptionValue(args, flag.getKey());
            if (value != null) {
                overrides.put(flag.getValue(), value);
            }
        }
        config = config.withTidyOverrides(overrides);

        if (_hasOption(args, "--recursive")) {
            config = config.withGeneral("recursive", true);
        }
        String threads = _getOptionValue(args, "--threads");
        if (threads != null) {
            if (threads.matches("\\d{1,4}") && Integer.parseInt(threads) > 0) {
                config = config.withGeneral("threads", Integer.parseInt(threads));
            } else {
                logger.warning("Invalid thread count: " + threads + ", using default");
            }
        }
        return config;
    }

    private static TidyFormatter _createFormatter(FormatterConfig config) {
        TidyFormatter formatter = new TidyFormatter(config);
        formatter.registerPlugin(FileType.R_SCRIPT, new RFormatterPlugin());
        return formatter;
    }

    private static List<String> _positionalArguments(String[] args) {
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                positional.add(arg);
            }
        }
        return positional;
    }

    static boolean _hasOption(String[] args, String option) {
        for (String arg : args) {
            if (arg.equals(option)) {
                return true;
            }
        }
        return false;
    }

    static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                return arg.substring(prefix.length());
            }
        }
        return null;
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;

        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
