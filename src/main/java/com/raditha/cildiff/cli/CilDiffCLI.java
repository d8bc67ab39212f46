package com.raditha.cildiff.cli;

import ch.qos.logback.classic.Level;
import com.raditha.cildiff.analyzer.PolicyDiffAnalyzer;
import com.raditha.cildiff.analyzer.PolicyDiffReport;
import com.raditha.cildiff.config.CilDiffConfig;
import com.raditha.cildiff.config.CilDiffSettings;
import com.raditha.cildiff.config.OutputFormat;
import com.raditha.cildiff.loader.PolicyFileLoader;
import com.raditha.cildiff.model.PolicyModelException;
import com.raditha.cildiff.parser.CilParseException;
import com.raditha.cildiff.report.AnnotatedCilRenderer;
import com.raditha.cildiff.report.DiffRenderer;
import com.raditha.cildiff.report.JsonDiffRenderer;
import com.raditha.cildiff.report.ValueChangeDescriber;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the CIL policy differ.
 * <p>
 * Usage:
 * java -jar cildiff.jar [options] LEFT RIGHT
 * <p>
 * Configuration priority: CLI arguments > cildiff.yml > defaults
 */
@Command(name = "cildiff", mixinStandardHelpOptions = true, version = "cildiff 1.0.0",
        description = "Compute the semantic difference between two SELinux CIL policy files",
        footer = {"", "Either file may be '-' to read standard input. Files may be plain text or bzip2 compressed."})
public class CilDiffCLI implements Callable<Integer> {

    private static final String BASE_LOGGER = "com.raditha.cildiff";

    @Parameters(index = "0", paramLabel = "LEFT", description = "Left policy file")
    private String leftPath;

    @Parameters(index = "1", paramLabel = "RIGHT", description = "Right policy file")
    private String rightPath;

    @Option(names = "--json", arity = "0..1", fallbackValue = "compact", paramLabel = "pretty",
            description = "Format output as JSON instead of CIL with comments, optionally indented",
            converter = JsonLayoutConverter.class)
    private JsonLayout jsonLayout;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--no-root-hashes", description = "Omit the root hash header of CIL output")
    private boolean noRootHashes = false;

    @Option(names = {"-v", "--verbose"}, description = "Log progress and comparison statistics to standard error")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    private final PolicyDiffAnalyzer analyzer;

    public CilDiffCLI() {
        this(new PolicyDiffAnalyzer());
    }

    CilDiffCLI(PolicyDiffAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Picocli call method - executes the comparison.
     *
     * @return exit code, 0 also when differences were found
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(BASE_LOGGER)).setLevel(Level.DEBUG);
        }

        Map<String, Object> yaml = CilDiffSettings.loadYaml(configFile);
        CilDiffConfig config = CilDiffSettings.loadConfig(yaml,
                jsonLayout != null ? OutputFormat.JSON : null,
                jsonLayout != null ? jsonLayout == JsonLayout.PRETTY : null,
                noRootHashes ? Boolean.FALSE : null);

        PolicyDiffReport report = analyzer.analyze(leftPath, rightPath);

        PrintWriter out = spec.commandLine().getOut();
        createRenderer(config).render(report.tree(), out);
        return 0;
    }

    static DiffRenderer createRenderer(CilDiffConfig config) {
        ValueChangeDescriber describer = config.describeChanges() ? new ValueChangeDescriber() : null;
        return switch (config.format()) {
            case JSON -> new JsonDiffRenderer(config.pretty(), describer);
            case CIL -> new AnnotatedCilRenderer(config.rootHashes(), describer);
        };
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(new CilDiffCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Set up the command line with the exit code mapping of this tool.
     */
    static CommandLine createCommandLine(CilDiffCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof CilParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return 4;
            } else if (ex instanceof PolicyModelException) {
                commandLine.getErr().println("Invalid policy: " + ex.getMessage());
                return 1;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine commandLine = ex.getCommandLine();
            commandLine.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, commandLine.getErr());
            commandLine.getErr().print(commandLine.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (PolicyFileLoader.STDIN.equals(leftPath) && PolicyFileLoader.STDIN.equals(rightPath)) {
            throw new IllegalArgumentException("Standard input can only be read for one side");
        }
        if (configFile != null && !new java.io.File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    /**
     * Custom converter for JsonLayout enum to handle CLI string values.
     */
    public static class JsonLayoutConverter implements ITypeConverter<JsonLayout> {
        @Override
        public JsonLayout convert(String value) throws Exception {
            return JsonLayout.fromString(value);
        }
    }
}
