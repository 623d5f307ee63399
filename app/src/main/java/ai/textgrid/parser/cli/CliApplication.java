package ai.textgrid.parser.cli;

import ai.textgrid.parser.classify.LoggingClassificationListener;
import ai.textgrid.parser.config.Config;
import ai.textgrid.parser.config.ConfigLoader;
import ai.textgrid.parser.config.SystemEnvironmentReader;
import ai.textgrid.parser.engine.ConstructParser;
import ai.textgrid.parser.engine.ParseResult;
import ai.textgrid.parser.io.GridFileReader;
import ai.textgrid.parser.io.GridFormatException;
import ai.textgrid.parser.logging.LoggingConfigurator;
import ai.textgrid.parser.surface.GridSurface;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and detection pipeline.
 */
public final class CliApplication {

    static final int EXIT_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final GridFileReader fileReader;
    private final ParseReportFormatter formatter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new GridFileReader(), new ParseReportFormatter());
    }

    CliApplication(ConfigLoader configLoader, GridFileReader fileReader, ParseReportFormatter formatter) {
        this.configLoader = configLoader;
        this.fileReader = fileReader;
        this.formatter = formatter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        return run(commandLine, cliArguments, args);
    }

    int run(CommandLine commandLine, CliArguments cliArguments, String[] args) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Parsing {} as {} with {} adjacency (max depth {}, nested min cells {})",
                config.input(), config.format(), config.adjacency(), config.maxNestingDepth(), config.nestedMinCells());

        GridSurface surface;
        try {
            surface = fileReader.read(config.input(), config.format());
        } catch (UncheckedIOException | GridFormatException ex) {
            LOGGER.error("Cannot load grid from {}", config.input(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }

        ConstructParser parser = new ConstructParser(config.parserSettings(), new LoggingClassificationListener());
        ParseResult result = parser.parse(surface);
        PrintWriter out = commandLine.getOut();
        out.print(formatter.format(result));
        out.flush();
        return 0;
    }
}
