package ai.textgrid.parser.config;

import ai.textgrid.parser.cli.CliArguments;
import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.engine.ParserSettings;
import ai.textgrid.parser.io.GridFormat;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT = "TEXTGRID_INPUT";
    static final String ENV_FORMAT = "TEXTGRID_FORMAT";
    static final String ENV_ADJACENCY = "TEXTGRID_ADJACENCY";
    static final String ENV_MAX_DEPTH = "TEXTGRID_MAX_DEPTH";
    static final String ENV_NESTED_MIN_CELLS = "TEXTGRID_NESTED_MIN_CELLS";
    static final String ENV_INDENT_WIDTH = "TEXTGRID_INDENT_WIDTH";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        ParserSettings defaults = ParserSettings.defaults();

        Path input = resolveInput(arguments);
        GridFormat format = resolveFormat(arguments, input);
        Adjacency adjacency = Optional.ofNullable(arguments.adjacency())
                .or(() -> environmentReader.get(ENV_ADJACENCY).filter(ConfigLoader::isNotBlank).map(Adjacency::from))
                .orElse(defaults.adjacency());
        int maxDepth = resolveInteger(arguments.maxDepth(), ENV_MAX_DEPTH, defaults.maxNestingDepth(), 0);
        int nestedMinCells = resolveInteger(arguments.nestedMinCells(), ENV_NESTED_MIN_CELLS,
                defaults.nestedMinCells(), 1);
        int indentWidth = resolveInteger(arguments.indentWidth(), ENV_INDENT_WIDTH, defaults.indentWidth(), 1);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(input, format, adjacency, maxDepth, nestedMinCells, indentWidth, logFormat);
    }

    private Path resolveInput(CliArguments arguments) {
        if (arguments.input() != null) {
            return arguments.input();
        }
        return environmentReader.get(ENV_INPUT)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of)
                .orElseThrow(() -> new IllegalArgumentException("input file must be provided (FILE or " + ENV_INPUT + ")"));
    }

    private GridFormat resolveFormat(CliArguments arguments, Path input) {
        GridFormat cliFormat = arguments.format();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(GridFormat::from)
                .orElseGet(() -> GridFormat.fromFileName(input));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue, int minimum) {
        if (cliValue != null) {
            return requireAtLeast(cliValue, envKey, minimum);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseInteger(raw, envKey))
                .map(value -> requireAtLeast(value, envKey, minimum))
                .orElse(defaultValue);
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static int requireAtLeast(int value, String key, int minimum) {
        if (value < minimum) {
            throw new IllegalArgumentException(key + " must be " + minimum + " or greater");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
