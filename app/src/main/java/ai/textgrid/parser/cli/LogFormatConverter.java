package ai.textgrid.parser.cli;

import ai.textgrid.parser.config.LogFormat;
import picocli.CommandLine;

/**
 * Turns {@code --log-format text|json} into a {@link LogFormat}; unknown values surface as a picocli usage error.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}
