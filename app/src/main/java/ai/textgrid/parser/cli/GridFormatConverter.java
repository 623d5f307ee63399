package ai.textgrid.parser.cli;

import ai.textgrid.parser.io.GridFormat;
import picocli.CommandLine;

public class GridFormatConverter implements CommandLine.ITypeConverter<GridFormat> {
    @Override
    public GridFormat convert(String value) {
        return GridFormat.from(value);
    }
}
