package ai.textgrid.parser.io;

/**
 * Raised when delimited text cannot be turned into a grid.
 */
public class GridFormatException extends RuntimeException {

    public GridFormatException(String message) {
        super(message);
    }
}
