package ai.textgrid.parser.classify;

/**
 * Primary axis of a construct. Vertical is the regular layout, horizontal the transposed one.
 */
public enum Orientation {
    VERTICAL,
    HORIZONTAL;

    public boolean isTransposed() {
        return this == HORIZONTAL;
    }
}
