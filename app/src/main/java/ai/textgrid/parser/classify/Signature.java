package ai.textgrid.parser.classify;

import java.util.Objects;

/**
 * Geometric fingerprint of a cluster: a 4-bit key over its top-left 2x2 corner or one of three sentinels.
 *
 * <p>Bit order of the key is R1C1, R1C2, R2C1, R2C2 with R1C1 as the most significant bit.
 */
public record Signature(Kind kind, int key) {

    public enum Kind {
        BINARY,
        SINGLE_CELL,
        VERTICAL_LIST,
        HORIZONTAL_LIST
    }

    public static final Signature SINGLE_CELL = new Signature(Kind.SINGLE_CELL, -1);
    public static final Signature VERTICAL_LIST = new Signature(Kind.VERTICAL_LIST, -1);
    public static final Signature HORIZONTAL_LIST = new Signature(Kind.HORIZONTAL_LIST, -1);

    public Signature {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.BINARY && (key < 0 || key > 15)) {
            throw new IllegalArgumentException("Binary keys range from 0 to 15, got " + key);
        }
        if (kind != Kind.BINARY) {
            key = -1;
        }
    }

    public static Signature binary(int key) {
        return new Signature(Kind.BINARY, key);
    }

    public static Signature binary(boolean r1c1, boolean r1c2, boolean r2c1, boolean r2c2) {
        int key = (bit(r1c1) << 3) | (bit(r1c2) << 2) | (bit(r2c1) << 1) | bit(r2c2);
        return binary(key);
    }

    public boolean isBinary() {
        return kind == Kind.BINARY;
    }

    /**
     * Short code: the numeric key, or SC / VL / HL for the sentinels.
     */
    public String code() {
        return switch (kind) {
            case BINARY -> Integer.toString(key);
            case SINGLE_CELL -> "SC";
            case VERTICAL_LIST -> "VL";
            case HORIZONTAL_LIST -> "HL";
        };
    }

    public String description() {
        return switch (kind) {
            case SINGLE_CELL -> "Single Cell";
            case VERTICAL_LIST -> "Vertical List";
            case HORIZONTAL_LIST -> "Horizontal List";
            case BINARY -> switch (key) {
                case 0, 1, 2, 3, 4, 5 -> "Extended Key " + key;
                case 6 -> "Corner Marker";
                case 7 -> "Matrix";
                case 8 -> "Single Corner Cell";
                case 9 -> "Key-Value";
                case 10 -> "Tree (Regular)";
                case 11 -> "Tree (Regular, with Header)";
                case 12 -> "Tree (Transposed)";
                case 13 -> "Tree (Transposed, with Header)";
                case 14 -> "Root Marker";
                default -> "Table";
            };
        };
    }

    /**
     * Fill pattern as text, one line per row: {@code "10\n11"} for key 11.
     */
    public String pattern() {
        return switch (kind) {
            case SINGLE_CELL -> "1";
            case VERTICAL_LIST -> "1\n1";
            case HORIZONTAL_LIST -> "11";
            case BINARY -> ((key >> 3) & 1) + "" + ((key >> 2) & 1) + "\n" + ((key >> 1) & 1) + (key & 1);
        };
    }

    @Override
    public String toString() {
        return code();
    }

    private static int bit(boolean value) {
        return value ? 1 : 0;
    }
}
