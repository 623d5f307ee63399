package ai.textgrid.parser.classify;

/**
 * Kinds of semantic structure the engine recognizes.
 */
public enum ConstructType {
    TABLE("table"),
    MATRIX("matrix"),
    KEY_VALUE("key-value"),
    LIST("list"),
    TREE("tree");

    private final String label;

    ConstructType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
