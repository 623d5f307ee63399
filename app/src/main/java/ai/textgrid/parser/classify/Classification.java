package ai.textgrid.parser.classify;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of classifying a cluster that maps to a construct.
 */
public record Classification(ConstructType constructType,
                             Optional<Orientation> orientation,
                             Signature signature,
                             boolean hasChildHeader,
                             double confidence) {

    public static final double CERTAIN = 1.0;

    public Classification {
        Objects.requireNonNull(constructType, "constructType");
        Objects.requireNonNull(signature, "signature");
        orientation = orientation == null ? Optional.empty() : orientation;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static Classification of(ConstructType type, Signature signature) {
        return new Classification(type, Optional.empty(), signature, false, CERTAIN);
    }

    public static Classification oriented(ConstructType type, Orientation orientation, Signature signature) {
        return new Classification(type, Optional.of(orientation), signature, false, CERTAIN);
    }

    public static Classification tree(Orientation orientation, boolean hasChildHeader, Signature signature) {
        return new Classification(ConstructType.TREE, Optional.of(orientation), signature, hasChildHeader, CERTAIN);
    }

    /**
     * Orientation, defaulting to vertical for constructs that carry none.
     */
    public Orientation orientationOrDefault() {
        return orientation.orElse(Orientation.VERTICAL);
    }

    public String describe() {
        StringBuilder builder = new StringBuilder(constructType.label());
        orientation.ifPresent(value -> builder.append(' ').append(value.name().toLowerCase()));
        if (hasChildHeader) {
            builder.append(" with child header");
        }
        return builder.toString();
    }
}
