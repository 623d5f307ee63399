package ai.textgrid.parser.classify;

import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.cluster.MalformedClusterException;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a cluster to a construct type using the fill pattern of its top-left 2x2 corner.
 *
 * <p>Checks run in order and the first match wins:
 * <ol>
 *     <li>a single filled cell is never a construct;</li>
 *     <li>a one-column or one-row cluster whose first two cells are filled is a list;</li>
 *     <li>otherwise the 4-bit corner key is looked up: 7 matrix, 9 key-value, 10-13 tree, 15 table,
 *     anything else no construct.</li>
 * </ol>
 */
public class ConstructClassifier {

    private final Adjacency adjacency;
    private final ClassificationListener listener;

    public ConstructClassifier() {
        this(Adjacency.ORTHOGONAL, ClassificationListener.NONE);
    }

    public ConstructClassifier(Adjacency adjacency) {
        this(adjacency, ClassificationListener.NONE);
    }

    public ConstructClassifier(Adjacency adjacency, ClassificationListener listener) {
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Classifies the cluster, returning empty when its signature does not denote a construct.
     *
     * @throws MalformedClusterException when the cluster's bounds disagree with its points, the points are not
     *                                   connected, or a point is not filled on the surface
     */
    public Optional<Classification> classify(CellCluster cluster, GridSurface surface) {
        Objects.requireNonNull(cluster, "cluster");
        Objects.requireNonNull(surface, "surface");
        cluster.verifyWellFormed(adjacency);
        for (CellPosition point : cluster.points()) {
            if (!surface.isFilled(point)) {
                throw new MalformedClusterException("Cluster " + cluster.bounds() + " lists " + point
                        + " but the cell is empty on the surface");
            }
        }
        Signature signature = computeSignature(cluster);
        Optional<Classification> classification = lookup(signature);
        listener.onClassified(cluster, signature, classification);
        return classification;
    }

    /**
     * Computes the signature of a well-formed cluster.
     */
    public Signature computeSignature(CellCluster cluster) {
        if (cluster.size() == 1) {
            return Signature.SINGLE_CELL;
        }
        if (cluster.isSingleColumn() && cluster.bounds().height() >= 2
                && cluster.hasPointAt(1, 1) && cluster.hasPointAt(2, 1)) {
            return Signature.VERTICAL_LIST;
        }
        if (cluster.isSingleRow() && cluster.bounds().width() >= 2
                && cluster.hasPointAt(1, 1) && cluster.hasPointAt(1, 2)) {
            return Signature.HORIZONTAL_LIST;
        }
        return Signature.binary(
                cluster.hasPointAt(1, 1),
                cluster.hasPointAt(1, 2),
                cluster.hasPointAt(2, 1),
                cluster.hasPointAt(2, 2));
    }

    /**
     * The lookup table from signature to construct; pure and independent of any cluster.
     */
    public static Optional<Classification> lookup(Signature signature) {
        Objects.requireNonNull(signature, "signature");
        return switch (signature.kind()) {
            case SINGLE_CELL -> Optional.empty();
            case VERTICAL_LIST -> Optional.of(Classification.oriented(ConstructType.LIST, Orientation.VERTICAL, signature));
            case HORIZONTAL_LIST -> Optional.of(Classification.oriented(ConstructType.LIST, Orientation.HORIZONTAL, signature));
            case BINARY -> lookupBinary(signature);
        };
    }

    private static Optional<Classification> lookupBinary(Signature signature) {
        return switch (signature.key()) {
            case 7 -> Optional.of(Classification.of(ConstructType.MATRIX, signature));
            case 9 -> Optional.of(Classification.oriented(ConstructType.KEY_VALUE, Orientation.VERTICAL, signature));
            case 10 -> Optional.of(Classification.tree(Orientation.VERTICAL, false, signature));
            case 11 -> Optional.of(Classification.tree(Orientation.VERTICAL, true, signature));
            case 12 -> Optional.of(Classification.tree(Orientation.HORIZONTAL, false, signature));
            case 13 -> Optional.of(Classification.tree(Orientation.HORIZONTAL, true, signature));
            case 15 -> Optional.of(Classification.of(ConstructType.TABLE, signature));
            // 0-5 reserved, 6 corner marker, 8 lone corner cell, 14 root marker
            default -> Optional.empty();
        };
    }
}
