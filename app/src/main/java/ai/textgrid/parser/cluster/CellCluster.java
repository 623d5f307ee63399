package ai.textgrid.parser.cluster;

import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.CellRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A connected group of filled cells together with its bounding rectangle.
 *
 * <p>The constructor does not check the invariants so that callers bypassing {@link ClusterFinder} can be
 * detected later; {@link #verifyWellFormed(Adjacency)} performs the check.
 */
public final class CellCluster {

    private final CellRange bounds;
    private final List<CellPosition> points;
    private final Set<CellPosition> pointSet;

    public CellCluster(CellRange bounds, Collection<CellPosition> points) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(points, "points");
        List<CellPosition> ordered = new ArrayList<>(new HashSet<>(points));
        ordered.sort(CellPosition.READING_ORDER);
        this.points = List.copyOf(ordered);
        this.pointSet = Set.copyOf(ordered);
    }

    /**
     * Creates a cluster whose bounds are the tight box around the points.
     */
    public static CellCluster of(Collection<CellPosition> points) {
        return new CellCluster(CellRange.enclosing(points), points);
    }

    public CellRange bounds() {
        return bounds;
    }

    public int topRow() {
        return bounds.topRow();
    }

    public int bottomRow() {
        return bounds.bottomRow();
    }

    public int leftCol() {
        return bounds.leftCol();
    }

    public int rightCol() {
        return bounds.rightCol();
    }

    /**
     * Filled points in reading order.
     */
    public List<CellPosition> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean contains(CellPosition position) {
        return pointSet.contains(position);
    }

    /**
     * Whether the cell at the given offset from the cluster's top-left corner belongs to the cluster.
     * Offsets are 1-based, so {@code hasPointAt(1, 1)} tests the corner itself.
     */
    public boolean hasPointAt(int localRow, int localCol) {
        int row = bounds.topRow() + localRow - 1;
        int col = bounds.leftCol() + localCol - 1;
        return row >= 1 && col >= 1 && pointSet.contains(new CellPosition(row, col));
    }

    public boolean isSingleColumn() {
        return bounds.width() == 1;
    }

    public boolean isSingleRow() {
        return bounds.height() == 1;
    }

    /**
     * Cells inside the bounding box that are not part of the cluster.
     */
    public List<CellPosition> emptyPositions() {
        List<CellPosition> empty = new ArrayList<>();
        for (int row = bounds.topRow(); row <= bounds.bottomRow(); row++) {
            for (int col = bounds.leftCol(); col <= bounds.rightCol(); col++) {
                CellPosition position = new CellPosition(row, col);
                if (!pointSet.contains(position)) {
                    empty.add(position);
                }
            }
        }
        return empty;
    }

    public boolean isConnected(Adjacency adjacency) {
        if (points.isEmpty()) {
            return false;
        }
        Set<CellPosition> visited = new HashSet<>();
        Deque<CellPosition> stack = new ArrayDeque<>();
        stack.push(points.get(0));
        while (!stack.isEmpty()) {
            CellPosition current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (CellPosition neighbour : adjacency.neighbours(current)) {
                if (pointSet.contains(neighbour) && !visited.contains(neighbour)) {
                    stack.push(neighbour);
                }
            }
        }
        return visited.size() == points.size();
    }

    /**
     * Fails fast when the bounds do not match the points or the points are not connected.
     */
    public void verifyWellFormed(Adjacency adjacency) {
        if (points.isEmpty()) {
            throw new MalformedClusterException("Cluster " + bounds + " has no filled points");
        }
        CellRange tight = CellRange.enclosing(points);
        if (!tight.equals(bounds)) {
            throw new MalformedClusterException("Cluster bounds " + bounds + " do not match its points, expected " + tight);
        }
        if (!isConnected(adjacency)) {
            throw new MalformedClusterException("Cluster " + bounds + " is not connected under "
                    + adjacency.name().toLowerCase() + " adjacency");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CellCluster that)) {
            return false;
        }
        return bounds.equals(that.bounds) && pointSet.equals(that.pointSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bounds, pointSet);
    }

    @Override
    public String toString() {
        return "CellCluster[" + bounds + ", " + points.size() + " cells]";
    }
}
