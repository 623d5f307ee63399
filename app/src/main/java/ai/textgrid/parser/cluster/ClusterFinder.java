package ai.textgrid.parser.cluster;

import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups the filled cells of a surface into maximal connected clusters.
 */
public class ClusterFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterFinder.class);

    private final Adjacency adjacency;

    public ClusterFinder() {
        this(Adjacency.ORTHOGONAL);
    }

    public ClusterFinder(Adjacency adjacency) {
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
    }

    public Adjacency adjacency() {
        return adjacency;
    }

    /**
     * Returns disjoint clusters covering every filled cell, ordered by their first cell in reading order.
     */
    public List<CellCluster> findClusters(GridSurface surface) {
        Objects.requireNonNull(surface, "surface");
        Set<CellPosition> filled = new LinkedHashSet<>(surface.filledPositions());
        if (filled.isEmpty()) {
            return List.of();
        }
        Set<CellPosition> visited = new HashSet<>();
        List<CellCluster> clusters = new ArrayList<>();
        for (CellPosition seed : filled) {
            if (visited.contains(seed)) {
                continue;
            }
            clusters.add(CellCluster.of(floodFill(seed, filled, visited)));
        }
        LOGGER.debug("Found {} clusters among {} filled cells using {} adjacency",
                clusters.size(), filled.size(), adjacency);
        return clusters;
    }

    private List<CellPosition> floodFill(CellPosition seed, Set<CellPosition> filled, Set<CellPosition> visited) {
        List<CellPosition> component = new ArrayList<>();
        Deque<CellPosition> stack = new ArrayDeque<>();
        stack.push(seed);
        while (!stack.isEmpty()) {
            CellPosition current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            component.add(current);
            for (CellPosition neighbour : adjacency.neighbours(current)) {
                if (filled.contains(neighbour) && !visited.contains(neighbour)) {
                    stack.push(neighbour);
                }
            }
        }
        return component;
    }
}
