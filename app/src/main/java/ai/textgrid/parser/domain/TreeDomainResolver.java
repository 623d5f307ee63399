package ai.textgrid.parser.domain;

import ai.textgrid.parser.construct.Construct;
import ai.textgrid.parser.construct.DomainRegion;
import ai.textgrid.parser.construct.DomainStatus;
import ai.textgrid.parser.construct.TreeConstruct;
import ai.textgrid.parser.construct.TreeElement;
import ai.textgrid.parser.surface.CellRange;
import ai.textgrid.parser.surface.GridSurface;
import ai.textgrid.parser.surface.RegionSurface;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the rectangle each tree parent owns and parses it for a nested construct.
 *
 * <p>A domain starts just past its parent along the tree's main axis and ends at the furthest
 * descendant. Across the main axis it spans the descendants' columns (vertical) or rows (horizontal),
 * never including the parent's own column or row. It also stops short of the next element at the
 * parent's level or above, so sibling domains never overlap.
 */
public class TreeDomainResolver {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 32;
    public static final int DEFAULT_NESTED_MIN_CELLS = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeDomainResolver.class);

    private final int maxNestingDepth;
    private final int nestedMinCells;

    public TreeDomainResolver() {
        this(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_NESTED_MIN_CELLS);
    }

    public TreeDomainResolver(int maxNestingDepth, int nestedMinCells) {
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must not be negative");
        }
        if (nestedMinCells < 1) {
            throw new IllegalArgumentException("nestedMinCells must be positive");
        }
        this.maxNestingDepth = maxNestingDepth;
        this.nestedMinCells = nestedMinCells;
    }

    /**
     * Returns a copy of the tree with a domain for every element that owns children.
     *
     * @param depth nesting depth of {@code tree} itself; top-level trees are at depth 0
     */
    public TreeConstruct resolve(TreeConstruct tree, GridSurface surface, int depth, NestedRegionParser parser) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(parser, "parser");
        Map<Integer, DomainRegion> domains = new LinkedHashMap<>();
        for (TreeElement parent : tree.parents()) {
            domains.put(parent.index(), resolveDomain(tree, parent, surface, depth, parser));
        }
        return tree.withDomains(domains);
    }

    /**
     * Rectangle owned by {@code parent}, or empty when clipping leaves nothing.
     */
    public Optional<CellRange> domainRange(TreeConstruct tree, TreeElement parent) {
        List<TreeElement> descendants = tree.descendants(parent);
        if (descendants.isEmpty()) {
            return Optional.empty();
        }
        Optional<TreeElement> boundary = boundaryOf(tree, parent);
        int minRow = Integer.MAX_VALUE;
        int maxRow = Integer.MIN_VALUE;
        int minCol = Integer.MAX_VALUE;
        int maxCol = Integer.MIN_VALUE;
        for (TreeElement element : descendants) {
            minRow = Math.min(minRow, element.position().row());
            maxRow = Math.max(maxRow, element.position().row());
            minCol = Math.min(minCol, element.position().col());
            maxCol = Math.max(maxCol, element.position().col());
        }
        int parentRow = parent.position().row();
        int parentCol = parent.position().col();
        if (tree.orientation().isTransposed()) {
            int rightCol = boundary.isPresent()
                    ? Math.min(maxCol, boundary.get().position().col() - 1)
                    : maxCol;
            return CellRange.clipped(Math.max(minRow, parentRow + 1), maxRow, parentCol + 1, rightCol);
        }
        int bottomRow = boundary.isPresent()
                ? Math.min(maxRow, boundary.get().position().row() - 1)
                : maxRow;
        return CellRange.clipped(parentRow + 1, bottomRow, Math.max(minCol, parentCol + 1), maxCol);
    }

    private DomainRegion resolveDomain(TreeConstruct tree,
                                       TreeElement parent,
                                       GridSurface surface,
                                       int depth,
                                       NestedRegionParser parser) {
        Optional<CellRange> range = domainRange(tree, parent);
        if (range.isEmpty()) {
            return DomainRegion.empty(parent.index());
        }
        RegionSurface region = new RegionSurface(surface, range.get());
        int filled = region.filledPositions().size();
        if (filled == 0) {
            return DomainRegion.of(parent.index(), range.get(), 0, DomainStatus.EMPTY);
        }
        if (filled < nestedMinCells) {
            return DomainRegion.of(parent.index(), range.get(), filled, DomainStatus.TOO_SMALL);
        }
        if (depth + 1 > maxNestingDepth) {
            LOGGER.warn("Nesting depth limit {} reached at domain {} of '{}'",
                    maxNestingDepth, range.get(), parent.content());
            return DomainRegion.of(parent.index(), range.get(), filled, DomainStatus.DEPTH_LIMIT_EXCEEDED);
        }
        Optional<Construct> nested = parser.parseRegion(region, depth + 1);
        if (nested.isEmpty()) {
            return DomainRegion.of(parent.index(), range.get(), filled, DomainStatus.NO_CONSTRUCT);
        }
        LOGGER.debug("Domain {} of '{}' holds nested {}", range.get(), parent.content(), nested.get().id());
        return DomainRegion.nested(parent.index(), range.get(), filled, nested.get());
    }

    private static Optional<TreeElement> boundaryOf(TreeConstruct tree, TreeElement parent) {
        List<TreeElement> elements = tree.elements();
        for (int i = parent.index() + 1; i < elements.size(); i++) {
            if (elements.get(i).level() <= parent.level()) {
                return Optional.of(elements.get(i));
            }
        }
        return Optional.empty();
    }
}
