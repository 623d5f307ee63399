package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds trees from indented clusters.
 *
 * <p>An element's level is the larger of its spatial offset from the cluster's leading edge and its
 * leading whitespace divided by the indent width. Elements are visited column-by-column within each
 * row for vertical trees and row-by-row within each column for horizontal ones, and linked to the
 * nearest preceding element with a smaller level.
 */
public class TreeBuilder {

    public static final int DEFAULT_INDENT_WIDTH = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);

    private final int indentWidth;

    public TreeBuilder() {
        this(DEFAULT_INDENT_WIDTH);
    }

    public TreeBuilder(int indentWidth) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive");
        }
        this.indentWidth = indentWidth;
    }

    public TreeConstruct build(CellCluster cluster, GridSurface surface, Classification classification) {
        Orientation orientation = classification.orientationOrDefault();
        List<CellPosition> ordered = new ArrayList<>(cluster.points());
        ordered.sort(orientation.isTransposed() ? CellPosition.COLUMN_ORDER : CellPosition.READING_ORDER);

        List<Draft> drafts = new ArrayList<>();
        CellPosition origin = cluster.bounds().topLeft();
        for (CellPosition position : ordered) {
            String raw = surface.getCellContent(position);
            int spatial = orientation.isTransposed()
                    ? position.row() - cluster.topRow()
                    : position.col() - cluster.leftCol();
            int level = Math.max(spatial, leadingWhitespace(raw) / indentWidth);
            ElementRole role;
            if (position.equals(origin)) {
                role = ElementRole.ANCHOR;
            } else if (level <= 1) {
                role = ElementRole.PARENT;
            } else {
                role = ElementRole.CHILD;
            }
            drafts.add(new Draft(drafts.size(), position, raw, level, role));
        }

        link(drafts);

        List<TreeElement> elements = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            elements.add(draft.freeze());
        }
        LOGGER.debug("Built {} tree at {} with {} elements", orientation.name().toLowerCase(),
                cluster.bounds(), elements.size());
        return new TreeConstruct(Construct.idFor(ConstructType.TREE, cluster.bounds()), cluster.bounds(),
                classification.signature(), classification.confidence(), orientation,
                classification.hasChildHeader(), elements, Map.of());
    }

    private void link(List<Draft> drafts) {
        Deque<Draft> stack = new ArrayDeque<>();
        for (Draft draft : drafts) {
            while (!stack.isEmpty() && stack.peek().level >= draft.level) {
                stack.pop();
            }
            if (!stack.isEmpty()) {
                Draft parent = stack.peek();
                draft.parentIndex = parent.index;
                parent.children.add(draft.index);
                if (parent.role == ElementRole.CHILD) {
                    parent.role = ElementRole.PARENT;
                }
            }
            stack.push(draft);
        }
        for (Draft draft : drafts) {
            if (draft.role != ElementRole.ANCHOR && draft.children.isEmpty()) {
                draft.role = ElementRole.LEAF;
            }
        }
    }

    static int leadingWhitespace(String raw) {
        int count = 0;
        while (count < raw.length() && Character.isWhitespace(raw.charAt(count))) {
            count++;
        }
        return count;
    }

    private static final class Draft {
        private final int index;
        private final CellPosition position;
        private final String raw;
        private final int level;
        private ElementRole role;
        private int parentIndex = -1;
        private final List<Integer> children = new ArrayList<>();

        private Draft(int index, CellPosition position, String raw, int level, ElementRole role) {
            this.index = index;
            this.position = position;
            this.raw = raw;
            this.level = level;
            this.role = role;
        }

        private TreeElement freeze() {
            return new TreeElement(index, position, raw, raw.trim(), level, role,
                    parentIndex < 0 ? OptionalInt.empty() : OptionalInt.of(parentIndex), children);
        }
    }
}
