package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.CellRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hierarchy of elements stored as an index-addressed arena. Parent and child links are indices into
 * {@link #elements()}.
 *
 * <p>Domains are keyed by the index of the owning parent element. A freshly built tree carries no
 * domains; {@link #withDomains(Map)} returns the resolved copy.
 */
public record TreeConstruct(String id,
                            CellRange bounds,
                            Signature signature,
                            double confidence,
                            Orientation orientation,
                            boolean hasChildHeader,
                            List<TreeElement> elements,
                            Map<Integer, DomainRegion> domains) implements Construct {

    public TreeConstruct {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(orientation, "orientation");
        elements = List.copyOf(elements);
        domains = domains == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(domains));
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).index() != i) {
                throw new IllegalArgumentException("element at " + i + " carries index " + elements.get(i).index());
            }
        }
    }

    @Override
    public ConstructType type() {
        return ConstructType.TREE;
    }

    @Override
    public List<RoleCell> cells() {
        return elements.stream().map(TreeElement::toRoleCell).toList();
    }

    @Override
    public <R> R accept(ConstructVisitor<R> visitor) {
        return visitor.visitTree(this);
    }

    public TreeConstruct withDomains(Map<Integer, DomainRegion> resolved) {
        return new TreeConstruct(id, bounds, signature, confidence, orientation, hasChildHeader, elements, resolved);
    }

    public TreeElement element(int index) {
        return elements.get(index);
    }

    public Optional<TreeElement> anchor() {
        return elements.stream().filter(element -> element.role() == ElementRole.ANCHOR).findFirst();
    }

    public Optional<TreeElement> elementAt(CellPosition position) {
        return elements.stream().filter(element -> element.position().equals(position)).findFirst();
    }

    public List<TreeElement> roots() {
        return elements.stream().filter(TreeElement::isRoot).toList();
    }

    public List<TreeElement> parents() {
        return elements.stream().filter(TreeElement::hasChildren).toList();
    }

    public List<TreeElement> leaves() {
        return elements.stream().filter(element -> !element.hasChildren()).toList();
    }

    public List<TreeElement> children(TreeElement element) {
        return element.childIndices().stream().map(elements::get).toList();
    }

    public Optional<TreeElement> parent(TreeElement element) {
        return element.parentIndex().isPresent()
                ? Optional.of(elements.get(element.parentIndex().getAsInt()))
                : Optional.empty();
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<TreeElement> ancestors(TreeElement element) {
        List<TreeElement> ancestors = new ArrayList<>();
        Optional<TreeElement> current = parent(element);
        while (current.isPresent()) {
            ancestors.add(current.get());
            current = parent(current.get());
        }
        return ancestors;
    }

    /**
     * Elements from the root down to and including the given element.
     */
    public List<TreeElement> path(TreeElement element) {
        List<TreeElement> path = new ArrayList<>(ancestors(element));
        Collections.reverse(path);
        path.add(element);
        return path;
    }

    /**
     * All descendants in depth-first pre-order.
     */
    public List<TreeElement> descendants(TreeElement element) {
        List<TreeElement> result = new ArrayList<>();
        Deque<TreeElement> stack = new ArrayDeque<>();
        List<TreeElement> direct = children(element);
        for (int i = direct.size() - 1; i >= 0; i--) {
            stack.push(direct.get(i));
        }
        while (!stack.isEmpty()) {
            TreeElement current = stack.pop();
            result.add(current);
            List<TreeElement> next = children(current);
            for (int i = next.size() - 1; i >= 0; i--) {
                stack.push(next.get(i));
            }
        }
        return result;
    }

    public List<TreeElement> siblings(TreeElement element) {
        List<TreeElement> candidates = parent(element).map(this::children).orElseGet(this::roots);
        return candidates.stream().filter(candidate -> candidate.index() != element.index()).toList();
    }

    public List<TreeElement> elementsAtLevel(int level) {
        return elements.stream().filter(element -> element.level() == level).toList();
    }

    public int maxLevel() {
        return elements.stream().mapToInt(TreeElement::level).max().orElse(0);
    }

    /**
     * Number of edges on the longest path from any root to a leaf.
     */
    public int maxDepth() {
        return roots().stream().mapToInt(this::height).max().orElse(0);
    }

    /**
     * Number of edges on the longest path from the element down to a leaf.
     */
    public int height(TreeElement element) {
        int height = 0;
        for (TreeElement child : children(element)) {
            height = Math.max(height, height(child) + 1);
        }
        return height;
    }

    public Optional<DomainRegion> domainOf(TreeElement element) {
        return Optional.ofNullable(domains.get(element.index()));
    }

    public List<Construct> nestedConstructs() {
        return domains.values().stream()
                .map(DomainRegion::nestedConstruct)
                .flatMap(Optional::stream)
                .toList();
    }
}
