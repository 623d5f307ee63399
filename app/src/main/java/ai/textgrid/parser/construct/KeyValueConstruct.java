package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Block header followed by keys, each paired with the values aligned to it.
 */
public record KeyValueConstruct(String id,
                                CellRange bounds,
                                Signature signature,
                                double confidence,
                                Orientation orientation,
                                List<RoleCell> cells,
                                Optional<RoleCell> mainHeader,
                                List<KeyValuePair> pairs) implements Construct {

    public KeyValueConstruct {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(orientation, "orientation");
        cells = List.copyOf(cells);
        mainHeader = mainHeader == null ? Optional.empty() : mainHeader;
        pairs = List.copyOf(pairs);
    }

    @Override
    public ConstructType type() {
        return ConstructType.KEY_VALUE;
    }

    @Override
    public <R> R accept(ConstructVisitor<R> visitor) {
        return visitor.visitKeyValue(this);
    }

    public List<String> keys() {
        return pairs.stream().map(KeyValuePair::keyText).toList();
    }

    public Optional<KeyValuePair> pair(String key) {
        return pairs.stream().filter(pair -> pair.keyText().equals(key)).findFirst();
    }

    public List<String> valuesFor(String key) {
        return pair(key).map(KeyValuePair::valueTexts).orElse(List.of());
    }
}
