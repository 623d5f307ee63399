package ai.textgrid.parser.construct;

import java.util.List;
import java.util.Objects;

/**
 * A key cell and every value cell aligned with it.
 */
public record KeyValuePair(RoleCell key, List<RoleCell> values) {

    public KeyValuePair {
        Objects.requireNonNull(key, "key");
        values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    public String keyText() {
        return key.content();
    }

    public List<String> valueTexts() {
        return values.stream().map(RoleCell::content).toList();
    }
}
