package ai.textgrid.parser.config;

import java.util.Optional;

/**
 * Source of the {@code TEXTGRID_*} and {@code LOG_FORMAT} settings; tests pass a map-backed reader instead of the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    /**
     * Value of {@code key}, empty when unset.
     */
    Optional<String> get(String key);
}
