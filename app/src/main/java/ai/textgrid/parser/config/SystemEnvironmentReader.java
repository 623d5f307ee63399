package ai.textgrid.parser.config;

import java.util.Optional;

/**
 * Reads settings from process environment variables.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
