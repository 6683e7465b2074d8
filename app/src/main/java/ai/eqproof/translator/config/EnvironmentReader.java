package ai.eqproof.translator.config;

import java.util.Optional;

/**
 * Source of environment values consulted when a CLI option is absent.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}, empty when unset or blank.
     */
    default Optional<String> nonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
