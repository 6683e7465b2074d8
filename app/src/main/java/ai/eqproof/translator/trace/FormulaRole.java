package ai.eqproof.translator.trace;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles of top-level {@code fof} declarations that the translator consumes.
 */
public enum FormulaRole {
    AXIOM,
    CONJECTURE;

    public static Optional<FormulaRole> from(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (FormulaRole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
