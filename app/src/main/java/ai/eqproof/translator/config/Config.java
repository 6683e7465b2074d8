package ai.eqproof.translator.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path transcript,
        Path outputDirectory,
        String tactic,
        boolean dryRun,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(transcript, "transcript");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        tactic = requireNonBlank(tactic, "tactic");
        if (!tactic.matches("[A-Za-z_][\\w.]*")) {
            throw new IllegalArgumentException("tactic must be a plain Lean identifier: " + tactic);
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
