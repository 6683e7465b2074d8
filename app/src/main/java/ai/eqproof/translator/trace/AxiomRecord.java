package ai.eqproof.translator.trace;

import java.util.Objects;

/**
 * Inline {@code Axiom N (name): expr.} declaration found in the transcript.
 */
public record AxiomRecord(String name, String expression, int lineNumber) {

    public AxiomRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }
}
