package ai.eqproof.translator.term;

import java.util.Objects;

/**
 * Leaf of a term, keeping the identifier exactly as spelled in the source.
 */
public record Variable(String name) implements Term {

    public Variable {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    @Override
    public int depth() {
        return 0;
    }
}
