package ai.eqproof.translator.term;

import java.util.Objects;

/**
 * Application of the operator to two sub-terms, written {@code op(left, right)} in TPTP.
 */
public record Application(Term left, Term right) implements Term {

    public Application {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public int depth() {
        return 1 + Math.max(left.depth(), right.depth());
    }
}
