package ai.eqproof.translator.term;

import java.util.Objects;

/**
 * Result of parsing one term: the tree and the offset right after it.
 */
public record ParsedTerm(Term term, int nextOffset) {

    public ParsedTerm {
        Objects.requireNonNull(term, "term");
    }
}
