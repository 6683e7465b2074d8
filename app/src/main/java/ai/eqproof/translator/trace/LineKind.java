package ai.eqproof.translator.trace;

/**
 * Classification of a transcript line, deciding which effect the segmenter applies.
 */
public enum LineKind {
    AXIOM,
    PROOF_MARKER,
    LEMMA_DECLARATION,
    BLOCK_HEADER,
    PROOF_LINE,
    TERMINATOR,
    FORMULA,
    FORMULA_START,
    FORMULA_PART,
    FORMULA_END,
    IGNORED
}
