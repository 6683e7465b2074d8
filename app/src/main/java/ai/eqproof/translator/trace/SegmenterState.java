package ai.eqproof.translator.trace;

/**
 * States of the line-driven transcript scanner.
 */
public enum SegmenterState {
    SCANNING_HEADER,
    ACCUMULATING_FORMULA,
    IN_PROOF_SECTION,
    ACCUMULATING_GOAL
}
