package ai.eqproof.translator.term;

/**
 * Binary tree over the single magma operator.
 */
public interface Term {

    int depth();
}
