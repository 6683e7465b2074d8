package ai.eqproof.translator.resolve;

import ai.eqproof.translator.translate.TranslationException;

/**
 * Raised when a dependency token names neither a lemma, a retained axiom nor the hypothesis.
 */
public class MissingDependencyException extends TranslationException {

    private final String token;
    private final String referrer;
    private final int lineNumber;

    public MissingDependencyException(String token, String referrer, int lineNumber) {
        super("Unresolved dependency '" + token + "' referenced by " + referrer + " (line " + lineNumber + ")");
        this.token = token;
        this.referrer = referrer;
        this.lineNumber = lineNumber;
    }

    public String token() {
        return token;
    }

    public String referrer() {
        return referrer;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
