package ai.eqproof.translator.translate;

/**
 * Base of every failure that stops a transcript from becoming a Lean document.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
