package ai.eqproof.translator.term;

import ai.eqproof.translator.translate.TranslationException;

/**
 * Raised when term or expression text does not follow the {@code op(...)} grammar.
 */
public class TermParseException extends TranslationException {

    private final int position;
    private final String reason;

    public TermParseException(int position, String reason, String text) {
        super(reason + " at position " + position + " in: " + text);
        this.position = position;
        this.reason = reason;
    }

    public TermParseException(String context, TermParseException cause) {
        super(context + ": " + cause.getMessage(), cause);
        this.position = cause.position;
        this.reason = cause.reason;
    }

    public int position() {
        return position;
    }

    public String reason() {
        return reason;
    }
}
