package ai.eqproof.translator.trace;

import ai.eqproof.translator.translate.TranslationException;
import java.util.Locale;

/**
 * Raised when the transcript declares no hypothesis ({@code fof(..., axiom, ...)}) or no conjecture.
 */
public class MissingTopLevelRecordException extends TranslationException {

    private final FormulaRole role;

    public MissingTopLevelRecordException(FormulaRole role) {
        super("Missing " + role.name().toLowerCase(Locale.ROOT) + " declaration in transcript");
        this.role = role;
    }

    public FormulaRole role() {
        return role;
    }
}
