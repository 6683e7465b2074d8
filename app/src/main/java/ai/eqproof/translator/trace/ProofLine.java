package ai.eqproof.translator.trace;

import java.util.Objects;

public record ProofLine(int lineNumber, String text) {

    public ProofLine {
        Objects.requireNonNull(text, "text");
    }
}
