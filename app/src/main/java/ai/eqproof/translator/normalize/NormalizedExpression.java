package ai.eqproof.translator.normalize;

import java.util.List;
import java.util.Objects;

/**
 * Expression text after canonical renaming, with the canonical names in binding order.
 */
public record NormalizedExpression(String text, List<String> canonicalNames) {

    public NormalizedExpression {
        Objects.requireNonNull(text, "text");
        canonicalNames = List.copyOf(Objects.requireNonNull(canonicalNames, "canonicalNames"));
    }
}
