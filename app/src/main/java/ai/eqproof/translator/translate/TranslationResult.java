package ai.eqproof.translator.translate;

import java.util.Objects;

/**
 * Rendered Lean document together with a short summary of what it contains. {@code lemmaCount}
 * counts intermediate lemmas only, not the conjecture.
 */
public record TranslationResult(String document,
                                String theoremName,
                                int lemmaCount,
                                int retainedAxiomCount) {

    public TranslationResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(theoremName, "theoremName");
    }
}
