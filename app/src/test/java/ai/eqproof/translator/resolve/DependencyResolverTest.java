package ai.eqproof.translator.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.entry;

import ai.eqproof.translator.trace.LemmaRecord;
import ai.eqproof.translator.trace.TranscriptSegmenter;
import ai.eqproof.translator.trace.TranslationContext;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {

    private static final String TRANSCRIPT = String.join("\n",
            "fof(a1, axiom, op(X, op(Y, X)) = X).",
            "fof(conjecture0, conjecture, op(X, Y) = op(Y, X)).",
            "% single_lemma_0001: op(X, X) = X | deps: a1->op(X0, X0)",
            "The conjecture is true! Here is a proof.",
            "Axiom 1 (a1): op(X, op(Y, X)) = X.",
            "Axiom 2 (single_lemma_0009): op(X, Y) = op(X, op(Y, Y)).",
            "Axiom 3 (single_lemma_0001): op(X, X) = X.",
            "Axiom 4 (history_lemma_0003): op(op(X, Y), Y) = X.",
            "Lemma 5: op(X, op(X, X)) = X.",
            "Proof:",
            "  op(X, op(X, X))",
            "= { by axiom 3 (single_lemma_0001) }",
            "  op(X, X)",
            "= { by axiom 4 (history_lemma_0003) }",
            "  X",
            "Goal 1 (conjecture0): op(a, b) = op(b, a).",
            "Proof:",
            "  op(a, b)",
            "= { by axiom 2 (single_lemma_0009) }",
            "  op(a, op(b, b))",
            "= { by lemma 5 }",
            "  op(b, a)",
            "RESULT: Theorem");

    private final DependencyResolver resolver = new DependencyResolver();

    @Test
    void renumbersLemmasInDiscoveryOrderAndKeepsConjectureName() {
        TranslationContext context = new TranscriptSegmenter().segment(TRANSCRIPT);

        resolver.resolve(context);

        assertThat(context.lemmas())
                .extracting(LemmaRecord::canonicalName)
                .containsExactly("lemma_1", "lemma_2", "conjecture0");
        assertThat(context.lemmaNames()).containsExactly(
                entry("single_lemma_0001", "lemma_1"),
                entry("Lemma_5", "lemma_2"),
                entry("conjecture0", "conjecture0"));
    }

    @Test
    void retainsOnlyUsedAxiomsThatAreNotLemmas() {
        TranslationContext context = new TranscriptSegmenter().segment(TRANSCRIPT);

        resolver.resolve(context);

        assertThat(context.retainedAxiomNames()).containsExactly(
                entry("history_lemma_0003", "axiom1"),
                entry("single_lemma_0009", "axiom2"));
    }

    @Test
    void rewritesEveryDependencyToDeclaredName() {
        TranslationContext context = new TranscriptSegmenter().segment(TRANSCRIPT);

        resolver.resolve(context);

        assertThat(context.lemma("single_lemma_0001").orElseThrow().resolvedDependencies()).containsExactly("op_law");
        assertThat(context.lemma("Lemma_5").orElseThrow().resolvedDependencies())
                .containsExactly("axiom1", "lemma_1");
        assertThat(context.lemma("conjecture0").orElseThrow().resolvedDependencies())
                .containsExactly("lemma_2", "axiom2");
        for (LemmaRecord lemma : context.lemmas()) {
            assertThat(lemma.resolvedDependencies())
                    .allSatisfy(name -> assertThat(name).matches("op_law|axiom\\d+|lemma_\\d+|conjecture0"));
        }
    }

    @Test
    void renumberingIsStableAcrossRuns() {
        TranslationContext first = new TranscriptSegmenter().segment(TRANSCRIPT);
        TranslationContext second = new TranscriptSegmenter().segment(TRANSCRIPT);

        resolver.resolve(first);
        resolver.resolve(second);

        assertThat(first.lemmaNames()).isEqualTo(second.lemmaNames());
        assertThat(first.retainedAxiomNames()).isEqualTo(second.retainedAxiomNames());
    }

    @Test
    void unknownLemmaReferenceFails() {
        TranslationContext context = new TranscriptSegmenter().segment(String.join("\n",
                "The conjecture is true! Here is a proof.",
                "Goal 1 (conjecture0): op(a, b) = a.",
                "Proof:",
                "  op(a, b)",
                "= { by lemma 42 }",
                "  a",
                "RESULT: Theorem"));

        Throwable thrown = catchThrowable(() -> resolver.resolve(context));

        assertThat(thrown).isInstanceOf(MissingDependencyException.class).hasMessageContaining("Lemma_42");
        assertThat(((MissingDependencyException) thrown).referrer()).isEqualTo("conjecture0");
        assertThat(((MissingDependencyException) thrown).lineNumber()).isEqualTo(5);
    }

    @Test
    void unknownDeclaredDependencyReportsDeclarationLine() {
        TranslationContext context = new TranscriptSegmenter().segment(String.join("\n",
                "fof(a1, axiom, op(X, Y) = X).",
                "% single_lemma_0001: op(X, X) = X | deps: a1->op(X, Y)",
                "% single_lemma_0002: op(Y, Y) = Y | deps: single_lemma_0099->op(X, X)",
                "The conjecture is true! Here is a proof."));

        Throwable thrown = catchThrowable(() -> resolver.resolve(context));

        assertThat(thrown).isInstanceOf(MissingDependencyException.class);
        assertThat(((MissingDependencyException) thrown).token()).isEqualTo("single_lemma_0099");
        assertThat(((MissingDependencyException) thrown).lineNumber()).isEqualTo(3);
    }

    @Test
    void usedReferenceWithoutInlineAxiomFails() {
        TranslationContext context = new TranscriptSegmenter().segment(String.join("\n",
                "The conjecture is true! Here is a proof.",
                "Goal 1 (conjecture0): op(a, b) = a.",
                "Proof:",
                "  op(a, b)",
                "= { by axiom 7 (single_lemma_0007) }",
                "  a",
                "RESULT: Theorem"));

        Throwable thrown = catchThrowable(() -> resolver.resolve(context));

        assertThat(thrown).isInstanceOf(MissingDependencyException.class);
        MissingDependencyException missing = (MissingDependencyException) thrown;
        assertThat(missing.token()).isEqualTo("single_lemma_0007");
        assertThat(missing.lineNumber()).isEqualTo(5);
    }
}
