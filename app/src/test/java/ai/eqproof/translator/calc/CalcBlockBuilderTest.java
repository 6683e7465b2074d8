package ai.eqproof.translator.calc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.eqproof.translator.normalize.VariableNormalizer;
import ai.eqproof.translator.normalize.VariableScope;
import ai.eqproof.translator.resolve.DependencyResolver;
import ai.eqproof.translator.resolve.MissingDependencyException;
import ai.eqproof.translator.term.TermParseException;
import ai.eqproof.translator.term.TermParser;
import ai.eqproof.translator.term.TermRenderer;
import ai.eqproof.translator.trace.LemmaRecord;
import ai.eqproof.translator.trace.ProofBlock;
import ai.eqproof.translator.trace.TranscriptSegmenter;
import ai.eqproof.translator.trace.TranslationContext;
import java.util.List;
import org.junit.jupiter.api.Test;

class CalcBlockBuilderTest {

    private final DependencyResolver resolver = new DependencyResolver();
    private final CalcBlockBuilder builder = new CalcBlockBuilder(new TermParser(), new TermRenderer(), resolver);
    private final VariableNormalizer normalizer = new VariableNormalizer();

    @Test
    void buildsOneStepPerJustificationLine() {
        TranslationContext context = resolvedContext(
                "Axiom 3 (single_lemma_0002): op(X, X) = X.",
                "Lemma 4: op(Y, X) = op(X, Y).",
                "Proof:",
                "  op(a, b)",
                "= { by axiom 1 (a1) }",
                "  op(X, op(a, b))",
                "Goal 1 (conjecture0): op(b, a) = op(a, b).",
                "Proof:",
                "  op(b, a)",
                "= { by lemma 4 }",
                "  op(a, op(b, a))",
                "= { by axiom 3 (single_lemma_0002) R->L }",
                "  op(a, b)");
        LemmaRecord goal = context.lemma("conjecture0").orElseThrow();
        VariableScope scope = normalizer.scopeOf(goal.expression());

        List<CalcStep> steps = builder.build(goal.proofBlock().orElseThrow(), scope, context, goal.canonicalName());

        assertThat(steps)
                .extracting(CalcStep::lhs, CalcStep::rhs, CalcStep::dependency)
                .containsExactly(
                        tuple("(x1 ◇ x0)", "(x0 ◇ (x1 ◇ x0))", "lemma_1"),
                        tuple("(x0 ◇ (x1 ◇ x0))", "(x0 ◇ x1)", "axiom1"));
    }

    @Test
    void renamesProofLinesWithTheLemmaScopeOnly() {
        TranslationContext context = resolvedContext(
                "Lemma 4: op(Y, Z) = Z.",
                "Proof:",
                "  op(Y, op(X, Z))",
                "= { by axiom 1 (a1) }",
                "  Z");
        LemmaRecord lemma = context.lemma("Lemma_4").orElseThrow();

        List<CalcStep> steps = builder.build(lemma.proofBlock().orElseThrow(), normalizer.scopeOf(lemma.expression()),
                context, lemma.canonicalName());

        assertThat(steps).singleElement()
                .satisfies(step -> {
                    assertThat(step.lhs()).isEqualTo("(x0 ◇ (X ◇ x1))");
                    assertThat(step.rhs()).isEqualTo("x1");
                    assertThat(step.dependency()).isEqualTo("op_law");
                });
    }

    @Test
    void firstReferenceOnLineWins() {
        TranslationContext context = resolvedContext(
                "Axiom 2 (single_lemma_0001): op(X, X) = X.",
                "Axiom 3 (single_lemma_0002): op(X, Y) = X.",
                "Goal 1 (conjecture0): op(a, a) = a.",
                "Proof:",
                "  op(a, a)",
                "= { by axiom 2 (single_lemma_0002) and axiom 1 (single_lemma_0001) }",
                "  a");
        LemmaRecord goal = context.lemma("conjecture0").orElseThrow();

        List<CalcStep> steps = builder.build(goal.proofBlock().orElseThrow(), normalizer.scopeOf(goal.expression()),
                context, goal.canonicalName());

        assertThat(steps).extracting(CalcStep::dependency).containsExactly("axiom2");
    }

    @Test
    void justificationWithoutReferenceFails() {
        TranslationContext context = resolvedContext(
                "Goal 1 (conjecture0): op(a, a) = a.",
                "Proof:",
                "  op(a, a)",
                "= { by definition }",
                "  a");
        LemmaRecord goal = context.lemma("conjecture0").orElseThrow();
        ProofBlock block = goal.proofBlock().orElseThrow();

        Throwable thrown = catchThrowable(() -> builder.build(block, normalizer.scopeOf(goal.expression()), context, "conjecture0"));

        assertThat(thrown).isInstanceOf(MissingDependencyException.class).hasMessageContaining("line 5");
    }

    @Test
    void malformedNeighbourLineReportsItsLineNumber() {
        TranslationContext context = resolvedContext(
                "Goal 1 (conjecture0): op(a, a) = a.",
                "Proof:",
                "  op(a, a",
                "= { by axiom 1 (a1) }",
                "  a");
        LemmaRecord goal = context.lemma("conjecture0").orElseThrow();
        ProofBlock block = goal.proofBlock().orElseThrow();

        Throwable thrown = catchThrowable(() -> builder.build(block, normalizer.scopeOf(goal.expression()), context, "conjecture0"));

        assertThat(thrown).isInstanceOf(TermParseException.class).hasMessageStartingWith("Line 4");
    }

    private TranslationContext resolvedContext(String... proofLines) {
        String transcript = "The conjecture is true! Here is a proof.\n" + String.join("\n", proofLines) + "\nRESULT: Theorem";
        TranslationContext context = new TranscriptSegmenter().segment(transcript);
        resolver.resolve(context);
        return context;
    }
}
