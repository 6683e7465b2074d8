package ai.eqproof.translator.render;

import ai.eqproof.translator.calc.CalcBlockBuilder;
import ai.eqproof.translator.calc.CalcStep;
import ai.eqproof.translator.calc.CalcStepFormatter;
import ai.eqproof.translator.normalize.NormalizedExpression;
import ai.eqproof.translator.normalize.VariableNormalizer;
import ai.eqproof.translator.normalize.VariableScope;
import ai.eqproof.translator.resolve.DependencyResolver;
import ai.eqproof.translator.term.Expression;
import ai.eqproof.translator.term.TermParseException;
import ai.eqproof.translator.term.TermParser;
import ai.eqproof.translator.term.TermRenderer;
import ai.eqproof.translator.trace.LemmaRecord;
import ai.eqproof.translator.trace.ProofBlock;
import ai.eqproof.translator.trace.TopLevelFormula;
import ai.eqproof.translator.trace.TranslationContext;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles the Lean document from a resolved {@link TranslationContext}.
 */
public class LeanDocumentRenderer {

    static final String PREAMBLE = String.join("\n",
            "import Mathlib.Tactic.NthRewrite",
            "import Duper",
            "open Lean Grind",
            "",
            "class Magma (α : Type _) where",
            "  op : α → α → α",
            "",
            "infix:65 \" ◇ \" => Magma.op");

    private static final String BODY_INDENT = "      ";
    private static final String SCHEMA_PREFIX = "Equation_";
    private static final String CARRIER_BINDER = "(G : Type _) [Magma G]";

    private final TermParser termParser;
    private final TermRenderer termRenderer;
    private final VariableNormalizer variableNormalizer;
    private final CalcBlockBuilder calcBlockBuilder;
    private final CalcStepFormatter calcStepFormatter;
    private final String tactic;

    public LeanDocumentRenderer(TermParser termParser,
                                TermRenderer termRenderer,
                                VariableNormalizer variableNormalizer,
                                CalcBlockBuilder calcBlockBuilder,
                                String tactic) {
        this.termParser = Objects.requireNonNull(termParser, "termParser");
        this.termRenderer = Objects.requireNonNull(termRenderer, "termRenderer");
        this.variableNormalizer = Objects.requireNonNull(variableNormalizer, "variableNormalizer");
        this.calcBlockBuilder = Objects.requireNonNull(calcBlockBuilder, "calcBlockBuilder");
        this.tactic = Objects.requireNonNull(tactic, "tactic");
        this.calcStepFormatter = new CalcStepFormatter(termRenderer, tactic);
    }

    public String render(TranslationContext context) {
        TopLevelFormula hypothesis = context.requireHypothesis();
        TopLevelFormula conjecture = context.requireConjecture();

        StringBuilder document = new StringBuilder(4096);
        document.append(PREAMBLE).append("\n\n");
        document.append(abbreviation(hypothesis)).append('\n');
        for (Map.Entry<String, String> retained : context.retainedAxiomNames().entrySet()) {
            String expression = context.axioms().get(retained.getKey()).expression();
            document.append(axiomDeclaration(retained.getValue(), expression)).append('\n');
        }
        document.append(abbreviation(conjecture)).append('\n');
        document.append(theoremHeader(hypothesis.name(), conjecture.name()));
        for (LemmaRecord lemma : context.lemmas()) {
            document.append(lemma(lemma, context));
        }
        document.append('\n');
        return document.toString();
    }

    String abbreviation(TopLevelFormula formula) {
        NormalizedExpression normalized = variableNormalizer.normalize(formula.body());
        String body = termRenderer.render(parse(normalized.text(), formula.name()));
        return "abbrev " + SCHEMA_PREFIX + formula.name() + " " + CARRIER_BINDER + " :=\n"
                + "  " + quantified(normalized.canonicalNames(), body) + "\n";
    }

    String axiomDeclaration(String name, String expressionText) {
        NormalizedExpression normalized = variableNormalizer.normalize(expressionText);
        String body = equationBody(parse(normalized.text(), name));
        return "axiom " + name + " " + CARRIER_BINDER + " :\n"
                + "  " + quantified(normalized.canonicalNames(), body) + "\n";
    }

    String theoremHeader(String hypothesisName, String conjectureName) {
        return "theorem " + SCHEMA_PREFIX + hypothesisName + "_implies_" + SCHEMA_PREFIX + conjectureName
                + " " + CARRIER_BINDER + "\n"
                + "    (" + DependencyResolver.HYPOTHESIS_NAME + " : " + SCHEMA_PREFIX + hypothesisName + " G) : "
                + SCHEMA_PREFIX + conjectureName + " G :=";
    }

    String lemma(LemmaRecord lemma, TranslationContext context) {
        String core = TopLevelFormula.stripUniversalQuantifier(lemma.expression());
        VariableScope scope = variableNormalizer.scopeOf(core);
        String name = lemma.canonicalName();
        String body = equationBody(parse(scope.apply(core), name));
        Optional<ProofBlock> proof = lemma.proofBlock();
        boolean conjecture = DependencyResolver.isConjecture(lemma, context.conjecture());

        if (proof.isPresent() && conjecture) {
            return "\n\n  show _ by\n"
                    + "    intros" + (scope.isEmpty() ? "" : " " + scope.binderList()) + "\n"
                    + "    calc\n"
                    + "      " + calcBlock(proof.get(), scope, context, name);
        }
        if (proof.isPresent()) {
            return "\n\n  have " + name + binders(scope) + " :\n"
                    + "  " + body + " := by\n"
                    + "    calc\n"
                    + "      " + calcBlock(proof.get(), scope, context, name);
        }
        List<String> dependencies = lemma.resolvedDependencies();
        String hints = dependencies.isEmpty() ? "[*]" : "[" + String.join(", ", dependencies) + "]";
        return "\n\n  have " + name + binders(scope) + " :\n"
                + "  " + body + " := by\n"
                + "    " + tactic + " " + hints;
    }

    /**
     * {@code lhs = rhs}, broken after {@code =} when the whole equation exceeds the line budget.
     */
    String equationBody(Expression expression) {
        String lhs = termRenderer.render(expression.lhs());
        if (expression.rhs().isEmpty()) {
            return termRenderer.wrap(lhs, BODY_INDENT);
        }
        String rhs = termRenderer.render(expression.rhs().get());
        String full = lhs + " = " + rhs;
        if (full.length() <= TermRenderer.LINE_BUDGET) {
            return full;
        }
        return termRenderer.wrap(lhs, BODY_INDENT) + " =\n" + BODY_INDENT + termRenderer.wrap(rhs, BODY_INDENT);
    }

    private String calcBlock(ProofBlock block, VariableScope scope, TranslationContext context, String referrer) {
        List<CalcStep> steps = calcBlockBuilder.build(block, scope, context, referrer);
        return calcStepFormatter.formatBlock(steps);
    }

    private Expression parse(String text, String owner) {
        try {
            return termParser.parseExpression(text);
        } catch (TermParseException ex) {
            throw new TermParseException("Malformed expression of " + owner, ex);
        }
    }

    private static String binders(VariableScope scope) {
        return scope.isEmpty() ? "" : " (" + scope.binderList() + " : G)";
    }

    private static String quantified(List<String> variables, String body) {
        return variables.isEmpty() ? body : "∀ " + String.join(" ", variables) + " : G, " + body;
    }
}
