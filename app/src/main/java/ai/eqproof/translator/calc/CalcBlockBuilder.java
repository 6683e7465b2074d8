package ai.eqproof.translator.calc;

import ai.eqproof.translator.normalize.VariableScope;
import ai.eqproof.translator.resolve.DependencyResolver;
import ai.eqproof.translator.resolve.MissingDependencyException;
import ai.eqproof.translator.term.TermParseException;
import ai.eqproof.translator.term.TermParser;
import ai.eqproof.translator.term.TermRenderer;
import ai.eqproof.translator.trace.DependencyTokens;
import ai.eqproof.translator.trace.ProofBlock;
import ai.eqproof.translator.trace.ProofLine;
import ai.eqproof.translator.trace.TranslationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns the raw lines of a proof block into calc steps.
 *
 * <p>Every justification line {@code = { by ... }} yields one step whose sides are the raw lines
 * directly above and below it. Only the first dependency named on the line is used.
 */
public class CalcBlockBuilder {

    private static final String PROOF_HEADING = "proof:";

    private final TermParser termParser;
    private final TermRenderer termRenderer;
    private final DependencyResolver dependencyResolver;

    public CalcBlockBuilder(TermParser termParser, TermRenderer termRenderer, DependencyResolver dependencyResolver) {
        this.termParser = Objects.requireNonNull(termParser, "termParser");
        this.termRenderer = Objects.requireNonNull(termRenderer, "termRenderer");
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
    }

    public List<CalcStep> build(ProofBlock block, VariableScope scope, TranslationContext context, String referrer) {
        List<CalcStep> steps = new ArrayList<>();
        for (int i = 0; i < block.size(); i++) {
            ProofLine line = block.line(i);
            String text = line.text().strip();
            if (text.isEmpty() || text.toLowerCase(Locale.ROOT).equals(PROOF_HEADING)) {
                continue;
            }
            if (!DependencyTokens.isJustification(text)) {
                continue;
            }
            String token = DependencyTokens.firstJustificationToken(text)
                    .orElseThrow(() -> new MissingDependencyException(text, referrer, line.lineNumber()));
            String dependency = dependencyResolver.resolveToken(context, token, referrer, line.lineNumber());
            String lhs = renderNeighbour(block, i - 1, scope, line);
            String rhs = renderNeighbour(block, i + 1, scope, line);
            steps.add(new CalcStep(lhs, rhs, dependency, line.lineNumber()));
        }
        return steps;
    }

    private String renderNeighbour(ProofBlock block, int index, VariableScope scope, ProofLine justification) {
        if (index < 0 || index >= block.size()) {
            throw new TermParseException(0, "Justification without a neighbouring term line",
                    "line " + justification.lineNumber() + ": " + justification.text());
        }
        ProofLine neighbour = block.line(index);
        try {
            return termRenderer.render(termParser.parseTerm(scope.apply(neighbour.text()), 0).term());
        } catch (TermParseException ex) {
            throw new TermParseException("Line " + neighbour.lineNumber(), ex);
        }
    }
}
