package ai.eqproof.translator.calc;

import ai.eqproof.translator.term.TermRenderer;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lays out calc steps as Lean source.
 */
public class CalcStepFormatter {

    static final String STEP_INDENT = "        ";
    static final String STEP_SEPARATOR = "\n      ";

    private final TermRenderer termRenderer;
    private final String tactic;

    public CalcStepFormatter(TermRenderer termRenderer, String tactic) {
        this.termRenderer = Objects.requireNonNull(termRenderer, "termRenderer");
        this.tactic = Objects.requireNonNull(tactic, "tactic");
    }

    /**
     * {@code lhs = rhs} stays on one line when the two sides together fit the budget; otherwise the
     * line breaks after {@code =}.
     */
    public String format(CalcStep step) {
        String lhs = termRenderer.wrap(step.lhs(), STEP_INDENT);
        String rhs = termRenderer.wrap(step.rhs(), STEP_INDENT);
        String justification = " := by\n" + STEP_INDENT + tactic + " [" + step.dependency() + "]";
        if (step.combinedLength() <= TermRenderer.LINE_BUDGET) {
            return lhs + " = " + rhs + justification;
        }
        return lhs + " =\n" + STEP_INDENT + rhs + justification;
    }

    public String formatBlock(List<CalcStep> steps) {
        return steps.stream()
                .map(this::format)
                .collect(Collectors.joining(STEP_SEPARATOR));
    }
}
