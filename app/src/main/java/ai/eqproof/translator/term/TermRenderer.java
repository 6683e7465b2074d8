package ai.eqproof.translator.term;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders terms in Lean infix notation and lays out long sides over several lines.
 */
public class TermRenderer {

    public static final String OPERATOR = "◇";
    public static final int LINE_BUDGET = 80;

    public String render(Term term) {
        StringBuilder builder = new StringBuilder();
        appendInfix(builder, term);
        return builder.toString();
    }

    public String render(Expression expression) {
        String lhs = render(expression.lhs());
        return expression.rhs()
                .map(rhs -> lhs + " = " + render(rhs))
                .orElse(lhs);
    }

    /**
     * Renders the TPTP prefix form, the inverse of {@link TermParser#parseTerm(String, int)}.
     */
    public String toPrefix(Term term) {
        if (term instanceof Application application) {
            return "op(" + toPrefix(application.left()) + ", " + toPrefix(application.right()) + ")";
        }
        return ((Variable) term).name();
    }

    /**
     * Greedy left-to-right wrap at operator fragments. Text within the budget is returned unchanged;
     * otherwise a line is closed as soon as the next fragment would push it past the budget, and the
     * continuation line starts with the operator, prefixed by {@code indent}.
     */
    public String wrap(String rendered, String indent) {
        String text = rendered.strip();
        if (text.length() <= LINE_BUDGET) {
            return text;
        }

        String[] parts = text.split(OPERATOR, -1);
        List<String> lines = new ArrayList<>();
        String current = parts[0].strip();
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].strip();
            String candidate = current + " " + OPERATOR + " " + part;
            if (candidate.length() > LINE_BUDGET) {
                lines.add(current);
                current = OPERATOR + " " + part;
            } else {
                current = candidate;
            }
        }
        lines.add(current);
        return String.join("\n" + indent, lines);
    }

    private void appendInfix(StringBuilder builder, Term term) {
        if (term instanceof Application application) {
            builder.append('(');
            appendInfix(builder, application.left());
            builder.append(' ').append(OPERATOR).append(' ');
            appendInfix(builder, application.right());
            builder.append(')');
        } else {
            builder.append(((Variable) term).name());
        }
    }
}
