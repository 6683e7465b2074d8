package ai.eqproof.translator.trace;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code fof(name, role, formula).} declaration: the hypothesis or the conjecture of the theorem.
 */
public record TopLevelFormula(String name, FormulaRole role, String formula) {

    private static final Pattern FOF = Pattern.compile("fof\\(([^,]+),([^,]+),(.*)\\)\\s*\\.", Pattern.DOTALL);
    private static final Pattern UNIVERSAL_PREFIX = Pattern.compile("!\\s*\\[.*?\\]\\s*:\\s*(.*)", Pattern.DOTALL);

    public TopLevelFormula {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(formula, "formula");
    }

    /**
     * Parses a complete declaration; roles other than axiom and conjecture yield an empty result.
     */
    public static Optional<TopLevelFormula> parse(String declaration) {
        Matcher matcher = FOF.matcher(declaration);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String name = matcher.group(1).strip();
        String formula = matcher.group(3).strip();
        return FormulaRole.from(matcher.group(2))
                .map(role -> new TopLevelFormula(name, role, formula));
    }

    /**
     * The formula without its leading {@code ! [X, ...] :} quantifier.
     */
    public String body() {
        return stripUniversalQuantifier(formula);
    }

    public static String stripUniversalQuantifier(String expression) {
        Matcher matcher = UNIVERSAL_PREFIX.matcher(expression.strip());
        if (matcher.lookingAt()) {
            return matcher.group(1).strip();
        }
        return expression.strip();
    }
}
