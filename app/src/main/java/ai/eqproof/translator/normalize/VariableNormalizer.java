package ai.eqproof.translator.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the free variables of an expression and renames them canonically.
 *
 * <p>The scope is computed from one expression only. Two expressions never share a renaming, even
 * when they belong to the same proof.
 */
public class VariableNormalizer {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z]\\w*");
    private static final String OPERATOR_KEYWORD = "op";
    private static final String CANONICAL_PREFIX = "x";

    public VariableScope scopeOf(String expressionText) {
        TreeSet<String> variables = new TreeSet<>();
        Matcher matcher = IDENTIFIER.matcher(expressionText);
        while (matcher.find()) {
            String lower = matcher.group().toLowerCase(Locale.ROOT);
            if (!lower.equals(OPERATOR_KEYWORD)) {
                variables.add(lower);
            }
        }

        Map<String, String> renaming = new LinkedHashMap<>();
        List<String> canonicalNames = new ArrayList<>(variables.size());
        int index = 0;
        for (String variable : variables) {
            String canonical = CANONICAL_PREFIX + index++;
            renaming.put(variable, canonical);
            canonicalNames.add(canonical);
        }
        return new VariableScope(renaming, canonicalNames);
    }

    public NormalizedExpression normalize(String expressionText) {
        VariableScope scope = scopeOf(expressionText);
        return new NormalizedExpression(scope.apply(expressionText), scope.canonicalNames());
    }
}
