package ai.eqproof.translator.term;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the prefix grammar {@code term := "op(" term "," term ")" | identifier}.
 */
public class TermParser {

    private static final String OPERATOR_OPEN = "op(";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z]\\w*");

    public ParsedTerm parseTerm(String text, int offset) {
        int length = text.length();
        int i = skipWhitespace(text, offset);
        if (i >= length) {
            throw new TermParseException(i, "Unexpected end while parsing term", text);
        }

        if (text.startsWith(OPERATOR_OPEN, i)) {
            ParsedTerm left = parseTerm(text, i + OPERATOR_OPEN.length());
            i = skipWhitespace(text, left.nextOffset());
            if (i >= length || text.charAt(i) != ',') {
                throw new TermParseException(i, "Expected ',' in op(...)", text);
            }
            ParsedTerm right = parseTerm(text, i + 1);
            i = skipWhitespace(text, right.nextOffset());
            if (i >= length || text.charAt(i) != ')') {
                throw new TermParseException(i, "Expected ')' in op(...)", text);
            }
            return new ParsedTerm(new Application(left.term(), right.term()), i + 1);
        }

        Matcher matcher = IDENTIFIER.matcher(text);
        matcher.region(i, length);
        if (!matcher.lookingAt()) {
            throw new TermParseException(i, "Expected variable", text);
        }
        return new ParsedTerm(new Variable(matcher.group()), matcher.end());
    }

    /**
     * Parses exactly one term, ignoring surrounding whitespace and trailing periods.
     */
    public Term parseSide(String sideText) {
        String side = stripTrailingPeriods(sideText.strip());
        ParsedTerm parsed = parseTerm(side, 0);
        int position = skipWhitespace(side, parsed.nextOffset());
        if (position != side.length()) {
            throw new TermParseException(position, "Extra characters after parsed term '" + side.substring(position) + "'", side);
        }
        return parsed.term();
    }

    /**
     * Parses a term or an equation split at the first {@code =} outside parentheses.
     */
    public Expression parseExpression(String text) {
        String expression = unwrapOuterParentheses(text.strip());
        int split = findTopLevelEquals(expression);
        if (split < 0) {
            return Expression.of(parseSide(expression));
        }
        Term lhs = parseSide(expression.substring(0, split));
        Term rhs = parseSide(expression.substring(split + 1));
        return Expression.equation(lhs, rhs);
    }

    static String unwrapOuterParentheses(String text) {
        if (text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
            return text;
        }
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    // the first parenthesis closes before the end
                    return text;
                }
            }
        }
        return depth == 0 ? text.substring(1, text.length() - 1).strip() : text;
    }

    private static int findTopLevelEquals(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == '=' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static String stripTrailingPeriods(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }

    private static int skipWhitespace(String text, int offset) {
        int i = offset;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
