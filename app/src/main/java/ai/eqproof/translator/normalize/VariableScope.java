package ai.eqproof.translator.normalize;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Case-insensitive renaming of the free variables of one expression to {@code x0, x1, ...}.
 */
public record VariableScope(Map<String, String> renaming, List<String> canonicalNames) {

    public VariableScope {
        renaming = Map.copyOf(Objects.requireNonNull(renaming, "renaming"));
        canonicalNames = List.copyOf(Objects.requireNonNull(canonicalNames, "canonicalNames"));
    }

    /**
     * Replaces every identifier known to this scope; other identifiers are left untouched.
     */
    public String apply(String text) {
        Matcher matcher = VariableNormalizer.IDENTIFIER.matcher(text);
        StringBuilder builder = new StringBuilder(text.length());
        while (matcher.find()) {
            String identifier = matcher.group();
            String replacement = renaming.getOrDefault(identifier.toLowerCase(Locale.ROOT), identifier);
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    public String binderList() {
        return String.join(" ", canonicalNames);
    }

    public boolean isEmpty() {
        return canonicalNames.isEmpty();
    }
}
