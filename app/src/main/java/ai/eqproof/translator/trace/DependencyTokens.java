package ai.eqproof.translator.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction of dependency references from proof and justification lines.
 */
public final class DependencyTokens {

    public static final String HYPOTHESIS_TOKEN = "a1";
    public static final String LEMMA_REFERENCE_PREFIX = "Lemma_";

    private static final Pattern PARENTHESIZED_REFERENCE =
            Pattern.compile("\\((single_lemma_\\d+|history_lemma_\\d+|a1)\\)");
    private static final Pattern REFERENCE =
            Pattern.compile("\\b(single_lemma_\\d+|history_lemma_\\d+|a1)\\b");
    private static final Pattern LEMMA_NUMBER =
            Pattern.compile("by\\s+lemma\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JUSTIFICATION =
            Pattern.compile("=\\s*\\{\\s*by\\s+(\\S+).*?\\}");

    private DependencyTokens() {
    }

    /**
     * References written as {@code (name)}, as the prover prints the axiom it rewrote with.
     */
    public static List<String> parenthesizedReferences(String line) {
        List<String> references = new ArrayList<>();
        Matcher matcher = PARENTHESIZED_REFERENCE.matcher(line);
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return references;
    }

    /**
     * Distinct dependencies of a whole proof block, sorted by name, each mapped to the first line
     * that mentions it.
     */
    public static SortedMap<String, Integer> fromProofLines(List<ProofLine> lines) {
        SortedMap<String, Integer> dependencies = new TreeMap<>();
        for (ProofLine line : lines) {
            for (String reference : parenthesizedReferences(line.text())) {
                dependencies.putIfAbsent(reference, line.lineNumber());
            }
            Matcher matcher = LEMMA_NUMBER.matcher(line.text());
            while (matcher.find()) {
                dependencies.putIfAbsent(lemmaReference(matcher.group(1)), line.lineNumber());
            }
        }
        return dependencies;
    }

    public static boolean isJustification(String line) {
        return JUSTIFICATION.matcher(line.strip()).lookingAt();
    }

    /**
     * The dependency a justification line rests on: the first named reference, else the first
     * {@code by lemma N}.
     */
    public static Optional<String> firstJustificationToken(String line) {
        Matcher reference = REFERENCE.matcher(line);
        if (reference.find()) {
            return Optional.of(reference.group(1));
        }
        Matcher lemma = LEMMA_NUMBER.matcher(line);
        if (lemma.find()) {
            return Optional.of(lemmaReference(lemma.group(1)));
        }
        return Optional.empty();
    }

    public static String lemmaReference(String number) {
        return LEMMA_REFERENCE_PREFIX + number;
    }

    public static boolean isHypothesis(String token) {
        return HYPOTHESIS_TOKEN.equalsIgnoreCase(token);
    }
}
