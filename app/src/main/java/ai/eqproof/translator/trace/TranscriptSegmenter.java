package ai.eqproof.translator.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions a prover transcript into axioms, top-level formulas, lemma declarations and proof blocks.
 *
 * <p>{@link #transition(SegmenterState, String)} only classifies a line; {@link #segment(String)}
 * applies the effect of each classification to a fresh {@link TranslationContext}.
 */
public class TranscriptSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSegmenter.class);

    static final String PROOF_MARKER = "The conjecture is true! Here is a proof";
    static final String TERMINATOR = "RESULT";
    private static final String FORMULA_OPEN = "fof(";
    private static final String FORMULA_CLOSE = ").";
    private static final String DEPS_KEYWORD = "deps:";
    private static final String ARROW = "->";

    private static final Pattern AXIOM = Pattern.compile("Axiom\\s+\\d+\\s+\\(([^)]+)\\):\\s*(.*)");
    private static final Pattern LEMMA_DECLARATION_PREFIX = Pattern.compile("%\\s(single_lemma_|history_lemma_)");
    private static final Pattern LEMMA_DECLARATION = Pattern.compile("%\\s*(\\S+):\\s*(.*)");
    private static final Pattern BLOCK_HEADER =
            Pattern.compile("(?:Goal|Lemma)\\s+(\\d+)(?:\\s*\\(([^)]+)\\))?\\s*:\\s*(.*)");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z]\\w*");

    public Transition transition(SegmenterState state, String rawLine) {
        Objects.requireNonNull(state, "state");
        String line = rawLine == null ? "" : rawLine.strip();

        if (AXIOM.matcher(line).lookingAt()) {
            return new Transition(state, LineKind.AXIOM);
        }
        if (line.startsWith(PROOF_MARKER)) {
            return new Transition(SegmenterState.IN_PROOF_SECTION, LineKind.PROOF_MARKER);
        }
        if (state == SegmenterState.ACCUMULATING_FORMULA) {
            return line.endsWith(FORMULA_CLOSE)
                    ? new Transition(SegmenterState.SCANNING_HEADER, LineKind.FORMULA_END)
                    : new Transition(state, LineKind.FORMULA_PART);
        }
        if (LEMMA_DECLARATION_PREFIX.matcher(line).lookingAt()) {
            return new Transition(state, LineKind.LEMMA_DECLARATION);
        }

        boolean inProof = state == SegmenterState.IN_PROOF_SECTION || state == SegmenterState.ACCUMULATING_GOAL;
        if (inProof && BLOCK_HEADER.matcher(line).lookingAt()) {
            return new Transition(SegmenterState.ACCUMULATING_GOAL, LineKind.BLOCK_HEADER);
        }
        if (state == SegmenterState.ACCUMULATING_GOAL) {
            if (line.startsWith(TERMINATOR)) {
                return new Transition(SegmenterState.IN_PROOF_SECTION, LineKind.TERMINATOR);
            }
            if (!line.isEmpty() && !line.startsWith("Goal") && !line.startsWith("Lemma")) {
                return new Transition(state, LineKind.PROOF_LINE);
            }
            return new Transition(state, LineKind.IGNORED);
        }
        if (state == SegmenterState.SCANNING_HEADER && line.contains(FORMULA_OPEN)) {
            return line.endsWith(FORMULA_CLOSE)
                    ? new Transition(state, LineKind.FORMULA)
                    : new Transition(SegmenterState.ACCUMULATING_FORMULA, LineKind.FORMULA_START);
        }
        return new Transition(state, LineKind.IGNORED);
    }

    public TranslationContext segment(String transcript) {
        Objects.requireNonNull(transcript, "transcript");
        return segment(Arrays.asList(transcript.split("\\R", -1)));
    }

    public TranslationContext segment(List<String> lines) {
        TranslationContext context = new TranslationContext();
        SegmenterState state = SegmenterState.SCANNING_HEADER;
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            Transition transition = transition(state, rawLine);
            apply(context, transition.kind(), rawLine.strip(), lineNumber);
            if (state == SegmenterState.ACCUMULATING_FORMULA && transition.kind() == LineKind.PROOF_MARKER) {
                LOGGER.warn("Line {}: proof section starts inside an unterminated fof declaration", lineNumber);
            }
            if (transition.next() != state) {
                LOGGER.debug("Line {}: {} -> {}", lineNumber, state, transition.next());
            }
            state = transition.next();
        }
        context.finalizeBlock();
        if (state == SegmenterState.ACCUMULATING_FORMULA) {
            LOGGER.warn("Transcript ended inside an unterminated fof declaration");
        }
        LOGGER.info("Segmented {} lines: {} inline axioms, {} lemmas, {} used references",
                lineNumber, context.axioms().size(), context.lemmas().size(), context.usedReferences().size());
        return context;
    }

    private void apply(TranslationContext context, LineKind kind, String line, int lineNumber) {
        switch (kind) {
            case AXIOM -> recordAxiom(context, line, lineNumber);
            case PROOF_MARKER -> context.finalizeBlock();
            case LEMMA_DECLARATION -> declareLemma(context, line, lineNumber);
            case BLOCK_HEADER -> openBlock(context, line, lineNumber);
            case PROOF_LINE -> context.appendProofLine(new ProofLine(lineNumber, line));
            case TERMINATOR -> context.finalizeBlock();
            case FORMULA -> recordFormula(context, line);
            case FORMULA_START -> context.startFormula(line);
            case FORMULA_PART -> context.appendFormula(line);
            case FORMULA_END -> {
                context.appendFormula(line);
                recordFormula(context, context.takePendingFormula());
            }
            case IGNORED -> {
            }
        }
    }

    private void recordAxiom(TranslationContext context, String line, int lineNumber) {
        Matcher matcher = AXIOM.matcher(line);
        if (!matcher.lookingAt()) {
            return;
        }
        String expression = stripTrailingPeriods(matcher.group(2));
        context.recordAxiom(new AxiomRecord(matcher.group(1), expression, lineNumber));
    }

    private void recordFormula(TranslationContext context, String declaration) {
        TopLevelFormula.parse(declaration).ifPresentOrElse(
                formula -> {
                    LOGGER.debug("Top-level {} '{}': {}", formula.role(), formula.name(), formula.formula());
                    context.recordFormula(formula);
                },
                () -> LOGGER.debug("Skipping fof declaration without axiom or conjecture role: {}", declaration));
    }

    private void declareLemma(TranslationContext context, String line, int lineNumber) {
        String[] parts = line.split("\\|", -1);
        Matcher matcher = LEMMA_DECLARATION.matcher(parts[0]);
        if (!matcher.lookingAt()) {
            return;
        }
        String dependencyPart = parts.length > 1 ? parts[1] : "";
        context.declareLemma(matcher.group(1), matcher.group(2).strip(), declaredDependencies(dependencyPart), lineNumber);
    }

    static List<String> declaredDependencies(String dependencyPart) {
        List<String> dependencies = new ArrayList<>();
        int keyword = dependencyPart.indexOf(DEPS_KEYWORD);
        if (keyword < 0) {
            return dependencies;
        }
        for (String entry : dependencyPart.substring(keyword + DEPS_KEYWORD.length()).split(",")) {
            String token = beforeFirst(beforeFirst(entry, ARROW), ":").strip();
            if (IDENTIFIER.matcher(token).matches()) {
                dependencies.add(token);
            }
        }
        return dependencies;
    }

    private void openBlock(TranslationContext context, String line, int lineNumber) {
        context.finalizeBlock();
        Matcher matcher = BLOCK_HEADER.matcher(line);
        if (!matcher.lookingAt()) {
            return;
        }
        String name = matcher.group(2) != null
                ? matcher.group(2).strip()
                : DependencyTokens.lemmaReference(matcher.group(1));
        context.openBlock(name);
        if (!DependencyTokens.isHypothesis(name)) {
            context.registerLemmaIfAbsent(name, matcher.group(3).strip(), lineNumber);
        }
    }

    private static String beforeFirst(String text, String separator) {
        int index = text.indexOf(separator);
        return index < 0 ? text : text.substring(0, index);
    }

    private static String stripTrailingPeriods(String text) {
        String stripped = text.strip();
        int end = stripped.length();
        while (end > 0 && stripped.charAt(end - 1) == '.') {
            end--;
        }
        return stripped.substring(0, end);
    }
}
