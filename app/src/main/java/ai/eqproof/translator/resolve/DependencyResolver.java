package ai.eqproof.translator.resolve;

import ai.eqproof.translator.trace.AxiomRecord;
import ai.eqproof.translator.trace.DependencyTokens;
import ai.eqproof.translator.trace.LemmaRecord;
import ai.eqproof.translator.trace.TopLevelFormula;
import ai.eqproof.translator.trace.TranslationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renumbers lemmas and retained axioms and rewrites every dependency list to canonical names.
 */
public class DependencyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyResolver.class);

    public static final String HYPOTHESIS_NAME = "op_law";
    static final String LEMMA_PREFIX = "lemma_";
    static final String AXIOM_PREFIX = "axiom";
    static final String CONJECTURE_PREFIX = "conjecture";

    public void resolve(TranslationContext context) {
        Objects.requireNonNull(context, "context");
        retainAxioms(context);
        renumberLemmas(context);
        for (LemmaRecord lemma : context.lemmas()) {
            List<String> resolved = new ArrayList<>(lemma.dependencies().size());
            for (String token : lemma.dependencies()) {
                resolved.add(resolveToken(context, token, lemma.canonicalName(), lemma.dependencyLine(token)));
            }
            lemma.resolveDependencies(resolved);
        }
        LOGGER.info("Resolved {} lemmas and {} retained axioms", context.lemmaNames().size(), context.retainedAxiomNames().size());
    }

    /**
     * Maps a raw dependency token to the name it has in the generated document.
     */
    public String resolveToken(TranslationContext context, String token, String referrer, int lineNumber) {
        String lemmaName = context.lemmaNames().get(token);
        if (lemmaName != null) {
            return lemmaName;
        }
        String axiomName = context.retainedAxiomNames().get(token);
        if (axiomName != null) {
            return axiomName;
        }
        if (DependencyTokens.isHypothesis(token)) {
            return HYPOTHESIS_NAME;
        }
        throw new MissingDependencyException(token, referrer, lineNumber);
    }

    public static boolean isConjecture(LemmaRecord lemma, Optional<TopLevelFormula> conjecture) {
        String name = lemma.originalName();
        return name.startsWith(CONJECTURE_PREFIX)
                || conjecture.map(formula -> formula.name().equals(name)).orElse(false);
    }

    private void retainAxioms(TranslationContext context) {
        int counter = 1;
        for (String reference : context.usedReferences()) {
            if (DependencyTokens.isHypothesis(reference) || context.isDeclaredLemma(reference)) {
                continue;
            }
            AxiomRecord axiom = context.axioms().get(reference);
            if (axiom == null) {
                throw new MissingDependencyException(reference, "proof step", context.firstUseLine(reference));
            }
            String name = AXIOM_PREFIX + counter++;
            LOGGER.debug("Retaining inline axiom {} as {}", reference, name);
            context.recordRetainedAxiom(reference, name);
        }
    }

    private void renumberLemmas(TranslationContext context) {
        int counter = 1;
        for (LemmaRecord lemma : context.lemmas()) {
            String name = isConjecture(lemma, context.conjecture())
                    ? lemma.originalName()
                    : LEMMA_PREFIX + counter++;
            lemma.rename(name);
            context.recordLemmaName(lemma.originalName(), name);
        }
    }
}
