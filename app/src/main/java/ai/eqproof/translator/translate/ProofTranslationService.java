package ai.eqproof.translator.translate;

import ai.eqproof.translator.calc.CalcBlockBuilder;
import ai.eqproof.translator.normalize.VariableNormalizer;
import ai.eqproof.translator.render.LeanDocumentRenderer;
import ai.eqproof.translator.resolve.DependencyResolver;
import ai.eqproof.translator.term.TermParser;
import ai.eqproof.translator.term.TermRenderer;
import ai.eqproof.translator.trace.TopLevelFormula;
import ai.eqproof.translator.trace.TranscriptSegmenter;
import ai.eqproof.translator.trace.TranslationContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole transcript-to-Lean pipeline in memory: segment, resolve, render.
 */
public class ProofTranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofTranslationService.class);

    private final TranscriptSegmenter segmenter;
    private final DependencyResolver dependencyResolver;
    private final LeanDocumentRenderer documentRenderer;

    public ProofTranslationService(TranscriptSegmenter segmenter,
                                   DependencyResolver dependencyResolver,
                                   LeanDocumentRenderer documentRenderer) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
        this.documentRenderer = Objects.requireNonNull(documentRenderer, "documentRenderer");
    }

    public static ProofTranslationService create(String tactic) {
        TermParser termParser = new TermParser();
        TermRenderer termRenderer = new TermRenderer();
        DependencyResolver dependencyResolver = new DependencyResolver();
        CalcBlockBuilder calcBlockBuilder = new CalcBlockBuilder(termParser, termRenderer, dependencyResolver);
        LeanDocumentRenderer renderer = new LeanDocumentRenderer(termParser, termRenderer, new VariableNormalizer(),
                calcBlockBuilder, tactic);
        return new ProofTranslationService(new TranscriptSegmenter(), dependencyResolver, renderer);
    }

    public TranslationResult translate(String transcript) {
        TranslationContext context = segmenter.segment(transcript);
        TopLevelFormula hypothesis = context.requireHypothesis();
        TopLevelFormula conjecture = context.requireConjecture();
        LOGGER.info("Translating proof of {} from hypothesis {}", conjecture.name(), hypothesis.name());

        dependencyResolver.resolve(context);
        String document = documentRenderer.render(context);

        String theoremName = "Equation_" + hypothesis.name() + "_implies_Equation_" + conjecture.name();
        long lemmaCount = context.lemmas().stream()
                .filter(lemma -> !DependencyResolver.isConjecture(lemma, context.conjecture()))
                .count();
        return new TranslationResult(document, theoremName, (int) lemmaCount, context.retainedAxiomNames().size());
    }
}
