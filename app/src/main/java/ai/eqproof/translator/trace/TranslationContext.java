package ai.eqproof.translator.trace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable state of one translation run, handed from the segmenter to the resolver and the calc
 * builder. A fresh instance is used for every transcript.
 */
public final class TranslationContext {

    private final Map<String, AxiomRecord> axioms = new LinkedHashMap<>();
    private final Map<String, LemmaRecord> lemmas = new LinkedHashMap<>();
    private final SortedMap<String, Integer> usedReferences = new TreeMap<>();
    private TopLevelFormula hypothesis;
    private TopLevelFormula conjecture;

    private String openBlockName;
    private final List<ProofLine> openBlockLines = new ArrayList<>();
    private final StringBuilder pendingFormula = new StringBuilder();

    private final Map<String, String> lemmaNames = new LinkedHashMap<>();
    private final Map<String, String> retainedAxiomNames = new LinkedHashMap<>();

    public void recordAxiom(AxiomRecord axiom) {
        axioms.put(axiom.name(), axiom);
    }

    public void recordFormula(TopLevelFormula formula) {
        switch (formula.role()) {
            case AXIOM -> hypothesis = formula;
            case CONJECTURE -> conjecture = formula;
        }
    }

    /**
     * Registers or re-declares a lemma; a re-declaration keeps its discovery position.
     */
    public void declareLemma(String name, String expression, List<String> dependencies, int lineNumber) {
        LemmaRecord existing = lemmas.get(name);
        if (existing != null) {
            existing.redeclare(expression, dependencies);
            return;
        }
        lemmas.put(name, new LemmaRecord(name, expression, dependencies, lineNumber));
    }

    public void registerLemmaIfAbsent(String name, String expression, int lineNumber) {
        lemmas.computeIfAbsent(name, key -> new LemmaRecord(key, expression, List.of(), lineNumber));
    }

    void openBlock(String name) {
        openBlockName = name;
        openBlockLines.clear();
    }

    void appendProofLine(ProofLine line) {
        if (openBlockName == null) {
            return;
        }
        openBlockLines.add(line);
        for (String reference : DependencyTokens.parenthesizedReferences(line.text())) {
            usedReferences.putIfAbsent(reference, line.lineNumber());
        }
    }

    /**
     * Attaches the accumulated lines to their lemma and re-derives its dependencies from them.
     */
    Optional<ProofBlock> finalizeBlock() {
        if (openBlockName == null || openBlockLines.isEmpty()) {
            return Optional.empty();
        }
        ProofBlock block = new ProofBlock(openBlockName, openBlockLines);
        openBlockLines.clear();
        LemmaRecord lemma = lemmas.get(block.name());
        if (lemma != null) {
            lemma.attachProof(block, DependencyTokens.fromProofLines(block.lines()));
        }
        return Optional.of(block);
    }

    void startFormula(String text) {
        pendingFormula.setLength(0);
        pendingFormula.append(text);
    }

    void appendFormula(String text) {
        pendingFormula.append(' ').append(text);
    }

    String takePendingFormula() {
        String formula = pendingFormula.toString();
        pendingFormula.setLength(0);
        return formula;
    }

    public Map<String, AxiomRecord> axioms() {
        return Collections.unmodifiableMap(axioms);
    }

    public Collection<LemmaRecord> lemmas() {
        return Collections.unmodifiableCollection(lemmas.values());
    }

    public Optional<LemmaRecord> lemma(String originalName) {
        return Optional.ofNullable(lemmas.get(originalName));
    }

    public boolean isDeclaredLemma(String name) {
        return lemmas.containsKey(name);
    }

    /**
     * References printed in parentheses inside proof lines, sorted by name.
     */
    public SortedSet<String> usedReferences() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(usedReferences.keySet()));
    }

    public int firstUseLine(String reference) {
        return usedReferences.getOrDefault(reference, 0);
    }

    public Optional<TopLevelFormula> hypothesis() {
        return Optional.ofNullable(hypothesis);
    }

    public Optional<TopLevelFormula> conjecture() {
        return Optional.ofNullable(conjecture);
    }

    public TopLevelFormula requireHypothesis() {
        return hypothesis().orElseThrow(() -> new MissingTopLevelRecordException(FormulaRole.AXIOM));
    }

    public TopLevelFormula requireConjecture() {
        return conjecture().orElseThrow(() -> new MissingTopLevelRecordException(FormulaRole.CONJECTURE));
    }

    public void recordLemmaName(String originalName, String canonicalName) {
        lemmaNames.put(originalName, canonicalName);
    }

    public void recordRetainedAxiom(String originalName, String canonicalName) {
        retainedAxiomNames.put(originalName, canonicalName);
    }

    /**
     * Original lemma name to canonical {@code lemma_k} (or the kept conjecture name), in discovery order.
     */
    public Map<String, String> lemmaNames() {
        return Collections.unmodifiableMap(lemmaNames);
    }

    /**
     * Original inline axiom name to synthesized {@code axiomK}, in sorted order of the original names.
     */
    public Map<String, String> retainedAxiomNames() {
        return Collections.unmodifiableMap(retainedAxiomNames);
    }
}
