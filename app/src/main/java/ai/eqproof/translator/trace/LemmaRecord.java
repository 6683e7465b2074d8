package ai.eqproof.translator.trace;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * A lemma or the conjecture collected from the transcript.
 *
 * <p>Created during segmentation; the canonical name and resolved dependencies are filled in once by
 * the dependency resolver.
 */
public final class LemmaRecord {

    private final String originalName;
    private final int lineNumber;
    private String expression;
    private List<String> dependencies;
    private Map<String, Integer> dependencyLines = Map.of();
    private ProofBlock proofBlock;
    private String canonicalName;
    private List<String> resolvedDependencies = List.of();

    public LemmaRecord(String originalName, String expression, List<String> dependencies, int lineNumber) {
        this.originalName = Objects.requireNonNull(originalName, "originalName");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
        this.lineNumber = lineNumber;
        this.canonicalName = originalName;
    }

    public String originalName() {
        return originalName;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String expression() {
        return expression;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    /**
     * Line that first mentions {@code token}: inside the proof block for derived dependencies, the
     * declaration line otherwise.
     */
    public int dependencyLine(String token) {
        return dependencyLines.getOrDefault(token, lineNumber);
    }

    public Optional<ProofBlock> proofBlock() {
        return Optional.ofNullable(proofBlock);
    }

    public String canonicalName() {
        return canonicalName;
    }

    public List<String> resolvedDependencies() {
        return resolvedDependencies;
    }

    void redeclare(String newExpression, List<String> newDependencies) {
        this.expression = Objects.requireNonNull(newExpression, "newExpression");
        this.dependencies = List.copyOf(newDependencies);
        this.dependencyLines = Map.of();
    }

    void attachProof(ProofBlock block, SortedMap<String, Integer> derivedDependencies) {
        this.proofBlock = Objects.requireNonNull(block, "block");
        this.dependencies = List.copyOf(derivedDependencies.keySet());
        this.dependencyLines = Map.copyOf(derivedDependencies);
    }

    public void rename(String newName) {
        this.canonicalName = Objects.requireNonNull(newName, "newName");
    }

    public void resolveDependencies(List<String> resolved) {
        this.resolvedDependencies = List.copyOf(resolved);
    }

    @Override
    public String toString() {
        return "LemmaRecord[" + originalName + " -> " + canonicalName + ", deps=" + dependencies + "]";
    }
}
