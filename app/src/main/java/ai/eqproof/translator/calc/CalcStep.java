package ai.eqproof.translator.calc;

import java.util.Objects;

/**
 * One equational step {@code lhs = rhs} justified by a single resolved dependency.
 */
public record CalcStep(String lhs, String rhs, String dependency, int lineNumber) {

    public CalcStep {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
        Objects.requireNonNull(dependency, "dependency");
    }

    public int combinedLength() {
        return lhs.length() + rhs.length();
    }
}
