package ai.eqproof.translator.term;

import java.util.Objects;
import java.util.Optional;

/**
 * A bare term or an equation between two terms.
 */
public record Expression(Term lhs, Optional<Term> rhs) {

    public Expression {
        Objects.requireNonNull(lhs, "lhs");
        rhs = rhs == null ? Optional.empty() : rhs;
    }

    public static Expression of(Term term) {
        return new Expression(term, Optional.empty());
    }

    public static Expression equation(Term lhs, Term rhs) {
        return new Expression(lhs, Optional.of(rhs));
    }

    public boolean isEquation() {
        return rhs.isPresent();
    }
}
