package ai.eqproof.translator.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VariableNormalizerTest {

    private final VariableNormalizer normalizer = new VariableNormalizer();

    @Test
    void assignsCanonicalNamesInSortedOrder() {
        NormalizedExpression normalized = normalizer.normalize("op(Z, op(X, Y)) = Y");

        assertThat(normalized.text()).isEqualTo("op(x2, op(x0, x1)) = x1");
        assertThat(normalized.canonicalNames()).containsExactly("x0", "x1", "x2");
    }

    @Test
    void mappingIgnoresOrderOfFirstOccurrence() {
        VariableScope first = normalizer.scopeOf("op(B, op(A, C)) = C");
        VariableScope second = normalizer.scopeOf("op(C, op(B, A)) = A");

        assertThat(first.renaming()).isEqualTo(second.renaming());
        assertThat(first.renaming()).containsEntry("a", "x0").containsEntry("b", "x1").containsEntry("c", "x2");
    }

    @Test
    void treatsIdentifiersCaseInsensitively() {
        NormalizedExpression upper = normalizer.normalize("op(X, op(Y, X)) = X");
        NormalizedExpression mixed = normalizer.normalize("op(x, op(Y, X)) = x");

        assertThat(upper.text()).isEqualTo(mixed.text()).isEqualTo("op(x0, op(x1, x0)) = x0");
        assertThat(upper.canonicalNames()).isEqualTo(mixed.canonicalNames());
    }

    @Test
    void neverRenamesOperatorKeyword() {
        VariableScope scope = normalizer.scopeOf("op(op(X0, X1), X0)");

        assertThat(scope.canonicalNames()).containsExactly("x0", "x1");
        assertThat(scope.apply("op(op(X0, X1), X0)")).isEqualTo("op(op(x0, x1), x0)");
    }

    @Test
    void scopeLeavesUnknownIdentifiersUntouched() {
        VariableScope scope = normalizer.scopeOf("op(a, b)");

        assertThat(scope.apply("op(b, c)")).isEqualTo("op(x1, c)");
    }

    @Test
    void expressionsNeverShareScopes() {
        VariableScope lemma = normalizer.scopeOf("op(Y, Z) = Z");
        VariableScope other = normalizer.scopeOf("op(X, Y) = X");

        assertThat(lemma.apply("Y")).isEqualTo("x0");
        assertThat(other.apply("Y")).isEqualTo("x1");
        assertThat(normalizer.scopeOf("X").binderList()).isEqualTo("x0");
        assertThat(normalizer.scopeOf("op").isEmpty()).isTrue();
    }
}
