package ai.eqproof.translator.trace;

import java.util.Objects;

public record Transition(SegmenterState next, LineKind kind) {

    public Transition {
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(kind, "kind");
    }
}
