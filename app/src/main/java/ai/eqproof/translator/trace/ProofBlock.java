package ai.eqproof.translator.trace;

import java.util.List;
import java.util.Objects;

/**
 * Raw lines of one {@code Goal} or {@code Lemma} proof, in transcript order.
 */
public record ProofBlock(String name, List<ProofLine> lines) {

    public ProofBlock {
        Objects.requireNonNull(name, "name");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }

    public int size() {
        return lines.size();
    }

    public ProofLine line(int index) {
        return lines.get(index);
    }
}
