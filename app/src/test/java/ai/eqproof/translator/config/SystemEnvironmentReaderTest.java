package ai.eqproof.translator.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SystemEnvironmentReaderTest {

    private final SystemEnvironmentReader reader = new SystemEnvironmentReader(Map.of(
            "EQPROOF_TACTIC", "  grind ",
            "DRY_RUN", "   "));

    @Test
    void nonBlankTrimsValues() {
        assertThat(reader.nonBlank("EQPROOF_TACTIC")).contains("grind");
        assertThat(reader.get("EQPROOF_TACTIC")).contains("  grind ");
    }

    @Test
    void blankAndMissingValuesAreEmpty() {
        assertThat(reader.nonBlank("DRY_RUN")).isEmpty();
        assertThat(reader.nonBlank("LOG_FORMAT")).isEmpty();
    }
}
