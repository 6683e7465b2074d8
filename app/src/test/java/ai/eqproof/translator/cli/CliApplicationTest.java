package ai.eqproof.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.eqproof.translator.config.ConfigLoader;
import ai.eqproof.translator.writer.DocumentWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    private static final int INVALID_INPUT =
            new CommandLine(new CliArguments()).getCommandSpec().exitCodeOnInvalidInput();

    @TempDir
    Path tempDir;

    private final CliApplication application =
            new CliApplication(new ConfigLoader(key -> Optional.empty()), new DocumentWriter());

    @Test
    void writesLeanFileNamedAfterTranscript() throws IOException {
        Path transcript = copyFixture("commutativity.txt");
        Path outputDir = tempDir.resolve("lean/Proof");

        int exitCode = application.run(new String[] {transcript.toString(), "--output-dir", outputDir.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("commutativity.lean"), StandardCharsets.UTF_8))
                .isEqualTo(fixture("commutativity.expected.lean"));
    }

    @Test
    void translationFailureReturnsOneAndWritesNothing() throws IOException {
        Path transcript = copyFixture("missing-conjecture.txt");
        Path outputDir = tempDir.resolve("out");

        int exitCode = application.run(new String[] {transcript.toString(), "--output-dir", outputDir.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_TRANSLATION_FAILURE);
        assertThat(Files.exists(outputDir.resolve("missing-conjecture.lean"))).isFalse();
    }

    @Test
    void dryRunDoesNotTouchOutputDirectory() throws IOException {
        Path transcript = copyFixture("lemmas.txt");
        Path outputDir = tempDir.resolve("out");

        int exitCode = application.run(new String[] {
                transcript.toString(), "--output-dir", outputDir.toString(), "--dry-run"});

        assertThat(exitCode).isZero();
        assertThat(Files.exists(outputDir)).isFalse();
    }

    @Test
    void unreadableTranscriptReturnsIoFailure() {
        int exitCode = application.run(new String[] {tempDir.resolve("absent.txt").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void missingTranscriptArgumentIsInvalidInput() {
        int exitCode = application.run(new String[] {"--dry-run"});

        assertThat(exitCode).isEqualTo(INVALID_INPUT).isNotEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void unknownLogFormatIsInvalidInput() throws IOException {
        Path transcript = copyFixture("commutativity.txt");

        int exitCode = application.run(new String[] {transcript.toString(), "--log-format", "xml", "--dry-run"});

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        Files.writeString(target, fixture(name), StandardCharsets.UTF_8);
        return target;
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = CliApplicationTest.class.getResourceAsStream("/transcripts/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
