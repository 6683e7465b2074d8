package ai.eqproof.translator.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commits a rendered Lean document to the output directory in a single step.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);
    static final String LEAN_EXTENSION = ".lean";
    // Written with default permissions; the move into place keeps them.
    static final String TEMP_SUFFIX = ".tmp";

    /**
     * {@code <outputDirectory>/<input base name without extension>.lean}.
     */
    public Path outputPathFor(Path outputDirectory, Path transcript) {
        if (outputDirectory == null || transcript == null || transcript.getFileName() == null) {
            throw new IllegalArgumentException("outputDirectory and transcript must be provided");
        }
        String fileName = transcript.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputDirectory.resolve(baseName + LEAN_EXTENSION);
    }

    public void write(Path target, String document) {
        if (target == null || document == null) {
            throw new IllegalArgumentException("target and document must be provided");
        }
        Path directory = target.toAbsolutePath().getParent();
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = directory.resolve(target.getFileName() + TEMP_SUFFIX);
            Files.writeString(temporary, document, StandardCharsets.UTF_8);
            moveIntoPlace(temporary, target);
            LOGGER.debug("Wrote {} characters to {}", document.length(), target);
        } catch (IOException ex) {
            deleteQuietly(temporary);
            throw new UncheckedIOException("Failed to write Lean document: " + target, ex);
        }
    }

    private void moveIntoPlace(Path temporary, Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temporary) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove temporary file {}", temporary, ex);
        }
    }
}
