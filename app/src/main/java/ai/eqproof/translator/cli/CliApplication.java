package ai.eqproof.translator.cli;

import ai.eqproof.translator.config.Config;
import ai.eqproof.translator.config.ConfigLoader;
import ai.eqproof.translator.config.SystemEnvironmentReader;
import ai.eqproof.translator.logging.LoggingConfigurator;
import ai.eqproof.translator.translate.ProofTranslationService;
import ai.eqproof.translator.translate.TranslationException;
import ai.eqproof.translator.translate.TranslationResult;
import ai.eqproof.translator.writer.DocumentWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_TRANSLATION_FAILURE = 1;
    static final int EXIT_IO_FAILURE = 3;
    static final String MDC_TRANSCRIPT = "transcript";

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentWriter());
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        MDC.put(MDC_TRANSCRIPT, config.transcript().getFileName().toString());
        try {
            return translate(config, commandLine);
        } catch (TranslationException ex) {
            LOGGER.debug("Translation aborted", ex);
            commandLine.getErr().println("error: " + ex.getMessage());
            return EXIT_TRANSLATION_FAILURE;
        } catch (UncheckedIOException ex) {
            LOGGER.debug("I/O failure", ex);
            commandLine.getErr().println("error: " + ex.getMessage());
            return EXIT_IO_FAILURE;
        } finally {
            MDC.remove(MDC_TRANSCRIPT);
        }
    }

    private int translate(Config config, CommandLine commandLine) {
        String transcript = readTranscript(config.transcript());
        LOGGER.info("Read transcript {} ({} characters)", config.transcript(), transcript.length());

        TranslationResult result = ProofTranslationService.create(config.tactic()).translate(transcript);
        LOGGER.info("Rendered {} with {} lemmas and {} retained axioms",
                result.theoremName(), result.lemmaCount(), result.retainedAxiomCount());

        if (config.dryRun()) {
            commandLine.getOut().print(result.document());
            commandLine.getOut().flush();
            return 0;
        }
        Path target = documentWriter.outputPathFor(config.outputDirectory(), config.transcript());
        documentWriter.write(target, result.document());
        LOGGER.info("Generated Lean file {}", target);
        return 0;
    }

    private static String readTranscript(Path transcript) {
        try {
            return Files.readString(transcript, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read transcript: " + transcript, ex);
        }
    }
}
