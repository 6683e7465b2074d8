package ai.eqproof.translator.cli;

import ai.eqproof.translator.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "eqproof-translator", mixinStandardHelpOptions = true, version = "eqproof-translator 0.1.0",
        description = "Translates an equational prover transcript into a Lean proof script")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "TRANSCRIPT", description = "Prover transcript to translate")
    private Path transcript;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving the generated .lean file", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--tactic", description = "Tactic closing each step (default: duper)", paramLabel = "NAME")
    private String tactic;

    @CommandLine.Option(names = "--dry-run", description = "Print the document to standard output instead of writing it")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log segmentation and resolution details")
    private boolean verbose;

    public Path transcript() {
        return transcript;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public String tactic() {
        return tactic;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
