package ai.eqproof.translator.config;

import ai.eqproof.translator.cli.CliArguments;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_DIR = "EQPROOF_OUTPUT_DIR";
    static final String ENV_TACTIC = "EQPROOF_TACTIC";
    static final String ENV_DRY_RUN = "DRY_RUN";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final Path DEFAULT_OUTPUT_DIR = Path.of("lean", "Proof");
    static final String DEFAULT_TACTIC = "duper";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.transcript() == null) {
            throw new IllegalArgumentException("transcript path must be provided");
        }
        Path outputDirectory = resolveOutputDirectory(arguments);
        String tactic = firstNonBlank(arguments.tactic(), ENV_TACTIC, DEFAULT_TACTIC);
        boolean dryRun = resolveDryRun(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        return new Config(arguments.transcript(), outputDirectory, tactic, dryRun, logFormat, arguments.verbose());
    }

    private Path resolveOutputDirectory(CliArguments arguments) {
        if (arguments.outputDirectory() != null) {
            return arguments.outputDirectory();
        }
        return environmentReader.nonBlank(ENV_OUTPUT_DIR)
                .map(ConfigLoader::parsePath)
                .orElse(DEFAULT_OUTPUT_DIR);
    }

    private boolean resolveDryRun(CliArguments arguments) {
        if (arguments.dryRun()) {
            return true;
        }
        return environmentReader.nonBlank(ENV_DRY_RUN)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.nonBlank(envKey).orElse(defaultValue);
    }

    private static Path parsePath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException(ENV_OUTPUT_DIR + " is not a valid path: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
