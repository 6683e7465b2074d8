package ai.eqproof.translator.cli;

import ai.eqproof.translator.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format}, reporting unknown values as a usage error.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("Unknown log format '" + value + "' (expected text or json)");
        }
    }
}
