package ai.docsite.latex.cli;

import ai.docsite.latex.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format} values.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
