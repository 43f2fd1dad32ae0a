package org.proclient.cli.commands;

import org.proclient.operation.OutputFormat;
import picocli.CommandLine;

/**
 * Parses {@code --format} values case-insensitively.
 */
class FormatConverter implements CommandLine.ITypeConverter<OutputFormat> {

    @Override
    public OutputFormat convert(final String value) {
        try {
            return OutputFormat.parse(value);
        } catch (final IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
