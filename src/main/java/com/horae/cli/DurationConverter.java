package com.horae.cli;

import com.horae.util.Durations;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.time.Duration;

/**
 * Converts "250ms", "2s", "5m", "1h", plain milliseconds or ISO-8601 text to a Duration.
 */
public class DurationConverter implements ITypeConverter<Duration> {

    @Override
    public Duration convert(String value) {
        try {
            return Durations.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException("'" + value + "' is not a duration (e.g. 500ms, 10s, 5m, 1h)");
        }
    }
}
