package com.horae.cli;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Accepts full or three-letter day names, in any case: "MON", "monday", "Wed".
 */
public class DayOfWeekConverter implements ITypeConverter<DayOfWeek> {

    @Override
    public DayOfWeek convert(String value) {
        String text = value.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(text) || day.name().substring(0, 3).equals(text)) {
                return day;
            }
        }
        throw new TypeConversionException("'" + value + "' is not a day of week (e.g. MON, TUESDAY)");
    }
}
