package com.rotseproc.algs.io;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Night identifiers: {@code yymmdd} (20yy) or {@code yyyymmdd}. */
public final class Nights {
    private static final DateTimeFormatter LONG = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter SHORT = DateTimeFormatter.ofPattern("yyMMdd");

    private Nights() {}

    public static LocalDate parse(String night) {
        if (night == null || !night.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Night must be yymmdd or yyyymmdd: " + night);
        }
        try {
            if (night.length() == 8) return LocalDate.parse(night, LONG);
            if (night.length() == 6) return LocalDate.parse(night, SHORT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a valid night: " + night, e);
        }
        throw new IllegalArgumentException("Night must be yymmdd or yyyymmdd: " + night);
    }

    /** The archive form, {@code yymmdd}. */
    public static String format(LocalDate night) {
        return night.format(SHORT);
    }
}
