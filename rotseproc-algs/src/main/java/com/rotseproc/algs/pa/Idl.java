package com.rotseproc.algs.pa;

import java.math.BigDecimal;
import java.util.List;
import java.util.StringJoiner;

/** Builds the single IDL statement passed after {@code -e}. */
final class Idl {
    private Idl() {}

    static String call(String procedure, String... args) {
        StringJoiner j = new StringJoiner(",");
        j.add(procedure);
        for (String a : args) j.add(a);
        return j.toString();
    }

    static String fileSearch(String pattern) {
        return "file_search(" + quote(pattern) + ")";
    }

    static String array(List<String> values) {
        StringJoiner j = new StringJoiner(",", "[", "]");
        for (String v : values) j.add(quote(v));
        return j.toString();
    }

    static String keyword(String name, double value) {
        return name + "=" + number(value);
    }

    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) throw new IllegalArgumentException("not a finite number: " + value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
