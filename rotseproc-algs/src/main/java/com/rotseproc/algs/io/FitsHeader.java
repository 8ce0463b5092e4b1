package com.rotseproc.algs.io;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Keyword values of a FITS header, in card order. String values are unquoted. */
public final class FitsHeader {
    private final Map<String, String> values;

    FitsHeader(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<String> value(String keyword) {
        return Optional.ofNullable(values.get(keyword));
    }

    public String text(String keyword) throws IOException {
        return value(keyword).orElseThrow(() -> new IOException("FITS header has no " + keyword));
    }

    public double number(String keyword) throws IOException {
        String raw = text(keyword);
        try {
            return Double.parseDouble(raw.replace('D', 'E'));
        } catch (NumberFormatException e) {
            throw new IOException("FITS keyword " + keyword + " is not numeric: " + raw, e);
        }
    }

    public double number(String keyword, double fallback) throws IOException {
        return values.containsKey(keyword) ? number(keyword) : fallback;
    }

    public int integer(String keyword) throws IOException {
        double v = number(keyword);
        if (v != Math.rint(v)) throw new IOException("FITS keyword " + keyword + " is not an integer: " + v);
        return (int) v;
    }

    public Map<String, String> asMap() {
        return values;
    }

    /** Parses one 80-character card into {@code into}; returns false at {@code END}. */
    static boolean parseCard(String card, Map<String, String> into) {
        String keyword = card.substring(0, Math.min(8, card.length())).trim();
        if ("END".equals(keyword)) return false;
        if (keyword.isEmpty() || card.length() < 10 || card.charAt(8) != '=') return true; // COMMENT, HISTORY, blank

        String rest = card.substring(10);
        String value;
        int start = rest.indexOf('\'');
        if (start >= 0 && rest.substring(0, start).isBlank()) {
            StringBuilder sb = new StringBuilder();
            int i = start + 1;
            while (i < rest.length()) {
                char c = rest.charAt(i);
                if (c == '\'') {
                    if (i + 1 < rest.length() && rest.charAt(i + 1) == '\'') {
                        sb.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                sb.append(c);
                i++;
            }
            value = sb.toString().stripTrailing();
        } else {
            int slash = rest.indexOf('/');
            value = (slash >= 0 ? rest.substring(0, slash) : rest).trim();
        }
        into.putIfAbsent(keyword, value);
        return true;
    }
}
