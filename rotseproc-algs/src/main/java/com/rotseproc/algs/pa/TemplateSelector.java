package com.rotseproc.algs.pa;

import java.util.List;
import java.util.Objects;

/**
 * Picks the template (reference) image from subimage names that start with {@code yymmdd}.
 *
 * <p>The earliest image is the template, unless it was taken on 31 December of the year
 * immediately before the next image's year; then it belongs with the following season's
 * data and the latest image is used instead. A single image is its own template.
 */
public final class TemplateSelector {
    private TemplateSelector() {}

    /**
     * @param sortedNames names in ascending order
     * @throws IllegalArgumentException when the list is empty
     */
    public static String select(List<String> sortedNames) {
        Objects.requireNonNull(sortedNames, "sortedNames");
        if (sortedNames.isEmpty()) throw new IllegalArgumentException("no candidate images");
        if (sortedNames.size() == 1) return sortedNames.get(0);

        String first = sortedNames.get(0);
        String second = sortedNames.get(1);
        if ("1231".equals(monthDay(first)) && year(first) == year(second) - 1) {
            return sortedNames.get(sortedNames.size() - 1);
        }
        return first;
    }

    private static String monthDay(String name) {
        return name.length() >= 6 ? name.substring(2, 6) : "";
    }

    private static int year(String name) {
        if (name.length() < 2 || !Character.isDigit(name.charAt(0)) || !Character.isDigit(name.charAt(1))) {
            throw new IllegalArgumentException("image name does not start with a year: " + name);
        }
        return Integer.parseInt(name.substring(0, 2));
    }
}
