package com.rotseproc.algs.io;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Finds preprocessed images and their products in a data archive. */
public interface DataLocator {

    /**
     * What to look for.
     *
     * @param telescope   telescope code such as {@code 3b}, or null for any
     * @param daysBefore  days before {@code night} to include
     * @param daysAfter   days after {@code night} to include
     */
    record Query(Path dataDir, LocalDate night, String telescope, String field, double daysBefore, double daysAfter) {
      public Query {
        dataDir = Objects.requireNonNull(dataDir, "dataDir");
        night = Objects.requireNonNull(night, "night");
        field = Objects.requireNonNull(field, "field");
        if (daysBefore < 0 || daysAfter < 0) throw new IllegalArgumentException("night window must not be negative");
      }
    }

    /** Images and product catalogs found for a query, each sorted by name. */
    record Found(List<Path> images, List<Path> prods) {
      public Found {
        images = List.copyOf(images);
        prods = List.copyOf(prods);
      }
    }

    /** The field whose centre lies nearest to the coordinates, if any is close enough. */
    Optional<String> resolveField(Path dataDir, double ra, double dec) throws IOException;

    Found locate(Query query) throws IOException;
}
