package com.rotseproc.core;

import java.util.Objects;

/** Tag for the shape of data flowing between stages. */
public record DataKind(String name) {
  public static final DataKind IMAGE_COLLECTION = new DataKind("image-collection");
  public static final DataKind LIGHT_CURVE = new DataKind("light-curve");

  public DataKind {
    name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("data kind name must not be blank");
  }

  public static DataKind of(String name) {
    return new DataKind(name.trim());
  }

  @Override
  public String toString() {
    return name;
  }
}
