package io.intellixity.docsql.schema;

/** Who assigns a primary key value. */
public enum Generated {
  /** The store generates it (auto-increment column). */
  AUTO,
  /** The caller supplies it; the column keeps its declared type. */
  USER
}
