package io.intellixity.docsql.query;

public enum Clause { AND, OR }
