package com.gentoro.morphie.ast;

/** The kinds accepted by {@link Types#make(TypeKind, Object)}. */
public enum TypeKind {
  BOOL,
  INT,
  STRING,
  NULLABLE,
  TAGGED,
  COMPOSITE
}
