package com.codeheadsystems.hashchain.model;

/**
 * Type tag of a content field. The tag is part of the canonical form, so a string "1" and a long 1
 * never hash the same.
 */
public enum FieldType {
  STRING,
  LONG,
  DECIMAL,
  BOOLEAN,
  INSTANT,
  NULL
}
