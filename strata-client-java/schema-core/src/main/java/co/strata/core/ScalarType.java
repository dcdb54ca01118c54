package co.strata.core;

/**
 * Logical value category of a field, independent of how many values it holds.
 */
public enum ScalarType {
  STRING, NUMBER, BOOLEAN, BINARY, DATETIME, ENUM, NESTED
}
