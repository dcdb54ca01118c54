package co.strata.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field types accepted in entity definitions.
 *
 * <p>Field types support an optional dot-notation sub-type qualifier that controls
 * the Java value type without changing the stored attribute variant.
 *
 * <h3>Numeric sub-types ({@code number.*} and {@code numberSet.*})</h3>
 * <pre>
 *   number.int      → Integer    (N)
 *   number.long     → Long       (N)
 *   number.float    → Float      (N)
 *   number.double   → Double     (N)
 *   number.decimal  → BigDecimal (N)
 * </pre>
 *
 * <h3>Timestamp sub-types ({@code timestamp.*})</h3>
 * <pre>
 *   timestamp       → OffsetDateTime (ISO-8601 offset date-time, S)
 *   timestamp.epoch → Instant        (epoch milliseconds, N)
 *   timestamp.date  → LocalDate      (ISO-8601 date, S)
 * </pre>
 *
 * <p>Bare types without a suffix fall back to their default mapping:
 * {@code number} is {@code number.int}, {@code numberSet} is {@code numberSet.int}
 * and {@code bool} is an alias of {@code boolean}.
 */
public enum FieldType {
  STRING("string", ScalarType.STRING, false),
  INT("number.int", ScalarType.NUMBER, false),
  LONG("number.long", ScalarType.NUMBER, false),
  FLOAT("number.float", ScalarType.NUMBER, false),
  DOUBLE("number.double", ScalarType.NUMBER, false),
  DECIMAL("number.decimal", ScalarType.NUMBER, false),
  BOOLEAN("boolean", ScalarType.BOOLEAN, false),
  BINARY("binary", ScalarType.BINARY, false),
  TIMESTAMP("timestamp", ScalarType.DATETIME, false),
  EPOCH("timestamp.epoch", ScalarType.DATETIME, false),
  DATE("timestamp.date", ScalarType.DATETIME, false),
  ENUM("enum", ScalarType.ENUM, false),
  MAP("map", ScalarType.NESTED, false),
  LIST("list", ScalarType.NESTED, true),
  STRING_SET("stringSet", ScalarType.STRING, true),
  INT_SET("numberSet.int", ScalarType.NUMBER, true),
  LONG_SET("numberSet.long", ScalarType.NUMBER, true),
  FLOAT_SET("numberSet.float", ScalarType.NUMBER, true),
  DOUBLE_SET("numberSet.double", ScalarType.NUMBER, true),
  DECIMAL_SET("numberSet.decimal", ScalarType.NUMBER, true),
  BINARY_SET("binarySet", ScalarType.BINARY, true);

  private static final Map<String, FieldType> BY_NAME = new HashMap<>();

  static {
    for (FieldType t : values()) {
      BY_NAME.put(t.typeName, t);
    }
    BY_NAME.put("number", INT);
    BY_NAME.put("numberSet", INT_SET);
    BY_NAME.put("bool", BOOLEAN);
  }

  private final String typeName;
  private final ScalarType scalarType;
  private final boolean collection;

  FieldType(String typeName, ScalarType scalarType, boolean collection) {
    this.typeName = typeName;
    this.scalarType = scalarType;
    this.collection = collection;
  }

  /** Canonical dotted name, e.g. {@code "number.long"}. */
  public String typeName() { return typeName; }

  public ScalarType scalarType() { return scalarType; }

  public boolean isCollection() { return collection; }

  public boolean isSet() {
    return collection && this != LIST;
  }

  /** True for types whose scalar form is stored as a number (N / NS). */
  public boolean isNumeric() {
    return scalarType == ScalarType.NUMBER || this == EPOCH;
  }

  /** Types that take a display {@code format}: numbers, timestamps and dates. */
  public boolean isFormattable() {
    return this == TIMESTAMP || this == DATE || (scalarType == ScalarType.NUMBER && !collection);
  }

  /** Key attributes can only be strings, numbers or binary. */
  public boolean isKeyEligible() {
    return !collection && scalarType != ScalarType.BOOLEAN && scalarType != ScalarType.NESTED;
  }

  /** Scalar counterpart of a set type, e.g. {@code INT} for {@code INT_SET}. */
  public FieldType elementType() {
    return switch (this) {
      case STRING_SET -> STRING;
      case INT_SET -> INT;
      case LONG_SET -> LONG;
      case FLOAT_SET -> FLOAT;
      case DOUBLE_SET -> DOUBLE;
      case DECIMAL_SET -> DECIMAL;
      case BINARY_SET -> BINARY;
      default -> this;
    };
  }

  /**
   * Resolve a type string from a definition.
   *
   * @param s the type string, bare ({@code "number"}) or dot-qualified ({@code "number.int"})
   * @return the type, or empty if {@code s} is not a supported type
   */
  public static Optional<FieldType> parse(String s) {
    if (s == null || s.isEmpty()) return Optional.empty();
    return Optional.ofNullable(BY_NAME.get(s));
  }

  /**
   * Return true if {@code s} is a valid field type string.
   *
   * @param s the type string from an entity definition
   * @return true if valid
   */
  public static boolean isValid(String s) {
    return parse(s).isPresent();
  }
}
