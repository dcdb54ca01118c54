package co.strata.mapper;

import co.strata.core.FieldType;
import co.strata.core.schema.FieldDescriptor;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts single field values between their Java form and {@link AttributeValueNode}s.
 *
 * <p>Java value types per field type:
 * <pre>
 *   string                       String (S)
 *   number.int/long/float/double Integer/Long/Float/Double (N)
 *   number.decimal               BigDecimal (N)
 *   boolean                      Boolean (BOOL)
 *   binary                       byte[] (B)
 *   timestamp                    OffsetDateTime (S)
 *   timestamp.date               LocalDate (S)
 *   timestamp.epoch              Instant, epoch milliseconds (N)
 *   enum                         String, or any Java enum on write (S)
 *   map                          Map&lt;String, Object&gt; (M)
 *   list                         List&lt;Object&gt; (L)
 *   stringSet / numberSet.* / binarySet  Set of String / Number / ByteBuffer (SS / NS / BS)
 * </pre>
 *
 * <p>{@code null} and empty sets encode to a NULL node; whether that node is written is the
 * record mapper's decision. A declared format is applied on write only. A formatted number is
 * stored as S since the formatted text is not necessarily a valid number. Reads parse the
 * canonical text first and fall back to the declared format.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class ValueCodec {

  private static final DecimalFormatSymbols ROOT_SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

  public AttributeValueNode encode(Object value, FieldDescriptor field) {
    if (value == null) return AttributeValueNode.nul();
    FieldType type = field.type();
    try {
      switch (type) {
        case STRING:
          return AttributeValueNode.s(checkEnum(asText(value, field), field));
        case ENUM:
          return AttributeValueNode.s(checkEnum(asText(value, field), field));
        case INT:
        case LONG:
        case FLOAT:
        case DOUBLE:
        case DECIMAL:
          if (field.format() != null) {
            BigDecimal number = checkRange(toBigDecimal(value, field), type);
            return AttributeValueNode.s(decimalFormat(field.format()).format(number));
          }
          return AttributeValueNode.n(canonicalNumber(value, field));
        case BOOLEAN:
          return AttributeValueNode.bool(expect(value, Boolean.class, field));
        case BINARY:
          return AttributeValueNode.b(toBytes(value, field));
        case TIMESTAMP:
        case DATE:
        case EPOCH:
          return encodeTime(value, field);
        case MAP:
          return encodeUntyped(expect(value, Map.class, field), field);
        case LIST:
          return encodeList(expect(value, List.class, field), field);
        case STRING_SET:
        case INT_SET:
        case LONG_SET:
        case FLOAT_SET:
        case DOUBLE_SET:
        case DECIMAL_SET:
        case BINARY_SET:
          return encodeSet(expect(value, Collection.class, field), field);
        default:
          throw ConversionException.encoding(field.sourceName(), type, "unsupported type " + type, null);
      }
    } catch (ConversionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw ConversionException.encoding(field.sourceName(), type,
          "cannot encode " + value.getClass().getSimpleName() + " as " + type.typeName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Decode a node. A NULL node and a missing attribute ({@code node == null}) both decode to
   * {@code null}.
   *
   * @throws ConversionException if the node variant does not fit the field type or its text
   *                             cannot be parsed
   */
  public Object decode(AttributeValueNode node, FieldDescriptor field) {
    if (node == null || node.kind() == AttributeValueNode.Kind.NULL) return null;
    FieldType type = field.type();
    try {
      switch (type) {
        case STRING:
          return checkEnum(requireKind(node, field, AttributeValueNode.Kind.S).text(), field);
        case ENUM:
          return checkEnum(requireKind(node, field, AttributeValueNode.Kind.S).text(), field);
        case INT:
        case LONG:
        case FLOAT:
        case DOUBLE:
        case DECIMAL:
          return parseNumber(requireText(node, field), field);
        case BOOLEAN:
          return ((AttributeValueNode.BoolValue) requireKind(node, field, AttributeValueNode.Kind.BOOL)).value();
        case BINARY:
          return ((AttributeValueNode.BinaryValue) requireKind(node, field, AttributeValueNode.Kind.B)).value();
        case TIMESTAMP:
        case DATE:
          return parseTime(requireKind(node, field, AttributeValueNode.Kind.S).text(), field);
        case EPOCH:
          return parseTime(requireText(node, field), field);
        case MAP:
          return decodeUntyped(requireKind(node, field, AttributeValueNode.Kind.M));
        case LIST:
          return decodeList((AttributeValueNode.ListValue) requireKind(node, field, AttributeValueNode.Kind.L), field);
        case STRING_SET:
          return new LinkedHashSet<>(
              ((AttributeValueNode.StringSetValue) requireKind(node, field, AttributeValueNode.Kind.SS)).values());
        case INT_SET:
        case LONG_SET:
        case FLOAT_SET:
        case DOUBLE_SET:
        case DECIMAL_SET:
          return decodeNumberSet(
              (AttributeValueNode.NumberSetValue) requireKind(node, field, AttributeValueNode.Kind.NS), field);
        case BINARY_SET:
          return new LinkedHashSet<>(
              ((AttributeValueNode.BinarySetValue) requireKind(node, field, AttributeValueNode.Kind.BS)).values());
        default:
          throw ConversionException.decoding(field.sourceName(), node, type, "unsupported type " + type, null);
      }
    } catch (ConversionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw ConversionException.decoding(field.sourceName(), node, type,
          "cannot decode " + node.kind() + " as " + type.typeName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Text of a value as it appears inside a composite key.
   *
   * @param format placeholder format overriding the field's own format, or {@code null}
   */
  public String toKeyText(Object value, FieldDescriptor field, String format) {
    if (format == null || format.equals(field.format())) {
      AttributeValueNode node = encode(value, field);
      if (node.text() != null) return node.text();
      if (node instanceof AttributeValueNode.BoolValue b) return Boolean.toString(b.value());
      if (node instanceof AttributeValueNode.BinaryValue b) return Base64.getEncoder().encodeToString(b.value());
      throw ConversionException.encoding(field.sourceName(), field.type(),
          field.type().typeName() + " values cannot be part of a key", null);
    }
    if (!field.type().isFormattable()) {
      throw ConversionException.encoding(field.sourceName(), field.type(),
          "key format '" + format + "' does not apply to " + field.type().typeName() + " values", null);
    }
    return encode(value, withFormat(field, format)).text();
  }

  /** Parse one component of a composite key into the field's Java type. */
  public Object fromKeyText(String text, FieldDescriptor field) {
    if (text == null) return null;
    switch (field.type()) {
      case BOOLEAN:
        if (text.equals("true") || text.equals("false")) return Boolean.valueOf(text);
        throw ConversionException.decoding(field.sourceName(), AttributeValueNode.s(text), field.type(),
            "'" + text + "' is not a boolean", null);
      case BINARY:
        try {
          return Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
          throw ConversionException.decoding(field.sourceName(), AttributeValueNode.s(text), field.type(),
              "'" + text + "' is not base64", e);
        }
      default:
        return decode(AttributeValueNode.s(text), field);
    }
  }

  // =========================================================================
  // Scalars
  // =========================================================================

  private static String asText(Object value, FieldDescriptor field) {
    if (value instanceof Enum<?> e) return e.name();
    return expect(value, String.class, field);
  }

  private static String checkEnum(String value, FieldDescriptor field) {
    if (!field.enumValues().isEmpty() && !field.enumValues().contains(value)) {
      throw new IllegalArgumentException("'" + value + "' is not one of " + field.enumValues());
    }
    return value;
  }

  private static String canonicalNumber(Object value, FieldDescriptor field) {
    checkRange(toBigDecimal(value, field), field.type());
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return value.toString();
    }
    return toBigDecimal(value, field).toPlainString();
  }

  private static BigDecimal toBigDecimal(Object value, FieldDescriptor field) {
    if (value instanceof BigDecimal b) return b;
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException(value + " cannot be stored as a number");
      }
      // Float.toString gives the shortest text that reads back as the same float
      return new BigDecimal(value.toString());
    }
    if (value instanceof Number n) return new BigDecimal(n.toString());
    throw new IllegalArgumentException("expected a number for " + field.sourceName() + " but got "
        + value.getClass().getName());
  }

  private static Object parseNumber(String text, FieldDescriptor field) {
    BigDecimal number;
    try {
      number = new BigDecimal(text);
    } catch (NumberFormatException e) {
      if (field.format() == null) throw e;
      DecimalFormat format = decimalFormat(field.format());
      format.setParseBigDecimal(true);
      ParsePosition pos = new ParsePosition(0);
      Number parsed = format.parse(text, pos);
      if (parsed == null || pos.getIndex() != text.length()) {
        throw new NumberFormatException("'" + text + "' matches neither a number nor format " + field.format());
      }
      number = (BigDecimal) parsed;
    }
    return toNumberType(number, field.type());
  }

  /** Integer types only take values that decode back without rounding or overflow. */
  private static BigDecimal checkRange(BigDecimal number, FieldType type) {
    try {
      toNumberType(number, type);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(number.toPlainString() + " does not fit " + type.typeName(), e);
    }
    return number;
  }

  private static Object toNumberType(BigDecimal number, FieldType type) {
    return switch (type) {
      case INT, INT_SET -> number.stripTrailingZeros().intValueExact();
      case LONG, LONG_SET, EPOCH -> number.stripTrailingZeros().longValueExact();
      case FLOAT, FLOAT_SET -> Float.parseFloat(number.toString());
      case DOUBLE, DOUBLE_SET -> Double.parseDouble(number.toString());
      default -> number;
    };
  }

  private static byte[] toBytes(Object value, FieldDescriptor field) {
    if (value instanceof byte[] bytes) return bytes;
    if (value instanceof ByteBuffer buffer) {
      ByteBuffer dup = buffer.duplicate();
      byte[] bytes = new byte[dup.remaining()];
      dup.get(bytes);
      return bytes;
    }
    throw new IllegalArgumentException("expected byte[] for " + field.sourceName() + " but got "
        + value.getClass().getName());
  }

  private static <V> V expect(Object value, Class<V> type, FieldDescriptor field) {
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("expected " + type.getSimpleName() + " for " + field.sourceName()
          + " but got " + value.getClass().getName());
    }
    return type.cast(value);
  }

  private static DecimalFormat decimalFormat(String pattern) {
    return new DecimalFormat(pattern, ROOT_SYMBOLS);
  }

  // =========================================================================
  // Date and time
  // =========================================================================

  private static AttributeValueNode encodeTime(Object value, FieldDescriptor field) {
    switch (field.type()) {
      case EPOCH: {
        Instant instant = toOffsetDateTime(value, field).toInstant();
        return AttributeValueNode.n(Long.toString(instant.toEpochMilli()));
      }
      case DATE: {
        LocalDate date = value instanceof LocalDate d ? d : toOffsetDateTime(value, field).toLocalDate();
        return AttributeValueNode.s(field.format() == null
            ? DateTimeFormatter.ISO_LOCAL_DATE.format(date)
            : DateTimeFormatter.ofPattern(field.format(), Locale.ROOT).format(date));
      }
      default: {
        OffsetDateTime time = toOffsetDateTime(value, field);
        // a pattern may drop the offset, and decoding reads it back in zoneOf(field)
        if (field.timezone() != null || field.format() != null) {
          time = time.atZoneSameInstant(zoneOf(field)).toOffsetDateTime();
        }
        return AttributeValueNode.s(field.format() == null
            ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time)
            : DateTimeFormatter.ofPattern(field.format(), Locale.ROOT).format(time));
      }
    }
  }

  private static OffsetDateTime toOffsetDateTime(Object value, FieldDescriptor field) {
    if (value instanceof OffsetDateTime t) return t;
    if (value instanceof Instant i) return i.atOffset(ZoneOffset.UTC);
    if (value instanceof ZonedDateTime z) return z.toOffsetDateTime();
    if (value instanceof LocalDate d) return d.atStartOfDay(zoneOf(field)).toOffsetDateTime();
    throw new IllegalArgumentException("expected a date-time for " + field.sourceName() + " but got "
        + value.getClass().getName());
  }

  private static Object parseTime(String text, FieldDescriptor field) {
    switch (field.type()) {
      case EPOCH:
        return Instant.ofEpochMilli((Long) toNumberType(new BigDecimal(text), FieldType.EPOCH));
      case DATE:
        try {
          return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
          if (field.format() == null) throw e;
          return LocalDate.parse(text, DateTimeFormatter.ofPattern(field.format(), Locale.ROOT));
        }
      default:
        OffsetDateTime time;
        try {
          time = OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
          if (field.format() == null) throw e;
          time = parseFormatted(text, field);
        }
        return field.timezone() == null ? time : time.atZoneSameInstant(field.timezone()).toOffsetDateTime();
    }
  }

  /** Formatted text may lack the offset or the time; those default to the declared zone and midnight. */
  private static OffsetDateTime parseFormatted(String text, FieldDescriptor field) {
    DateTimeFormatter formatter = DateTimeFormatter.ofPattern(field.format(), Locale.ROOT);
    TemporalAccessor parsed = formatter.parseBest(text,
        OffsetDateTime::from, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
    if (parsed instanceof OffsetDateTime t) return t;
    if (parsed instanceof ZonedDateTime z) return z.toOffsetDateTime();
    if (parsed instanceof LocalDateTime l) return l.atZone(zoneOf(field)).toOffsetDateTime();
    return ((LocalDate) parsed).atStartOfDay(zoneOf(field)).toOffsetDateTime();
  }

  private static ZoneId zoneOf(FieldDescriptor field) {
    return field.timezone() == null ? ZoneOffset.UTC : field.timezone();
  }

  // =========================================================================
  // Containers
  // =========================================================================

  private AttributeValueNode encodeList(List<?> values, FieldDescriptor field) {
    List<AttributeValueNode> nodes = new ArrayList<>(values.size());
    FieldDescriptor element = field.elementType() == null ? null : field.elementDescriptor();
    for (Object v : values) {
      nodes.add(element == null ? encodeUntyped(v, field) : encode(v, element));
    }
    return new AttributeValueNode.ListValue(nodes);
  }

  private Object decodeList(AttributeValueNode.ListValue node, FieldDescriptor field) {
    List<Object> values = new ArrayList<>(node.values().size());
    FieldDescriptor element = field.elementType() == null ? null : field.elementDescriptor();
    for (AttributeValueNode n : node.values()) {
      values.add(element == null ? decodeUntyped(n) : decode(n, element));
    }
    return values;
  }

  private static AttributeValueNode encodeSet(Collection<?> values, FieldDescriptor field) {
    if (values.isEmpty()) return AttributeValueNode.nul();
    switch (field.type()) {
      case STRING_SET: {
        List<String> strings = new ArrayList<>(values.size());
        for (Object v : values) strings.add(expect(v, String.class, field));
        return new AttributeValueNode.StringSetValue(strings);
      }
      case BINARY_SET: {
        List<ByteBuffer> buffers = new ArrayList<>(values.size());
        for (Object v : values) buffers.add(ByteBuffer.wrap(toBytes(v, field)));
        return new AttributeValueNode.BinarySetValue(buffers);
      }
      default: {
        List<String> numbers = new ArrayList<>(values.size());
        for (Object v : values) numbers.add(canonicalNumber(v, field));
        return new AttributeValueNode.NumberSetValue(numbers);
      }
    }
  }

  private static Set<Object> decodeNumberSet(AttributeValueNode.NumberSetValue node, FieldDescriptor field) {
    Set<Object> values = new LinkedHashSet<>();
    for (String n : node.values()) {
      values.add(toNumberType(new BigDecimal(n), field.type()));
    }
    return values;
  }

  /** Nested documents carry no schema; the Java type picks the variant. */
  private AttributeValueNode encodeUntyped(Object value, FieldDescriptor field) {
    if (value == null) return AttributeValueNode.nul();
    if (value instanceof String s) return AttributeValueNode.s(s);
    if (value instanceof Boolean b) return AttributeValueNode.bool(b);
    if (value instanceof Number) return AttributeValueNode.n(canonicalNumber(value, field));
    if (value instanceof byte[] || value instanceof ByteBuffer) return AttributeValueNode.b(toBytes(value, field));
    if (value instanceof Enum<?> e) return AttributeValueNode.s(e.name());
    if (value instanceof Map<?, ?> map) {
      Map<String, AttributeValueNode> nodes = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : map.entrySet()) {
        nodes.put(String.valueOf(e.getKey()), encodeUntyped(e.getValue(), field));
      }
      return new AttributeValueNode.MapValue(nodes);
    }
    if (value instanceof List<?> list) {
      List<AttributeValueNode> nodes = new ArrayList<>(list.size());
      for (Object v : list) nodes.add(encodeUntyped(v, field));
      return new AttributeValueNode.ListValue(nodes);
    }
    if (value instanceof Set<?> set) {
      if (set.isEmpty()) return AttributeValueNode.nul();
      Object first = set.iterator().next();
      FieldType setType = first instanceof String ? FieldType.STRING_SET
          : first instanceof Number ? FieldType.DECIMAL_SET : FieldType.BINARY_SET;
      return encodeSet(set, FieldDescriptor.of(field.sourceName(), setType));
    }
    throw new IllegalArgumentException("cannot store " + value.getClass().getName() + " in a nested document");
  }

  private Object decodeUntyped(AttributeValueNode node) {
    if (node instanceof AttributeValueNode.StringValue s) return s.value();
    if (node instanceof AttributeValueNode.NumberValue n) return new BigDecimal(n.value());
    if (node instanceof AttributeValueNode.BoolValue b) return b.value();
    if (node instanceof AttributeValueNode.BinaryValue b) return b.value();
    if (node instanceof AttributeValueNode.StringSetValue ss) return new LinkedHashSet<>(ss.values());
    if (node instanceof AttributeValueNode.NumberSetValue ns) {
      Set<Object> values = new LinkedHashSet<>();
      for (String n : ns.values()) values.add(new BigDecimal(n));
      return values;
    }
    if (node instanceof AttributeValueNode.BinarySetValue bs) return new LinkedHashSet<>(bs.values());
    if (node instanceof AttributeValueNode.ListValue l) {
      List<Object> values = new ArrayList<>(l.values().size());
      for (AttributeValueNode n : l.values()) values.add(decodeUntyped(n));
      return values;
    }
    if (node instanceof AttributeValueNode.MapValue m) {
      Map<String, Object> values = new LinkedHashMap<>();
      m.values().forEach((k, v) -> values.put(k, decodeUntyped(v)));
      return values;
    }
    return null;
  }

  // =========================================================================
  // Helpers
  // =========================================================================

  private static AttributeValueNode requireKind(AttributeValueNode node, FieldDescriptor field,
                                                AttributeValueNode.Kind kind) {
    if (node.kind() != kind) {
      throw ConversionException.decoding(field.sourceName(), node, field.type(),
          "expected " + kind + " for " + field.type().typeName() + " but found " + node.kind(), null);
    }
    return node;
  }

  /** Numbers are N, or S when they were written with a display format. */
  private static String requireText(AttributeValueNode node, FieldDescriptor field) {
    if (node.kind() != AttributeValueNode.Kind.N && node.kind() != AttributeValueNode.Kind.S) {
      throw ConversionException.decoding(field.sourceName(), node, field.type(),
          "expected N for " + field.type().typeName() + " but found " + node.kind(), null);
    }
    return node.text();
  }

  private static FieldDescriptor withFormat(FieldDescriptor f, String format) {
    return new FieldDescriptor(f.sourceName(), f.storedName(), f.type(), f.elementType(), f.nullable(),
        f.required(), f.storeNull(), f.keyRole(), f.indexName(), format, f.timezone(), f.enumValues(),
        f.encrypted(), null, null);
  }
}
