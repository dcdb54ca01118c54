package co.strata.mapper;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One attribute value as stored in a record: exactly one of the store's value variants.
 *
 * <p>Nodes are immutable. Container nodes copy their contents on construction.
 */
public sealed interface AttributeValueNode {

  enum Kind { S, N, B, SS, NS, BS, L, M, BOOL, NULL }

  Kind kind();

  /** Text of a string or number node, {@code null} for every other variant. */
  default String text() {
    return null;
  }

  static AttributeValueNode s(String value) {
    return new StringValue(value);
  }

  static AttributeValueNode n(String value) {
    return new NumberValue(value);
  }

  static AttributeValueNode b(byte[] value) {
    return new BinaryValue(value);
  }

  static AttributeValueNode bool(boolean value) {
    return new BoolValue(value);
  }

  static AttributeValueNode nul() {
    return NullValue.INSTANCE;
  }

  record StringValue(String value) implements AttributeValueNode {
    public StringValue {
      if (value == null) throw new IllegalArgumentException("S value cannot be null");
    }
    @Override public Kind kind() { return Kind.S; }
    @Override public String text() { return value; }
  }

  record NumberValue(String value) implements AttributeValueNode {
    public NumberValue {
      if (value == null || value.isEmpty()) throw new IllegalArgumentException("N value cannot be empty");
    }
    @Override public Kind kind() { return Kind.N; }
    @Override public String text() { return value; }
  }

  record BinaryValue(byte[] value) implements AttributeValueNode {
    public BinaryValue {
      if (value == null) throw new IllegalArgumentException("B value cannot be null");
      value = value.clone();
    }
    @Override public byte[] value() { return value.clone(); }
    @Override public Kind kind() { return Kind.B; }

    @Override
    public boolean equals(Object o) {
      return o instanceof BinaryValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "BinaryValue[" + Base64.getEncoder().encodeToString(value) + "]";
    }
  }

  record StringSetValue(List<String> values) implements AttributeValueNode {
    public StringSetValue {
      values = List.copyOf(values);
    }
    @Override public Kind kind() { return Kind.SS; }
  }

  record NumberSetValue(List<String> values) implements AttributeValueNode {
    public NumberSetValue {
      values = List.copyOf(values);
    }
    @Override public Kind kind() { return Kind.NS; }
  }

  /** Binary set. Elements are read-only buffers. */
  record BinarySetValue(List<ByteBuffer> values) implements AttributeValueNode {
    public BinarySetValue {
      List<ByteBuffer> copy = new ArrayList<>(values.size());
      for (ByteBuffer b : values) {
        ByteBuffer dup = b.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        copy.add(ByteBuffer.wrap(bytes).asReadOnlyBuffer());
      }
      values = Collections.unmodifiableList(copy);
    }
    @Override public Kind kind() { return Kind.BS; }
  }

  /** List of nodes. Elements may be {@link NullValue}. */
  record ListValue(List<AttributeValueNode> values) implements AttributeValueNode {
    public ListValue {
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }
    @Override public Kind kind() { return Kind.L; }
  }

  record MapValue(Map<String, AttributeValueNode> values) implements AttributeValueNode {
    public MapValue {
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
    @Override public Kind kind() { return Kind.M; }
  }

  record BoolValue(boolean value) implements AttributeValueNode {
    @Override public Kind kind() { return Kind.BOOL; }
  }

  record NullValue() implements AttributeValueNode {
    static final NullValue INSTANCE = new NullValue();
    @Override public Kind kind() { return Kind.NULL; }
  }
}
