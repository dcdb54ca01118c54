package co.strata.mapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sparse record as stored in a table: attribute name to {@link AttributeValueNode}.
 * Immutable; attribute order is insertion order.
 */
public final class RawRecord {

  private static final RawRecord EMPTY = new RawRecord(new LinkedHashMap<>());

  private final Map<String, AttributeValueNode> attributes;

  private RawRecord(LinkedHashMap<String, AttributeValueNode> attributes) {
    this.attributes = Collections.unmodifiableMap(attributes);
  }

  public static RawRecord of(Map<String, AttributeValueNode> attributes) {
    LinkedHashMap<String, AttributeValueNode> copy = new LinkedHashMap<>();
    attributes.forEach((name, value) -> copy.put(
        Objects.requireNonNull(name, "attribute name"),
        Objects.requireNonNull(value, () -> "value of " + name)));
    return new RawRecord(copy);
  }

  public static RawRecord empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The node stored under {@code name}, or {@code null} when absent. */
  public AttributeValueNode get(String name) {
    return attributes.get(name);
  }

  public boolean contains(String name) {
    return attributes.containsKey(name);
  }

  /** Present and not a NULL node. */
  public boolean hasValue(String name) {
    AttributeValueNode node = attributes.get(name);
    return node != null && node.kind() != AttributeValueNode.Kind.NULL;
  }

  /** Text of a string or number attribute, {@code null} otherwise. */
  public String text(String name) {
    AttributeValueNode node = attributes.get(name);
    return node == null ? null : node.text();
  }

  public Map<String, AttributeValueNode> attributes() {
    return attributes;
  }

  public Set<String> names() {
    return attributes.keySet();
  }

  public int size() {
    return attributes.size();
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RawRecord)) return false;
    return attributes.equals(((RawRecord) o).attributes);
  }

  @Override
  public int hashCode() {
    return attributes.hashCode();
  }

  @Override
  public String toString() {
    return "RawRecord" + attributes;
  }

  public static final class Builder {
    private final LinkedHashMap<String, AttributeValueNode> attributes = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String name, AttributeValueNode value) {
      attributes.put(Objects.requireNonNull(name, "attribute name"), Objects.requireNonNull(value, name));
      return this;
    }

    public Builder s(String name, String value) {
      return put(name, AttributeValueNode.s(value));
    }

    public Builder n(String name, Object value) {
      return put(name, AttributeValueNode.n(String.valueOf(value)));
    }

    public RawRecord build() {
      return new RawRecord(new LinkedHashMap<>(attributes));
    }
  }
}
