package co.strata.core;

import java.util.Optional;

/** Role a field plays in the table's primary key or a global secondary index. */
public enum KeyRole {
  NONE(null),
  PARTITION("partition"),
  SORT("sort"),
  GSI_PARTITION("gsiPartition"),
  GSI_SORT("gsiSort");

  private final String definitionName;

  KeyRole(String definitionName) {
    this.definitionName = definitionName;
  }

  public String definitionName() { return definitionName; }

  public boolean isPrimaryKey() {
    return this == PARTITION || this == SORT;
  }

  public boolean isIndexKey() {
    return this == GSI_PARTITION || this == GSI_SORT;
  }

  /** A missing or blank role means {@link #NONE}. */
  public static Optional<KeyRole> parse(String s) {
    if (s == null || s.isEmpty()) return Optional.of(NONE);
    for (KeyRole role : values()) {
      if (s.equals(role.definitionName)) return Optional.of(role);
    }
    return Optional.empty();
  }
}
