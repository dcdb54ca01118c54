package co.strata.core.schema;

/**
 * How records of one entity shape are told apart from other shapes in the same table.
 *
 * @param attributeName attribute carrying a type tag, or {@code null}
 * @param attributeValue matcher for the tag, present when {@code attributeName} is
 * @param sortKeyPattern matcher for the sort key, used when no tag attribute is declared
 */
public record DiscriminatorRule(String attributeName, KeyPattern attributeValue, KeyPattern sortKeyPattern) {

  public static final DiscriminatorRule NONE = new DiscriminatorRule(null, null, null);

  public boolean hasAttribute() {
    return attributeName != null;
  }

  public boolean hasSortKeyPattern() {
    return sortKeyPattern != null;
  }

  /** Neither a tag nor a sort key pattern: records are recognized by attribute presence. */
  public boolean isNone() {
    return !hasAttribute() && !hasSortKeyPattern();
  }

  /**
   * Two shapes with the same signature in one table cannot be told apart.
   * Only the rule that actually decides is part of the signature.
   */
  public String signature() {
    if (hasAttribute()) {
      return "attr:" + attributeName + "=" + attributeValue.pattern();
    }
    if (hasSortKeyPattern()) {
      return "sk:" + sortKeyPattern.pattern();
    }
    return "presence";
  }

  @Override
  public String toString() {
    return hasAttribute() || hasSortKeyPattern() ? signature() : "none";
  }
}
