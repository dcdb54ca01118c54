package co.strata.core.schema;

/**
 * Records under the same partition key whose sort key matches {@code sortKeyPattern}
 * populate {@code targetFieldName}, mapped with the {@code targetEntity} model.
 */
public record RelationshipDescriptor(
    String targetFieldName,
    KeyPattern sortKeyPattern,
    String targetEntity,
    boolean collection
) {
}
