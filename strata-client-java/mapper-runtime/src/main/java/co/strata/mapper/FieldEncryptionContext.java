package co.strata.mapper;

/**
 * What the encryption hook is told about the value it transforms.
 *
 * @param entityId entity shape the field belongs to
 * @param fieldName field name on the domain object
 * @param attributeName stored attribute name
 * @param contextId caller supplied context, e.g. a tenant id, or {@code null}
 */
public record FieldEncryptionContext(String entityId, String fieldName, String attributeName, String contextId) {
}
