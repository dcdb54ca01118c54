package co.strata.core.schema;

/**
 * Problems reported while building schema models from definitions.
 */
public enum DiagnosticCode {
  // structural
  MISSING_ENTITY_NAME,
  DUPLICATE_ENTITY,
  MISSING_TABLE_NAME,
  MISSING_FIELDS,
  MISSING_FIELD_NAME,
  DUPLICATE_FIELD,
  DUPLICATE_ATTRIBUTE_NAME,
  UNSUPPORTED_TYPE,
  INVALID_ENUM_VALUES,
  INVALID_FORMAT,
  INVALID_TIMEZONE,
  INVALID_KEY_ROLE,
  ENCRYPTED_KEY_FIELD,
  CONFLICTING_FIELD_ROLES,
  REQUIRED_AND_NULLABLE,
  MISSING_PARTITION_KEY,
  MULTIPLE_PARTITION_KEYS,
  MULTIPLE_SORT_KEYS,
  // graph
  CIRCULAR_KEY_DEPENDENCY,
  // cross-field
  INVALID_DERIVED_KEY_SOURCE,
  INVALID_DERIVED_KEY_TEMPLATE,
  INVALID_EXTRACTED_KEY_SOURCE,
  INVALID_EXTRACTED_KEY_INDEX,
  INVALID_EXTRACTION_POLICY,
  INVALID_KEY_PATTERN,
  UNKNOWN_RELATIONSHIP_TARGET,
  RELATIONSHIP_WITHOUT_SORT_KEY,
  DISCRIMINATOR_VALUE_AND_PATTERN,
  // table
  CONFLICTING_ENTITY_SHAPES
}
