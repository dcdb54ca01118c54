package co.strata.mapper;

/**
 * A record could not be turned into an entity, either because a required attribute is missing
 * or because the entity accessor failed.
 */
public class EntityConstructionException extends MappingException {

  private final String missingField;

  public EntityConstructionException(String entityId, RawRecord record, String missingField, Throwable cause) {
    super(missingField != null
            ? "required field '" + missingField + "' is missing from the record"
            : "entity construction failed" + (cause != null ? " (" + cause.getMessage() + ")" : ""),
        entityId, missingField, record, Operation.CONSTRUCT, cause);
    this.missingField = missingField;
  }

  /** Name of the missing required field, or {@code null} when construction failed for another reason. */
  public String missingField() { return missingField; }
}
