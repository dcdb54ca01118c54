package co.strata.mapper;

/**
 * A single mapping operation failed. Carries the entity shape, the field and, when there is
 * one, the raw record being read, so callers can report the failure without re-reading input.
 */
public class MappingException extends RuntimeException {

  public enum Operation { ENCODE, DECODE, COMPUTE_KEY, EXTRACT_KEY, CONSTRUCT, ENCRYPT, DECRYPT }

  private final String entityId;
  private final String fieldName;
  private final RawRecord record;
  private final Operation operation;

  public MappingException(String message, String entityId, String fieldName, RawRecord record,
                          Operation operation, Throwable cause) {
    super(describe(message, entityId, fieldName, operation), cause);
    this.entityId = entityId;
    this.fieldName = fieldName;
    this.record = record;
    this.operation = operation;
  }

  public String entityId() { return entityId; }

  public String fieldName() { return fieldName; }

  /** Record being read, or {@code null} on the write path. */
  public RawRecord record() { return record; }

  public Operation operation() { return operation; }

  private static String describe(String message, String entityId, String fieldName, Operation operation) {
    StringBuilder sb = new StringBuilder();
    sb.append(operation).append(' ');
    if (entityId != null) sb.append(entityId);
    if (fieldName != null) sb.append(entityId != null ? "." : "").append(fieldName);
    return sb.append(": ").append(message).toString();
  }
}
