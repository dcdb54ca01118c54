package co.strata.mapper;

/** The field encryption hook failed or is not configured for an encrypted field. */
public class FieldEncryptionException extends MappingException {

  public FieldEncryptionException(String message, String entityId, String fieldName, RawRecord record,
                                  Operation operation, Throwable cause) {
    super(message, entityId, fieldName, record, operation, cause);
  }
}
