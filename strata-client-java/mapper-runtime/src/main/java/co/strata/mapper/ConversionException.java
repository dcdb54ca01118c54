package co.strata.mapper;

import co.strata.core.FieldType;

/** A value could not be converted between its Java form and its stored node. */
public class ConversionException extends MappingException {

  private final AttributeValueNode node;
  private final FieldType targetType;

  public ConversionException(String message, String entityId, String fieldName, AttributeValueNode node,
                             FieldType targetType, RawRecord record, Operation operation, Throwable cause) {
    super(message, entityId, fieldName, record, operation, cause);
    this.node = node;
    this.targetType = targetType;
  }

  static ConversionException decoding(String fieldName, AttributeValueNode node, FieldType targetType,
                                      String message, Throwable cause) {
    return new ConversionException(message, null, fieldName, node, targetType, null, Operation.DECODE, cause);
  }

  static ConversionException encoding(String fieldName, FieldType targetType, String message, Throwable cause) {
    return new ConversionException(message, null, fieldName, null, targetType, null, Operation.ENCODE, cause);
  }

  /** Same failure, attributed to an entity shape and the record being read. */
  public ConversionException withContext(String entityId, RawRecord record) {
    return new ConversionException(detail(), entityId, fieldName(), node, targetType, record, operation(),
        getCause());
  }

  /** Offending node, {@code null} when encoding. */
  public AttributeValueNode node() { return node; }

  public FieldType targetType() { return targetType; }

  /** Message without the operation and field prefix. */
  String detail() {
    String message = getMessage();
    int colon = message.indexOf(": ");
    return colon < 0 ? message : message.substring(colon + 2);
  }
}
