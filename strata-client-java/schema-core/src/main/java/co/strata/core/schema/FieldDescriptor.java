package co.strata.core.schema;

import co.strata.core.FieldType;
import co.strata.core.KeyRole;
import co.strata.core.ScalarType;
import java.time.ZoneId;
import java.util.List;

/**
 * Compiled description of one field of an entity shape.
 *
 * <p>A field is plain, derived ({@link #derivedFrom} set) or extracted ({@link #extractedFrom}
 * set), never more than one. Extracted fields are not stored.
 *
 * @param sourceName name of the field on the domain object
 * @param storedName attribute name in the raw record
 * @param type declared type
 * @param elementType element type of {@code list} and set fields, {@code null} otherwise
 * @param nullable the field explicitly allows null
 * @param required a record without this attribute cannot be turned into an entity
 * @param storeNull a null value is written as a NULL attribute instead of being omitted
 * @param keyRole role in the primary key or an index
 * @param indexName index name for index key roles
 * @param format display format applied on write, or {@code null}
 * @param timezone zone timestamps are normalized to, or {@code null}
 * @param enumValues allowed values of {@code enum} fields, empty otherwise
 * @param encrypted value passes through the field encryption hook
 */
public record FieldDescriptor(
    String sourceName,
    String storedName,
    FieldType type,
    FieldType elementType,
    boolean nullable,
    boolean required,
    boolean storeNull,
    KeyRole keyRole,
    String indexName,
    String format,
    ZoneId timezone,
    List<String> enumValues,
    boolean encrypted,
    DerivedKeyRule derivedFrom,
    ExtractedKeyRule extractedFrom
) {

  public FieldDescriptor {
    enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    if (derivedFrom != null && extractedFrom != null) {
      throw new IllegalArgumentException(sourceName + " cannot be both derived and extracted");
    }
  }

  /** Plain string field, mostly useful in tests and hand-built models. */
  public static FieldDescriptor of(String name, FieldType type) {
    return new FieldDescriptor(name, name, type, type.isSet() ? type.elementType() : null,
        false, false, false, KeyRole.NONE, null, null, null, List.of(), false, null, null);
  }

  public boolean isDerived() {
    return derivedFrom != null;
  }

  public boolean isExtracted() {
    return extractedFrom != null;
  }

  public boolean isStored() {
    return extractedFrom == null;
  }

  public boolean isCollection() {
    return type.isCollection();
  }

  /** Scalar category; for lists this is the category of the elements. */
  public ScalarType scalarType() {
    if (type == FieldType.LIST) {
      return elementType == null ? ScalarType.NESTED : elementType.scalarType();
    }
    return type.scalarType();
  }

  public boolean isKey() {
    return keyRole != KeyRole.NONE;
  }

  /** Descriptor for one element of a list or set field, sharing this field's names and format. */
  public FieldDescriptor elementDescriptor() {
    FieldType element = elementType == null ? FieldType.MAP : elementType;
    return new FieldDescriptor(sourceName, storedName, element, null, true, false, false,
        KeyRole.NONE, null, format, timezone, enumValues, false, null, null);
  }
}
