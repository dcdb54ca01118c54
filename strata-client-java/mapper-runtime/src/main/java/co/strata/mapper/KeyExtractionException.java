package co.strata.mapper;

/** Strict extraction found fewer key components than an extracted field needs. */
public class KeyExtractionException extends MappingException {

  private final String sourceValue;
  private final int index;

  public KeyExtractionException(String entityId, String fieldName, String sourceValue, int index,
                                int components, RawRecord record) {
    super("component " + index + " requested but '" + sourceValue + "' has " + components + " component(s)",
        entityId, fieldName, record, Operation.EXTRACT_KEY, null);
    this.sourceValue = sourceValue;
    this.index = index;
  }

  public String sourceValue() { return sourceValue; }

  public int index() { return index; }
}
