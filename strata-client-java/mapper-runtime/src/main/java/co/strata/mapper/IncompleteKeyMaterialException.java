package co.strata.mapper;

/** A derived key could not be computed because one of its source values is absent. */
public class IncompleteKeyMaterialException extends MappingException {

  private final String missingSource;

  public IncompleteKeyMaterialException(String entityId, String fieldName, String missingSource) {
    super("source field '" + missingSource + "' has no value", entityId, fieldName, null,
        Operation.COMPUTE_KEY, null);
    this.missingSource = missingSource;
  }

  public String missingSource() { return missingSource; }
}
