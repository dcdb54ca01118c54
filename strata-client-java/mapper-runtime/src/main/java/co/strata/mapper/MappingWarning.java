package co.strata.mapper;

/**
 * Non-fatal finding of a read: the operation went ahead, but the data or the model deserves a
 * look.
 *
 * @param kind what was noticed
 * @param message human readable description
 * @param context where, typically {@code Entity[partitionKey]}
 */
public record MappingWarning(Kind kind, String message, String context) {

  public enum Kind {
    /** A record without the partition key attribute. */
    UNKEYED_RECORD,
    /** A singular relationship matched several records; the first was kept. */
    MULTIPLE_SINGULAR_MATCHES,
    /** Several records of one group matched the primary shape; the first was kept. */
    DUPLICATE_PRIMARY,
    /** A partition key group had records but no primary record. */
    ORPHANED_CHILD_RECORDS,
    /** A record matched more than one shape; the first configured one was used. */
    AMBIGUOUS_DISCRIMINATION
  }

  @Override
  public String toString() {
    return kind + " " + context + ": " + message;
  }
}
