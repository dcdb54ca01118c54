package co.strata.core.schema;

import java.util.Optional;

/**
 * What to do when a composite key has fewer components than an extracted field expects.
 */
public enum ExtractionPolicy {
  /** Leave the extracted field absent. */
  LENIENT,
  /** Fail the read. */
  STRICT;

  public static Optional<ExtractionPolicy> parse(String s) {
    if (s == null || s.isEmpty()) return Optional.empty();
    return switch (s.toLowerCase()) {
      case "lenient" -> Optional.of(LENIENT);
      case "strict" -> Optional.of(STRICT);
      default -> Optional.empty();
    };
  }
}
