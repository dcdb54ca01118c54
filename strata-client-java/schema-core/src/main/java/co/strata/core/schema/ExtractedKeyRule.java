package co.strata.core.schema;

/**
 * How an extracted field is read back: the {@code index}-th component of {@code source}
 * split by {@code separator}. A null {@code policy} defers to the mapper default.
 */
public record ExtractedKeyRule(String source, int index, String separator, ExtractionPolicy policy) {
}
