package co.strata.core.schema;

import java.util.List;

/**
 * How a derived field is computed: source field names in declared order, combined by
 * {@code template} when present, otherwise joined with {@code separator}.
 */
public record DerivedKeyRule(List<String> sources, KeyTemplate template, String separator) {

  public DerivedKeyRule {
    sources = List.copyOf(sources);
  }

  public boolean hasTemplate() {
    return template != null;
  }
}
