package co.strata.mapper;

import java.util.List;

/**
 * Entities assembled from a batch of records, in partition key discovery order, plus whatever
 * was noticed along the way.
 */
public record ReconstructionResult<T>(List<T> entities, List<MappingWarning> warnings) {

  public ReconstructionResult {
    entities = List.copyOf(entities);
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public List<MappingWarning> warnings(MappingWarning.Kind kind) {
    return warnings.stream().filter(w -> w.kind() == kind).toList();
  }
}
