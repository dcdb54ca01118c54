package co.strata.core.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The models compiled together from one batch of definitions. Relationship targets
 * are resolved here.
 */
public final class SchemaCatalog {

  private final Map<String, SchemaModel> models;

  SchemaCatalog(List<SchemaModel> models) {
    Map<String, SchemaModel> byId = new LinkedHashMap<>();
    for (SchemaModel m : models) {
      byId.put(m.entityId(), m);
    }
    this.models = Collections.unmodifiableMap(byId);
  }

  public Optional<SchemaModel> get(String entityId) {
    return Optional.ofNullable(models.get(entityId));
  }

  /**
   * @throws IllegalArgumentException if no model has that id
   */
  public SchemaModel require(String entityId) {
    SchemaModel m = models.get(entityId);
    if (m == null) {
      throw new IllegalArgumentException("Unknown entity: " + entityId + " (known: " + models.keySet() + ")");
    }
    return m;
  }

  public Collection<SchemaModel> models() {
    return models.values();
  }

  /** Shapes stored in one table, in definition order. */
  public List<SchemaModel> modelsForTable(String tableName) {
    List<SchemaModel> result = new ArrayList<>();
    for (SchemaModel m : models.values()) {
      if (m.tableName().equals(tableName)) result.add(m);
    }
    return result;
  }

  public SchemaModel relationshipTarget(RelationshipDescriptor relationship) {
    return require(relationship.targetEntity());
  }

  public int size() {
    return models.size();
  }
}
