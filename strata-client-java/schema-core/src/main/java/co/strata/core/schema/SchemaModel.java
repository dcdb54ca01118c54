package co.strata.core.schema;

import co.strata.core.KeyRole;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one entity shape: its fields, key roles, derived-key rules,
 * relationships and discriminator.
 *
 * <p>Instances are produced by {@link SchemaBuilder} after validation and are safe to share
 * between threads without synchronization. Everything the mappers need per call is
 * precomputed here.
 */
public final class SchemaModel {

  private final String entityId;
  private final String tableName;
  private final List<FieldDescriptor> fields;
  private final List<RelationshipDescriptor> relationships;
  private final DiscriminatorRule discriminator;

  private final Map<String, FieldDescriptor> bySourceName;
  private final Map<String, FieldDescriptor> byStoredName;
  private final FieldDescriptor partitionKey;
  private final FieldDescriptor sortKey;
  private final List<FieldDescriptor> storedFields;
  private final List<FieldDescriptor> derivedFieldsInOrder;
  private final List<FieldDescriptor> extractedFields;
  private final List<String> requiredAttributes;

  SchemaModel(String entityId,
              String tableName,
              List<FieldDescriptor> fields,
              List<RelationshipDescriptor> relationships,
              DiscriminatorRule discriminator,
              List<FieldDescriptor> derivedFieldsInOrder) {
    this.entityId = entityId;
    this.tableName = tableName;
    this.fields = List.copyOf(fields);
    this.relationships = List.copyOf(relationships);
    this.discriminator = discriminator == null ? DiscriminatorRule.NONE : discriminator;
    this.derivedFieldsInOrder = List.copyOf(derivedFieldsInOrder);

    Map<String, FieldDescriptor> source = new LinkedHashMap<>();
    Map<String, FieldDescriptor> stored = new LinkedHashMap<>();
    List<FieldDescriptor> storedList = new ArrayList<>();
    List<FieldDescriptor> extracted = new ArrayList<>();
    List<String> required = new ArrayList<>();
    FieldDescriptor pk = null;
    FieldDescriptor sk = null;
    for (FieldDescriptor f : this.fields) {
      source.put(f.sourceName(), f);
      if (f.isStored()) {
        stored.put(f.storedName(), f);
        storedList.add(f);
        if (f.required()) required.add(f.storedName());
      } else {
        extracted.add(f);
      }
      if (f.keyRole() == KeyRole.PARTITION) pk = f;
      if (f.keyRole() == KeyRole.SORT) sk = f;
    }
    if (pk == null) {
      throw new IllegalStateException(entityId + " has no partition key");
    }
    this.bySourceName = Collections.unmodifiableMap(source);
    this.byStoredName = Collections.unmodifiableMap(stored);
    this.storedFields = List.copyOf(storedList);
    this.extractedFields = List.copyOf(extracted);
    this.requiredAttributes = List.copyOf(required);
    this.partitionKey = pk;
    this.sortKey = sk;
  }

  public String entityId() { return entityId; }

  public String tableName() { return tableName; }

  public List<FieldDescriptor> fields() { return fields; }

  public List<RelationshipDescriptor> relationships() { return relationships; }

  public DiscriminatorRule discriminator() { return discriminator; }

  public FieldDescriptor partitionKey() { return partitionKey; }

  public Optional<FieldDescriptor> sortKey() { return Optional.ofNullable(sortKey); }

  public Optional<FieldDescriptor> field(String sourceName) {
    return Optional.ofNullable(bySourceName.get(sourceName));
  }

  public Optional<FieldDescriptor> fieldByStoredName(String storedName) {
    return Optional.ofNullable(byStoredName.get(storedName));
  }

  /** Fields written to and read from raw records, in declaration order. */
  public List<FieldDescriptor> storedFields() { return storedFields; }

  /** Derived fields ordered so that every field comes after the derived fields it reads. */
  public List<FieldDescriptor> derivedFieldsInOrder() { return derivedFieldsInOrder; }

  public List<FieldDescriptor> extractedFields() { return extractedFields; }

  /** Stored names of the fields a record must carry to become an entity. */
  public List<String> requiredAttributes() { return requiredAttributes; }

  /** Index key fields for the given index name. */
  public List<FieldDescriptor> indexKeys(String indexName) {
    List<FieldDescriptor> keys = new ArrayList<>();
    for (FieldDescriptor f : fields) {
      if (f.keyRole().isIndexKey() && indexName.equals(f.indexName())) keys.add(f);
    }
    return keys;
  }

  @Override
  public String toString() {
    return "SchemaModel{" + entityId + " in " + tableName + ", " + fields.size() + " fields, "
        + relationships.size() + " relationships, discriminator=" + discriminator + "}";
  }
}
