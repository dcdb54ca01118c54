package co.strata.mapper;

import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One entity shape bound to a store: reads come from a {@link RecordSource}, writes go to a
 * {@link RecordSink}. Key values are the stored key values, e.g. {@code "CUSTOMER#C1"}.
 */
public class EntityTable<T> {

  private static final Logger log = LoggerFactory.getLogger(EntityTable.class);

  private final MappingContext context;
  private final SchemaModel model;
  private final RecordMapper<T> mapper;
  private final RecordSource source;
  private final RecordSink sink;

  public EntityTable(MappingContext context, String entityId, RecordSource source, RecordSink sink) {
    this.context = context;
    this.model = context.catalog().require(entityId);
    this.mapper = context.mapper(entityId);
    this.source = source;
    this.sink = sink;
  }

  public String tableName() {
    return model.tableName();
  }

  /** Entity stored under a partition key only. */
  public Optional<T> get(Object partitionKey) {
    return get(partitionKey, null);
  }

  /**
   * Single record by primary key. A record of another shape under that key reads as absent.
   *
   * @throws IllegalArgumentException if the shape has a sort key and none is given
   */
  public Optional<T> get(Object partitionKey, Object sortKey) {
    RawRecord.Builder key = RawRecord.builder();
    key.put(model.partitionKey().storedName(), keyNode(model.partitionKey(), partitionKey));
    Optional<FieldDescriptor> sortField = model.sortKey();
    if (sortField.isPresent()) {
      if (sortKey == null) {
        throw new IllegalArgumentException(model.entityId() + " needs a sort key value");
      }
      key.put(sortField.get().storedName(), keyNode(sortField.get(), sortKey));
    }
    return source.get(model.tableName(), key.build())
        .filter(r -> {
          boolean match = context.discriminator().matches(r, model);
          if (!match) log.debug("Record under {} is not a {}", partitionKey, model.entityId());
          return match;
        })
        .map(mapper::fromRecord);
  }

  /** Write the entity and its populated relationships. */
  public void put(T entity) {
    sink.putAll(model.tableName(), mapper.toRecords(entity));
  }

  /** Entities assembled from every record under one partition key. */
  public ReconstructionResult<T> query(Object partitionKey) {
    return context.<T>reconstructor(model.entityId()).reconstruct(queryRecords(partitionKey));
  }

  /** Every record of this shape under one partition key, each mapped on its own. */
  public List<T> queryAll(Object partitionKey) {
    List<T> entities = new ArrayList<>();
    for (RawRecord r : queryRecords(partitionKey)) {
      if (context.discriminator().matches(r, model)) {
        entities.add(mapper.fromRecord(r));
      }
    }
    return entities;
  }

  private List<RawRecord> queryRecords(Object partitionKey) {
    FieldDescriptor pk = model.partitionKey();
    return source.query(model.tableName(), pk.storedName(), keyNode(pk, partitionKey));
  }

  private AttributeValueNode keyNode(FieldDescriptor field, Object value) {
    if (value == null) {
      throw new IllegalArgumentException(model.entityId() + "." + field.sourceName() + " key value cannot be null");
    }
    return context.codec().encode(value, field);
  }
}
