package co.strata.mapper;

import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.RelationshipDescriptor;
import co.strata.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Assembles entities stored as several records under one partition key: a primary record for
 * the entity itself and child records that populate its relationship fields.
 *
 * <ol>
 *   <li>Group the records by partition key value, keeping first-seen order.</li>
 *   <li>In each group the discriminator picks the primary record; the other records are offered
 *       to every relationship's sort key pattern.</li>
 *   <li>The primary record becomes the entity; matched children are mapped with the target shape
 *       and set on the relationship field, in input order.</li>
 *   <li>Groups without a primary record are dropped.</li>
 * </ol>
 *
 * <p>Nothing found here fails the call: anomalies are logged and returned as warnings. Mapping
 * errors of individual records do fail it.
 */
public class MultiRecordReconstructor<T> {

  private static final Logger log = LoggerFactory.getLogger(MultiRecordReconstructor.class);

  private final RecordMapper<T> mapper;
  private final EntityDiscriminator discriminator;
  private final Function<String, RecordMapper<?>> relationshipMappers;

  public MultiRecordReconstructor(RecordMapper<T> mapper, EntityDiscriminator discriminator,
                                  Function<String, RecordMapper<?>> relationshipMappers) {
    this.mapper = mapper;
    this.discriminator = discriminator;
    this.relationshipMappers = relationshipMappers;
  }

  public ReconstructionResult<T> reconstruct(List<RawRecord> records) {
    SchemaModel model = mapper.model();
    List<MappingWarning> warnings = new ArrayList<>();
    Map<String, List<RawRecord>> groups = group(model, records, warnings);

    List<T> entities = new ArrayList<>(groups.size());
    for (Map.Entry<String, List<RawRecord>> group : groups.entrySet()) {
      T entity = assemble(model, group.getKey(), group.getValue(), warnings);
      if (entity != null) entities.add(entity);
    }
    return new ReconstructionResult<>(entities, warnings);
  }

  private Map<String, List<RawRecord>> group(SchemaModel model, List<RawRecord> records,
                                             List<MappingWarning> warnings) {
    String partitionAttribute = model.partitionKey().storedName();
    Map<String, List<RawRecord>> groups = new LinkedHashMap<>();
    for (RawRecord r : records) {
      AttributeValueNode key = r.get(partitionAttribute);
      if (key == null || key.kind() == AttributeValueNode.Kind.NULL) {
        warn(warnings, MappingWarning.Kind.UNKEYED_RECORD, model.entityId(),
            "record without partition key attribute '" + partitionAttribute + "' skipped");
        continue;
      }
      groups.computeIfAbsent(groupKey(key), k -> new ArrayList<>()).add(r);
    }
    return groups;
  }

  private T assemble(SchemaModel model, String partitionKey, List<RawRecord> group, List<MappingWarning> warnings) {
    String context = model.entityId() + "[" + partitionKey + "]";
    RawRecord primary = null;
    int primaries = 0;
    List<RawRecord> children = new ArrayList<>(group.size());
    for (RawRecord r : group) {
      if (isPrimary(model, r, context, warnings)) {
        if (primary == null) primary = r;
        primaries++;
      } else {
        children.add(r);
      }
    }

    if (primary == null) {
      warn(warnings, MappingWarning.Kind.ORPHANED_CHILD_RECORDS, context,
          group.size() + " record(s) without a primary record dropped");
      return null;
    }
    if (primaries > 1) {
      warn(warnings, MappingWarning.Kind.DUPLICATE_PRIMARY, context,
          primaries + " records match the primary shape; using the first");
    }

    T entity = mapper.fromRecord(primary);
    String sortAttribute = model.sortKey().map(FieldDescriptor::storedName).orElse(null);
    for (RelationshipDescriptor r : model.relationships()) {
      List<RawRecord> matched = new ArrayList<>();
      for (RawRecord child : children) {
        if (sortAttribute != null && r.sortKeyPattern().matches(child.text(sortAttribute))) {
          matched.add(child);
        }
      }
      if (matched.isEmpty()) continue;
      populate(entity, r, matched, context, warnings);
    }
    return entity;
  }

  private void populate(T entity, RelationshipDescriptor r, List<RawRecord> matched, String context,
                        List<MappingWarning> warnings) {
    RecordMapper<?> target = relationshipMappers.apply(r.targetEntity());
    if (r.collection()) {
      List<Object> values = new ArrayList<>(matched.size());
      for (RawRecord child : matched) {
        values.add(target.fromRecord(child));
      }
      mapper.accessor().set(entity, r.targetFieldName(), values);
    } else {
      if (matched.size() > 1) {
        warn(warnings, MappingWarning.Kind.MULTIPLE_SINGULAR_MATCHES, context,
            matched.size() + " records match " + r.targetFieldName() + " (" + r.sortKeyPattern()
                + "); using the first");
      }
      mapper.accessor().set(entity, r.targetFieldName(), target.fromRecord(matched.get(0)));
    }
  }

  /**
   * Without a declared discriminator any fully keyed record would look primary, so records
   * claimed by a relationship pattern are children. A declared discriminator wins over a
   * relationship pattern, with an ambiguity warning.
   */
  private boolean isPrimary(SchemaModel model, RawRecord record, String context, List<MappingWarning> warnings) {
    String sortAttribute = model.sortKey().map(FieldDescriptor::storedName).orElse(null);
    String sortKey = sortAttribute == null ? null : record.text(sortAttribute);
    RelationshipDescriptor claimed = null;
    if (sortKey != null) {
      for (RelationshipDescriptor r : model.relationships()) {
        if (r.sortKeyPattern().matches(sortKey)) {
          claimed = r;
          break;
        }
      }
    }
    if (model.discriminator().isNone()) {
      return claimed == null && discriminator.matches(record, model);
    }
    boolean primary = discriminator.matches(record, model);
    if (primary && claimed != null && discriminator.warnsOnAmbiguity()) {
      warn(warnings, MappingWarning.Kind.AMBIGUOUS_DISCRIMINATION, context,
          "sort key '" + sortKey + "' matches both the " + model.entityId() + " shape and relationship "
              + claimed.targetFieldName() + " (" + claimed.sortKeyPattern() + "); treated as primary");
    }
    return primary;
  }

  private static String groupKey(AttributeValueNode key) {
    if (key.text() != null) return key.text();
    if (key instanceof AttributeValueNode.BinaryValue b) return Base64.getEncoder().encodeToString(b.value());
    return key.toString();
  }

  private static void warn(List<MappingWarning> warnings, MappingWarning.Kind kind, String context, String message) {
    MappingWarning warning = new MappingWarning(kind, message, context);
    log.warn("{}", warning);
    warnings.add(warning);
  }
}
