package co.strata.core.schema;

import co.strata.core.FieldType;
import co.strata.core.KeyRole;
import co.strata.core.model.EntityDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles validated entity definitions into immutable {@link SchemaModel}s.
 *
 * <p>Building is all-or-nothing: if validation reports any error, no model is produced and a
 * {@link SchemaBuildException} carrying the full diagnostic list is thrown. Warnings are logged.
 */
public final class SchemaBuilder {

  private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

  private SchemaBuilder() {}

  public static SchemaCatalog build(List<EntityDefinition> definitions) {
    List<Diagnostic> diagnostics = SchemaValidator.diagnose(definitions);
    if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
      throw new SchemaBuildException(diagnostics);
    }
    for (Diagnostic d : diagnostics) {
      log.warn("{}", d);
    }

    List<SchemaModel> models = new ArrayList<>(definitions.size());
    for (EntityDefinition d : definitions) {
      models.add(compile(d));
    }
    log.debug("Built {} schema model(s)", models.size());
    return new SchemaCatalog(models);
  }

  /** Build a catalog holding a single, self-contained definition. */
  public static SchemaModel buildOne(EntityDefinition definition) {
    return build(List.of(definition)).require(definition.entityName);
  }

  private static SchemaModel compile(EntityDefinition d) {
    List<FieldDescriptor> fields = new ArrayList<>(d.fields.size());
    for (EntityDefinition.Field f : d.fields) {
      fields.add(describe(f));
    }

    List<RelationshipDescriptor> relationships = new ArrayList<>();
    if (d.relationships != null) {
      for (EntityDefinition.Relationship r : d.relationships) {
        relationships.add(new RelationshipDescriptor(
            r.field, KeyPattern.parse(r.sortKeyPattern), r.targetEntity, r.collection));
      }
    }

    return new SchemaModel(d.entityName, d.tableName, fields, relationships, discriminatorOf(d),
        derivationOrder(fields));
  }

  private static FieldDescriptor describe(EntityDefinition.Field f) {
    FieldType type = FieldType.parse(f.type).orElseThrow();
    FieldType elementType = null;
    if (type == FieldType.LIST) {
      elementType = f.items == null ? null : FieldType.parse(f.items).orElseThrow();
    } else if (type.isSet()) {
      elementType = type.elementType();
    }

    DerivedKeyRule derived = null;
    if (f.derivedFrom != null) {
      derived = new DerivedKeyRule(
          f.derivedFrom.sources,
          f.derivedFrom.format == null ? null : KeyTemplate.parse(f.derivedFrom.format),
          f.derivedFrom.separator == null ? "" : f.derivedFrom.separator);
    }
    ExtractedKeyRule extracted = null;
    if (f.extractedFrom != null) {
      extracted = new ExtractedKeyRule(
          f.extractedFrom.source,
          f.extractedFrom.index,
          f.extractedFrom.separator,
          ExtractionPolicy.parse(f.extractedFrom.policy).orElse(null));
    }

    boolean nullable = Boolean.TRUE.equals(f.nullable);
    return new FieldDescriptor(
        f.name,
        SchemaValidator.attributeName(f),
        type,
        elementType,
        nullable,
        SchemaValidator.isRequired(f),
        nullable && f.storeNull,
        KeyRole.parse(f.keyRole).orElseThrow(),
        f.indexName,
        f.format,
        f.timezone == null ? null : ZoneId.of(f.timezone),
        f.enumValues,
        f.encrypted,
        derived,
        extracted);
  }

  /**
   * Discriminator of a definition. Invalid patterns are left out here; the validator
   * reports them.
   */
  static DiscriminatorRule discriminatorOf(EntityDefinition d) {
    EntityDefinition.Discriminator disc = d.discriminator;
    if (disc == null) return DiscriminatorRule.NONE;

    String attribute = null;
    KeyPattern value = null;
    if (!SchemaValidator.isBlank(disc.attribute)) {
      if (!SchemaValidator.isBlank(disc.value)) {
        value = KeyPattern.literal(disc.value);
      } else if (!SchemaValidator.isBlank(disc.pattern)) {
        value = tryParse(disc.pattern);
      }
      if (value != null) attribute = disc.attribute;
    }
    KeyPattern sortKey = SchemaValidator.isBlank(disc.sortKeyPattern) ? null : tryParse(disc.sortKeyPattern);
    return attribute == null && sortKey == null
        ? DiscriminatorRule.NONE
        : new DiscriminatorRule(attribute, value, sortKey);
  }

  private static KeyPattern tryParse(String pattern) {
    try {
      return KeyPattern.parse(pattern);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /** Depth-first post-order over derived-from-derived edges; declaration order breaks ties. */
  private static List<FieldDescriptor> derivationOrder(List<FieldDescriptor> fields) {
    Map<String, FieldDescriptor> derived = new LinkedHashMap<>();
    for (FieldDescriptor f : fields) {
      if (f.isDerived()) derived.put(f.sourceName(), f);
    }
    List<FieldDescriptor> order = new ArrayList<>(derived.size());
    Set<String> done = new HashSet<>();
    for (FieldDescriptor f : derived.values()) {
      appendAfterSources(f, derived, done, order);
    }
    return order;
  }

  private static void appendAfterSources(FieldDescriptor f, Map<String, FieldDescriptor> derived,
                                         Set<String> done, List<FieldDescriptor> order) {
    if (!done.add(f.sourceName())) return;
    for (String source : f.derivedFrom().sources()) {
      FieldDescriptor upstream = derived.get(source);
      if (upstream != null) appendAfterSources(upstream, derived, done, order);
    }
    order.add(f);
  }
}
