package co.strata.core.schema;

import co.strata.core.FieldType;
import co.strata.core.KeyRole;
import co.strata.core.model.EntityDefinition;

import java.text.DecimalFormat;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a batch of entity definitions and reports every problem found.
 *
 * <p>Checks run in phases over the whole batch: structural checks (names, types, key
 * cardinality), then graph checks (derived-key cycles), then cross-field checks
 * (derived/extracted references, relationships, discriminators), then table checks
 * (shapes sharing a table must be distinguishable).
 */
public final class SchemaValidator {

  private SchemaValidator() {}

  /**
   * Validate a single definition.
   *
   * @throws SchemaBuildException if any error is found
   */
  public static void validate(EntityDefinition definition) {
    List<Diagnostic> diagnostics = diagnose(List.of(definition));
    if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
      throw new SchemaBuildException(diagnostics);
    }
  }

  public static List<Diagnostic> diagnose(List<EntityDefinition> definitions) {
    List<Diagnostic> out = new ArrayList<>();
    Map<String, EntityDefinition> usable = new LinkedHashMap<>();

    for (int i = 0; i < definitions.size(); i++) {
      checkStructure(definitions.get(i), i, usable, out);
    }
    for (EntityDefinition d : usable.values()) {
      checkCycles(d, out);
    }
    for (EntityDefinition d : usable.values()) {
      checkDerivedFields(d, out);
      checkExtractedFields(d, out);
      checkRelationships(d, usable, out);
      checkDiscriminator(d, out);
    }
    checkTables(usable, out);
    return out;
  }

  // =========================================================================
  // Structure
  // =========================================================================

  private static void checkStructure(EntityDefinition d, int position, Map<String, EntityDefinition> usable,
                                     List<Diagnostic> out) {
    String entity = isBlank(d.entityName) ? "<definition #" + position + ">" : d.entityName;
    boolean ok = true;

    if (isBlank(d.entityName)) {
      out.add(Diagnostic.error(DiagnosticCode.MISSING_ENTITY_NAME, entity, "entityName required"));
      ok = false;
    } else if (usable.containsKey(d.entityName)) {
      out.add(Diagnostic.error(DiagnosticCode.DUPLICATE_ENTITY, entity, "duplicate entity " + d.entityName));
      ok = false;
    }
    if (isBlank(d.tableName)) {
      out.add(Diagnostic.error(DiagnosticCode.MISSING_TABLE_NAME, entity, "tableName required for " + entity));
    }
    if (d.fields == null || d.fields.isEmpty()) {
      out.add(Diagnostic.error(DiagnosticCode.MISSING_FIELDS, entity,
          "fields must have at least one field for " + entity));
      return;
    }

    Set<String> names = new HashSet<>();
    Set<String> attributes = new HashSet<>();
    int partitionKeys = 0;
    int sortKeys = 0;
    Map<String, Integer> indexPartitionKeys = new HashMap<>();
    Map<String, Integer> indexSortKeys = new HashMap<>();

    for (EntityDefinition.Field f : d.fields) {
      if (isBlank(f.name)) {
        out.add(Diagnostic.error(DiagnosticCode.MISSING_FIELD_NAME, entity, entity + ": field.name required"));
        continue;
      }
      String path = entity + "." + f.name;
      if (!names.add(f.name)) {
        out.add(Diagnostic.error(DiagnosticCode.DUPLICATE_FIELD, path, entity + ": duplicate field " + f.name));
      }
      if (f.extractedFrom == null && !attributes.add(attributeName(f))) {
        out.add(Diagnostic.error(DiagnosticCode.DUPLICATE_ATTRIBUTE_NAME, path,
            path + ": attribute name " + attributeName(f) + " is already used"));
      }

      FieldType type = FieldType.parse(f.type).orElse(null);
      if (type == null) {
        out.add(Diagnostic.error(DiagnosticCode.UNSUPPORTED_TYPE, path, path + ": unsupported type " + f.type));
      } else {
        checkFieldType(f, type, path, out);
      }

      KeyRole role = KeyRole.parse(f.keyRole).orElse(null);
      if (role == null) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path, path + ": unknown key role " + f.keyRole));
      } else {
        checkKeyRole(f, type, role, path, out);
        switch (role) {
          case PARTITION -> partitionKeys++;
          case SORT -> sortKeys++;
          case GSI_PARTITION -> indexPartitionKeys.merge(String.valueOf(f.indexName), 1, Integer::sum);
          case GSI_SORT -> indexSortKeys.merge(String.valueOf(f.indexName), 1, Integer::sum);
          default -> { }
        }
      }

      if (f.derivedFrom != null && f.extractedFrom != null) {
        out.add(Diagnostic.error(DiagnosticCode.CONFLICTING_FIELD_ROLES, path,
            path + ": a field cannot be both derived and extracted"));
      }
      if (f.required && Boolean.TRUE.equals(f.nullable)) {
        out.add(Diagnostic.warning(DiagnosticCode.REQUIRED_AND_NULLABLE, path,
            path + ": required and nullable; treating as nullable"));
      }
    }

    if (partitionKeys == 0) {
      out.add(Diagnostic.error(DiagnosticCode.MISSING_PARTITION_KEY, entity, entity + ": no partition key field"));
    } else if (partitionKeys > 1) {
      out.add(Diagnostic.error(DiagnosticCode.MULTIPLE_PARTITION_KEYS, entity,
          entity + ": " + partitionKeys + " partition key fields, expected exactly one"));
    }
    if (sortKeys > 1) {
      out.add(Diagnostic.error(DiagnosticCode.MULTIPLE_SORT_KEYS, entity,
          entity + ": " + sortKeys + " sort key fields, expected at most one"));
    }
    indexPartitionKeys.forEach((index, count) -> {
      if (count > 1) {
        out.add(Diagnostic.error(DiagnosticCode.MULTIPLE_PARTITION_KEYS, entity + "#" + index,
            entity + ": index " + index + " has " + count + " partition key fields"));
      }
    });
    indexSortKeys.forEach((index, count) -> {
      if (count > 1) {
        out.add(Diagnostic.error(DiagnosticCode.MULTIPLE_SORT_KEYS, entity + "#" + index,
            entity + ": index " + index + " has " + count + " sort key fields"));
      }
    });

    if (ok) {
      usable.put(d.entityName, d);
    }
  }

  private static void checkFieldType(EntityDefinition.Field f, FieldType type, String path, List<Diagnostic> out) {
    if (type == FieldType.LIST && f.items != null) {
      FieldType items = FieldType.parse(f.items).orElse(null);
      if (items == null || (items.isCollection())) {
        out.add(Diagnostic.error(DiagnosticCode.UNSUPPORTED_TYPE, path,
            path + ": unsupported list item type " + f.items));
      }
    }

    if (type == FieldType.ENUM && (f.enumValues == null || f.enumValues.isEmpty())) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_ENUM_VALUES, path, path + ": enum values cannot be empty"));
    }
    if (f.enumValues != null) {
      if (type != FieldType.ENUM && type != FieldType.STRING) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_ENUM_VALUES, path,
            path + ": enum values are only allowed on enum and string fields"));
      }
      for (String v : f.enumValues) {
        if (isBlank(v)) {
          out.add(Diagnostic.error(DiagnosticCode.INVALID_ENUM_VALUES, path, path + ": enum values cannot be empty"));
          break;
        }
      }
    }

    if (f.format != null) {
      checkFormat(f.format, type, path, out);
    }
    if (f.timezone != null) {
      if (type != FieldType.TIMESTAMP) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_TIMEZONE, path,
            path + ": timezone is only supported on timestamp fields"));
      } else {
        try {
          ZoneId.of(f.timezone);
        } catch (DateTimeException e) {
          out.add(Diagnostic.error(DiagnosticCode.INVALID_TIMEZONE, path,
              path + ": invalid timezone " + f.timezone + " (" + e.getMessage() + ")"));
        }
      }
    }
    if (f.encrypted && (type.isCollection() || type == FieldType.MAP)) {
      out.add(Diagnostic.error(DiagnosticCode.UNSUPPORTED_TYPE, path,
          path + ": only scalar fields can be encrypted"));
    }
  }

  private static void checkFormat(String format, FieldType type, String path, List<Diagnostic> out) {
    try {
      switch (type) {
        case TIMESTAMP, DATE -> DateTimeFormatter.ofPattern(format);
        case INT, LONG, FLOAT, DOUBLE, DECIMAL -> new DecimalFormat(format);
        default -> out.add(Diagnostic.error(DiagnosticCode.INVALID_FORMAT, path,
            path + ": format is not supported for type " + type.typeName()));
      }
    } catch (IllegalArgumentException e) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_FORMAT, path,
          path + ": invalid format '" + format + "' (" + e.getMessage() + ")"));
    }
  }

  private static void checkKeyRole(EntityDefinition.Field f, FieldType type, KeyRole role, String path,
                                   List<Diagnostic> out) {
    if (role == KeyRole.NONE) {
      if (f.indexName != null) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path,
            path + ": indexName requires a gsiPartition or gsiSort key role"));
      }
      return;
    }
    if (type != null && !type.isKeyEligible()) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path,
          path + ": type " + type.typeName() + " cannot be a key"));
    }
    if (Boolean.TRUE.equals(f.nullable)) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path, path + ": key fields cannot be nullable"));
    }
    if (f.extractedFrom != null) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path,
          path + ": key fields must be stored, extracted fields are not"));
    }
    if (role.isIndexKey() && isBlank(f.indexName)) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_ROLE, path, path + ": index key requires indexName"));
    }
    if (f.encrypted) {
      out.add(Diagnostic.error(DiagnosticCode.ENCRYPTED_KEY_FIELD, path, path + ": key fields cannot be encrypted"));
    }
  }

  // =========================================================================
  // Derived key graph
  // =========================================================================

  private static void checkCycles(EntityDefinition d, List<Diagnostic> out) {
    Map<String, List<String>> edges = new LinkedHashMap<>();
    for (EntityDefinition.Field f : d.fields) {
      if (!isBlank(f.name) && f.derivedFrom != null && f.derivedFrom.sources != null) {
        edges.put(f.name, f.derivedFrom.sources);
      }
    }
    Map<String, Integer> state = new HashMap<>();
    Set<Set<String>> reported = new HashSet<>();
    for (String start : edges.keySet()) {
      visit(start, edges, state, new ArrayList<>(), reported, d.entityName, out);
    }
  }

  // state: 1 = on the current path, 2 = done
  private static void visit(String node, Map<String, List<String>> edges, Map<String, Integer> state,
                            List<String> path, Set<Set<String>> reported, String entity, List<Diagnostic> out) {
    Integer s = state.get(node);
    if (s != null && s == 2) return;
    if (s != null && s == 1) {
      List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
      if (reported.add(new HashSet<>(cycle))) {
        cycle.add(node);
        out.add(Diagnostic.error(DiagnosticCode.CIRCULAR_KEY_DEPENDENCY, entity + "." + cycle.get(0),
            entity + ": circular key dependency " + String.join(" -> ", cycle)));
      }
      return;
    }
    List<String> next = edges.get(node);
    if (next == null) {
      state.put(node, 2);
      return;
    }
    state.put(node, 1);
    path.add(node);
    for (String source : next) {
      visit(source, edges, state, path, reported, entity, out);
    }
    path.remove(path.size() - 1);
    state.put(node, 2);
  }

  // =========================================================================
  // Cross-field references
  // =========================================================================

  private static void checkDerivedFields(EntityDefinition d, List<Diagnostic> out) {
    Map<String, EntityDefinition.Field> fields = fieldsByName(d);
    for (EntityDefinition.Field f : d.fields) {
      if (isBlank(f.name) || f.derivedFrom == null) continue;
      String path = d.entityName + "." + f.name;
      EntityDefinition.DerivedFrom rule = f.derivedFrom;

      if (rule.sources == null || rule.sources.isEmpty()) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_SOURCE, path,
            path + ": derivedFrom needs at least one source field"));
        continue;
      }
      if (FieldType.parse(f.type).orElse(null) != FieldType.STRING) {
        out.add(Diagnostic.error(DiagnosticCode.UNSUPPORTED_TYPE, path,
            path + ": derived fields must be of type string"));
      }
      for (String source : rule.sources) {
        EntityDefinition.Field sourceField = fields.get(source);
        if (sourceField == null) {
          out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_SOURCE, path,
              path + ": derivedFrom source '" + source + "' does not exist"));
        } else {
          FieldType sourceType = FieldType.parse(sourceField.type).orElse(null);
          if (sourceType != null && (sourceType.isCollection() || sourceType == FieldType.MAP)) {
            out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_SOURCE, path,
                path + ": derivedFrom source '" + source + "' must be a scalar field"));
          }
        }
      }
      if (rule.format != null) {
        try {
          KeyTemplate template = KeyTemplate.parse(rule.format);
          if (template.maxIndex() >= rule.sources.size()) {
            out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE, path,
                path + ": template '" + rule.format + "' references index " + template.maxIndex()
                    + " but only " + rule.sources.size() + " source(s) are declared"));
          }
          checkPlaceholderFormats(template, rule.sources, fields, path, out);
        } catch (IllegalArgumentException e) {
          out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE, path,
              path + ": " + e.getMessage()));
        }
      }
    }
  }

  private static void checkExtractedFields(EntityDefinition d, List<Diagnostic> out) {
    Map<String, EntityDefinition.Field> fields = fieldsByName(d);
    for (EntityDefinition.Field f : d.fields) {
      if (isBlank(f.name) || f.extractedFrom == null) continue;
      String path = d.entityName + "." + f.name;
      EntityDefinition.ExtractedFrom rule = f.extractedFrom;

      EntityDefinition.Field source = isBlank(rule.source) ? null : fields.get(rule.source);
      if (source == null) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTED_KEY_SOURCE, path,
            path + ": extractedFrom source '" + rule.source + "' does not exist"));
      } else if (source.extractedFrom != null) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTED_KEY_SOURCE, path,
            path + ": extractedFrom source '" + rule.source + "' is itself extracted"));
      } else if (FieldType.parse(source.type).orElse(null) != FieldType.STRING) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTED_KEY_SOURCE, path,
            path + ": extractedFrom source '" + rule.source + "' must be of type string"));
      }
      if (rule.index < 0) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTED_KEY_INDEX, path,
            path + ": index must be non-negative"));
      }
      if (rule.separator == null || rule.separator.isEmpty()) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTED_KEY_INDEX, path,
            path + ": separator cannot be empty"));
      }
      if (rule.policy != null && ExtractionPolicy.parse(rule.policy).isEmpty()) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_EXTRACTION_POLICY, path,
            path + ": unknown extraction policy " + rule.policy));
      }
      FieldType type = FieldType.parse(f.type).orElse(null);
      if (type != null && (type.isCollection() || type == FieldType.MAP)) {
        out.add(Diagnostic.error(DiagnosticCode.UNSUPPORTED_TYPE, path,
            path + ": extracted fields must be scalar"));
      }
    }
  }

  private static void checkRelationships(EntityDefinition d, Map<String, EntityDefinition> usable,
                                         List<Diagnostic> out) {
    if (d.relationships == null) return;
    Map<String, EntityDefinition.Field> fields = fieldsByName(d);
    Set<String> seen = new HashSet<>();
    boolean hasSortKey = d.fields.stream().anyMatch(f -> "sort".equals(f.keyRole));

    for (EntityDefinition.Relationship r : d.relationships) {
      if (isBlank(r.field)) {
        out.add(Diagnostic.error(DiagnosticCode.MISSING_FIELD_NAME, d.entityName,
            d.entityName + ": relationship field required"));
        continue;
      }
      String path = d.entityName + "." + r.field;
      if (fields.containsKey(r.field) || !seen.add(r.field)) {
        out.add(Diagnostic.error(DiagnosticCode.DUPLICATE_FIELD, path,
            path + ": relationship field collides with another field"));
      }
      checkPattern(r.sortKeyPattern, path, "sortKeyPattern", out);
      EntityDefinition target = isBlank(r.targetEntity) ? null : usable.get(r.targetEntity);
      if (target == null) {
        out.add(Diagnostic.error(DiagnosticCode.UNKNOWN_RELATIONSHIP_TARGET, path,
            path + ": unknown target entity " + r.targetEntity));
      } else if (target.tableName != null && !target.tableName.equals(d.tableName)) {
        out.add(Diagnostic.error(DiagnosticCode.UNKNOWN_RELATIONSHIP_TARGET, path,
            path + ": target entity " + r.targetEntity + " is stored in " + target.tableName
                + ", not " + d.tableName));
      }
      if (!hasSortKey) {
        out.add(Diagnostic.error(DiagnosticCode.RELATIONSHIP_WITHOUT_SORT_KEY, path,
            path + ": relationships need a sort key to tell related records apart"));
      }
    }
  }

  private static void checkDiscriminator(EntityDefinition d, List<Diagnostic> out) {
    EntityDefinition.Discriminator disc = d.discriminator;
    if (disc == null) return;
    String path = d.entityName + ".discriminator";

    if (disc.attribute != null) {
      if (isBlank(disc.value) && isBlank(disc.pattern)) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_PATTERN, path,
            path + ": discriminator attribute " + disc.attribute + " needs a value or a pattern"));
      } else if (!isBlank(disc.value) && !isBlank(disc.pattern)) {
        out.add(Diagnostic.warning(DiagnosticCode.DISCRIMINATOR_VALUE_AND_PATTERN, path,
            path + ": both value and pattern given; using value"));
      } else if (!isBlank(disc.pattern)) {
        checkPattern(disc.pattern, path, "pattern", out);
      }
    }
    if (disc.sortKeyPattern != null) {
      checkPattern(disc.sortKeyPattern, path, "sortKeyPattern", out);
      if (d.fields.stream().noneMatch(f -> "sort".equals(f.keyRole))) {
        out.add(Diagnostic.error(DiagnosticCode.RELATIONSHIP_WITHOUT_SORT_KEY, path,
            path + ": sortKeyPattern needs a sort key field"));
      }
    }
  }

  private static void checkPattern(String pattern, String path, String what, List<Diagnostic> out) {
    try {
      KeyPattern.parse(pattern);
    } catch (IllegalArgumentException e) {
      out.add(Diagnostic.error(DiagnosticCode.INVALID_KEY_PATTERN, path, path + ": " + what + " " + e.getMessage()));
    }
  }

  private static void checkPlaceholderFormats(KeyTemplate template, List<String> sources,
                                              Map<String, EntityDefinition.Field> fields, String path,
                                              List<Diagnostic> out) {
    for (KeyTemplate.Segment segment : template.segments()) {
      if (!segment.isPlaceholder() || segment.format() == null || segment.index() >= sources.size()) continue;
      String source = sources.get(segment.index());
      EntityDefinition.Field sourceField = fields.get(source);
      FieldType sourceType = sourceField == null ? null : FieldType.parse(sourceField.type).orElse(null);
      if (sourceType == null) continue;
      if (!sourceType.isFormattable()) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE, path,
            path + ": placeholder {" + segment.index() + ":" + segment.format() + "} formats '" + source
                + "' but type " + sourceType.typeName() + " takes no format"));
        continue;
      }
      try {
        if (sourceType == FieldType.TIMESTAMP || sourceType == FieldType.DATE) {
          DateTimeFormatter.ofPattern(segment.format());
        } else {
          new DecimalFormat(segment.format());
        }
      } catch (IllegalArgumentException e) {
        out.add(Diagnostic.error(DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE, path,
            path + ": invalid placeholder format '" + segment.format() + "' (" + e.getMessage() + ")"));
      }
    }
  }

  // =========================================================================
  // Tables
  // =========================================================================

  private static void checkTables(Map<String, EntityDefinition> usable, List<Diagnostic> out) {
    Map<String, List<EntityDefinition>> byTable = new LinkedHashMap<>();
    for (EntityDefinition d : usable.values()) {
      if (!isBlank(d.tableName)) {
        byTable.computeIfAbsent(d.tableName, k -> new ArrayList<>()).add(d);
      }
    }
    for (List<EntityDefinition> shapes : byTable.values()) {
      for (int i = 0; i < shapes.size(); i++) {
        for (int j = i + 1; j < shapes.size(); j++) {
          EntityDefinition a = shapes.get(i);
          EntityDefinition b = shapes.get(j);
          if (indistinguishable(a, b)) {
            out.add(Diagnostic.error(DiagnosticCode.CONFLICTING_ENTITY_SHAPES, b.entityName,
                b.entityName + " and " + a.entityName + " share table " + a.tableName
                    + " but cannot be told apart; declare a discriminator"));
          }
        }
      }
    }
  }

  private static boolean indistinguishable(EntityDefinition a, EntityDefinition b) {
    String sa = SchemaBuilder.discriminatorOf(a).signature();
    String sb = SchemaBuilder.discriminatorOf(b).signature();
    if (!sa.equals(sb)) return false;
    if (!"presence".equals(sa)) return true;
    Set<String> ra = requiredAttributes(a);
    Set<String> rb = requiredAttributes(b);
    return ra.containsAll(rb) || rb.containsAll(ra);
  }

  static Set<String> requiredAttributes(EntityDefinition d) {
    Set<String> required = new LinkedHashSet<>();
    for (EntityDefinition.Field f : d.fields) {
      if (!isBlank(f.name) && f.extractedFrom == null && isRequired(f)) {
        required.add(attributeName(f));
      }
    }
    return required;
  }

  static boolean isRequired(EntityDefinition.Field f) {
    if (Boolean.TRUE.equals(f.nullable)) return false;
    return f.required || "partition".equals(f.keyRole) || "sort".equals(f.keyRole);
  }

  static String attributeName(EntityDefinition.Field f) {
    return isBlank(f.attributeName) ? f.name : f.attributeName;
  }

  private static Map<String, EntityDefinition.Field> fieldsByName(EntityDefinition d) {
    Map<String, EntityDefinition.Field> byName = new HashMap<>();
    for (EntityDefinition.Field f : d.fields) {
      if (!isBlank(f.name)) byName.putIfAbsent(f.name, f);
    }
    return byName;
  }

  static boolean isBlank(String s) { return s == null || s.isEmpty(); }
}
