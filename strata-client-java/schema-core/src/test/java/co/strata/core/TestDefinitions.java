package co.strata.core;

import co.strata.core.model.EntityDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/** Small builders for definitions used across the schema tests. */
public final class TestDefinitions {

  private TestDefinitions() {}

  public static EntityDefinition entity(String name, String table, EntityDefinition.Field... fields) {
    EntityDefinition d = new EntityDefinition();
    d.schemaVersion = "1.0";
    d.entityName = name;
    d.tableName = table;
    d.fields = new ArrayList<>(Arrays.asList(fields));
    return d;
  }

  public static EntityDefinition.Field field(String name, String type) {
    EntityDefinition.Field f = new EntityDefinition.Field();
    f.name = name;
    f.type = type;
    return f;
  }

  public static EntityDefinition.Field key(String name, String role) {
    EntityDefinition.Field f = field(name, "string");
    f.keyRole = role;
    return f;
  }

  public static EntityDefinition.Field derived(String name, String separator, String... sources) {
    EntityDefinition.Field f = field(name, "string");
    f.derivedFrom = new EntityDefinition.DerivedFrom();
    f.derivedFrom.sources = List.of(sources);
    f.derivedFrom.separator = separator;
    return f;
  }

  public static EntityDefinition.Field extracted(String name, String source, int index) {
    EntityDefinition.Field f = field(name, "string");
    f.extractedFrom = new EntityDefinition.ExtractedFrom();
    f.extractedFrom.source = source;
    f.extractedFrom.index = index;
    return f;
  }

  public static EntityDefinition.Relationship relationship(String field, String pattern, String target,
                                                           boolean collection) {
    EntityDefinition.Relationship r = new EntityDefinition.Relationship();
    r.field = field;
    r.sortKeyPattern = pattern;
    r.targetEntity = target;
    r.collection = collection;
    return r;
  }

  public static EntityDefinition.Discriminator sortKeyDiscriminator(String pattern) {
    EntityDefinition.Discriminator d = new EntityDefinition.Discriminator();
    d.sortKeyPattern = pattern;
    return d;
  }

  public static EntityDefinition.Discriminator attributeDiscriminator(String attribute, String value) {
    EntityDefinition.Discriminator d = new EntityDefinition.Discriminator();
    d.attribute = attribute;
    d.value = value;
    return d;
  }

  public static <T> T with(T target, Consumer<T> change) {
    change.accept(target);
    return target;
  }
}
