package co.strata.mapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entity whose fields live in a map keyed by field name. Useful when no domain class exists,
 * e.g. for tooling that works from definitions alone.
 */
public final class DynamicEntity {

  public static final EntityAccessor<DynamicEntity> ACCESSOR = new EntityAccessor<>() {
    @Override
    public DynamicEntity newInstance() {
      return new DynamicEntity();
    }

    @Override
    public Object get(DynamicEntity entity, String field) {
      return entity.get(field);
    }

    @Override
    public void set(DynamicEntity entity, String field, Object value) {
      entity.set(field, value);
    }
  };

  private final Map<String, Object> values = new LinkedHashMap<>();

  public DynamicEntity() {}

  public DynamicEntity(Map<String, ?> values) {
    this.values.putAll(values);
  }

  public Object get(String field) {
    return values.get(field);
  }

  public DynamicEntity set(String field, Object value) {
    if (value == null) {
      values.remove(field);
    } else {
      values.put(field, value);
    }
    return this;
  }

  public boolean has(String field) {
    return values.containsKey(field);
  }

  public Map<String, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DynamicEntity)) return false;
    return values.equals(((DynamicEntity) o).values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public String toString() {
    return "DynamicEntity" + values;
  }
}
