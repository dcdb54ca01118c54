package co.strata.mapper;

/**
 * Reads and writes the fields of one domain type by field name, without reflection.
 *
 * <p>Field names are the {@code sourceName}s of the entity's schema. Values use the Java types
 * the value codec produces for each field type.
 */
public interface EntityAccessor<T> {

  T newInstance();

  Object get(T entity, String field);

  void set(T entity, String field, Object value);
}
