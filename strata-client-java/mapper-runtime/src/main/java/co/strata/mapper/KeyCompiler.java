package co.strata.mapper;

import co.strata.core.schema.DerivedKeyRule;
import co.strata.core.schema.ExtractedKeyRule;
import co.strata.core.schema.ExtractionPolicy;
import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Computes derived (composite) key fields before a write and extracts component fields from
 * them after a read.
 *
 * <p>Derived values are built from the key text of each source value: the source's own format
 * applies unless the template placeholder names one, as in {@code {1:yyyy-MM}}. Without a
 * template the texts are joined with the separator.
 *
 * <p>Extraction splits the source text on the separator, literally, and converts the
 * {@code index}-th component to the extracted field's type. When there are not enough
 * components the field's policy, or the mapper default, decides: lenient leaves the field
 * absent, strict fails the read.
 */
public class KeyCompiler {

  private static final Logger log = LoggerFactory.getLogger(KeyCompiler.class);

  private final ValueCodec codec;
  private final ExtractionPolicy defaultPolicy;

  public KeyCompiler(ValueCodec codec, ExtractionPolicy defaultPolicy) {
    this.codec = codec;
    this.defaultPolicy = defaultPolicy;
  }

  /** Compute every derived field of {@code model} on {@code entity}, sources first. */
  public <T> void computeAll(T entity, EntityAccessor<T> accessor, SchemaModel model) {
    for (FieldDescriptor f : model.derivedFieldsInOrder()) {
      computeDerived(entity, accessor, model, f);
    }
  }

  /**
   * Compute one derived field and write it onto the entity.
   *
   * @throws IncompleteKeyMaterialException if a source value is absent
   */
  public <T> void computeDerived(T entity, EntityAccessor<T> accessor, SchemaModel model, FieldDescriptor field) {
    accessor.set(entity, field.sourceName(), derive(model, field, name -> accessor.get(entity, name)));
  }

  /**
   * Compute the value of a derived field from source values.
   *
   * @param values source field name to its current Java value
   */
  public String derive(SchemaModel model, FieldDescriptor field, Function<String, Object> values) {
    DerivedKeyRule rule = field.derivedFrom();
    List<Object> raw = new ArrayList<>(rule.sources().size());
    for (String source : rule.sources()) {
      Object value = values.apply(source);
      if (value == null) {
        throw new IncompleteKeyMaterialException(model.entityId(), field.sourceName(), source);
      }
      raw.add(value);
    }

    if (rule.hasTemplate()) {
      return rule.template().render((index, format) ->
          keyText(model, field, rule.sources().get(index), raw.get(index), format));
    }
    List<String> texts = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      texts.add(keyText(model, field, rule.sources().get(i), raw.get(i), null));
    }
    return String.join(rule.separator(), texts);
  }

  private String keyText(SchemaModel model, FieldDescriptor field, String sourceName, Object value, String format) {
    FieldDescriptor source = model.field(sourceName).orElseThrow(
        () -> new IllegalStateException(model.entityId() + " has no field " + sourceName));
    try {
      return codec.toKeyText(value, source, format);
    } catch (ConversionException e) {
      throw new ConversionException("source '" + sourceName + "' cannot be rendered into the key: "
          + e.detail(), model.entityId(), field.sourceName(), null, source.type(), null,
          MappingException.Operation.COMPUTE_KEY, e);
    }
  }

  /** Extract every extracted field of {@code model} on {@code entity}. */
  public <T> void extractAll(T entity, EntityAccessor<T> accessor, SchemaModel model) {
    for (FieldDescriptor f : model.extractedFields()) {
      extractComponents(entity, accessor, model, f);
    }
  }

  /**
   * Read the source of an extracted field from the entity and assign the component.
   *
   * @throws KeyExtractionException under the strict policy when the source is too short
   */
  public <T> void extractComponents(T entity, EntityAccessor<T> accessor, SchemaModel model, FieldDescriptor field) {
    extract(model, field, name -> accessor.get(entity, name),
        (name, value) -> accessor.set(entity, name, value), null);
  }

  /**
   * Extract one field between a value lookup and a value sink.
   *
   * @param record record being read, for error context; may be {@code null}
   */
  public void extract(SchemaModel model, FieldDescriptor field, Function<String, Object> values,
                      BiConsumer<String, Object> out, RawRecord record) {
    ExtractedKeyRule rule = field.extractedFrom();
    Object source = values.apply(rule.source());
    if (source == null) {
      // nothing to split; the source field itself reports missing required values
      out.accept(field.sourceName(), null);
      return;
    }
    String text = source.toString();
    String[] parts = split(text, rule.separator());
    if (rule.index() >= parts.length) {
      ExtractionPolicy policy = rule.policy() != null ? rule.policy() : defaultPolicy;
      if (policy == ExtractionPolicy.STRICT) {
        throw new KeyExtractionException(model.entityId(), field.sourceName(), text, rule.index(), parts.length,
            record);
      }
      log.debug("{}.{}: '{}' has {} component(s), component {} left absent",
          model.entityId(), field.sourceName(), text, parts.length, rule.index());
      out.accept(field.sourceName(), null);
      return;
    }
    try {
      out.accept(field.sourceName(), codec.fromKeyText(parts[rule.index()], field));
    } catch (ConversionException e) {
      throw e.withContext(model.entityId(), record);
    }
  }

  /** Literal split that keeps empty components. */
  static String[] split(String text, String separator) {
    if (separator.isEmpty()) return new String[] {text};
    List<String> parts = new ArrayList<>();
    int start = 0;
    int at;
    while ((at = text.indexOf(separator, start)) >= 0) {
      parts.add(text.substring(start, at));
      start = at + separator.length();
    }
    parts.add(text.substring(start));
    return parts.toArray(new String[0]);
  }
}
