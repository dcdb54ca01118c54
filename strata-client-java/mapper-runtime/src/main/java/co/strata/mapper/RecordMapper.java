package co.strata.mapper;

import co.strata.core.FieldType;
import co.strata.core.ScalarType;
import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.RelationshipDescriptor;
import co.strata.core.schema.SchemaModel;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Maps one entity shape between domain objects and raw records.
 *
 * <p>Write: derived keys are computed in dependency order, every stored field is encoded (and
 * encrypted when declared), and NULL nodes are dropped unless the field is nullable and stores
 * nulls. Read: every stored field present is decrypted and decoded, extracted fields are split
 * out of their sources, and only then is the entity constructed.
 *
 * <p>A mapper holds no per-call state and can be shared between threads.
 */
public class RecordMapper<T> {

  private final SchemaModel model;
  private final EntityAccessor<T> accessor;
  private final ValueCodec codec;
  private final KeyCompiler keys;
  private final FieldEncryptor encryptor;
  private final MapperOptions options;
  private final Function<String, RecordMapper<?>> relationshipMappers;

  /**
   * @param encryptor hook for encrypted fields, or {@code null} when the shape has none
   * @param relationshipMappers mapper of a relationship's target entity, by entity id; only
   *                            needed by {@link #toRecords}
   */
  public RecordMapper(SchemaModel model,
                      EntityAccessor<T> accessor,
                      ValueCodec codec,
                      KeyCompiler keys,
                      FieldEncryptor encryptor,
                      MapperOptions options,
                      Function<String, RecordMapper<?>> relationshipMappers) {
    this.model = model;
    this.accessor = accessor;
    this.codec = codec;
    this.keys = keys;
    this.encryptor = encryptor;
    this.options = options;
    this.relationshipMappers = relationshipMappers;
  }

  /** Mapper with the default codec and options, no encryption and no relationship targets. */
  public static <T> RecordMapper<T> of(SchemaModel model, EntityAccessor<T> accessor) {
    ValueCodec codec = new ValueCodec();
    return new RecordMapper<>(model, accessor, codec,
        new KeyCompiler(codec, MapperOptions.DEFAULTS.extractionPolicy()), null, MapperOptions.DEFAULTS, null);
  }

  public SchemaModel model() { return model; }

  public EntityAccessor<T> accessor() { return accessor; }

  /**
   * Serialize one entity. Derived key fields are written back onto the entity.
   *
   * @throws IncompleteKeyMaterialException if a derived key source is absent
   * @throws ConversionException if a value does not fit its field type
   * @throws FieldEncryptionException if the encryption hook fails
   */
  public RawRecord toRecord(T entity) {
    keys.computeAll(entity, accessor, model);

    RawRecord.Builder record = RawRecord.builder();
    for (FieldDescriptor f : model.storedFields()) {
      AttributeValueNode node;
      try {
        node = codec.encode(accessor.get(entity, f.sourceName()), f);
      } catch (ConversionException e) {
        throw e.withContext(model.entityId(), null);
      }
      if (node.kind() == AttributeValueNode.Kind.NULL) {
        if (f.storeNull()) record.put(f.storedName(), node);
        continue;
      }
      if (f.encrypted()) {
        node = encrypt(node, f);
      }
      record.put(f.storedName(), node);
    }
    return record.build();
  }

  /**
   * Serialize an entity and its populated relationships: the entity's own record first, then
   * one record per related entity, mapped with the target shape.
   */
  public List<RawRecord> toRecords(T entity) {
    List<RawRecord> records = new ArrayList<>();
    records.add(toRecord(entity));
    for (RelationshipDescriptor r : model.relationships()) {
      Object value = accessor.get(entity, r.targetFieldName());
      if (value == null) continue;
      RecordMapper<Object> target = relationshipMapper(r);
      if (r.collection()) {
        for (Object child : (Collection<?>) value) {
          if (child != null) records.add(target.toRecord(child));
        }
      } else {
        records.add(target.toRecord(value));
      }
    }
    return records;
  }

  /**
   * Deserialize one record.
   *
   * @throws EntityConstructionException if a required field is missing or the accessor fails
   * @throws ConversionException if a stored value does not fit its field type
   * @throws KeyExtractionException if strict extraction finds too few key components
   */
  public T fromRecord(RawRecord record) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (FieldDescriptor f : model.storedFields()) {
      AttributeValueNode node = record.get(f.storedName());
      if (node == null || node.kind() == AttributeValueNode.Kind.NULL) {
        if (f.required()) {
          throw new EntityConstructionException(model.entityId(), record, f.sourceName(), null);
        }
        continue;
      }
      if (f.encrypted()) {
        node = decrypt(node, f, record);
      }
      try {
        values.put(f.sourceName(), codec.decode(node, f));
      } catch (ConversionException e) {
        throw e.withContext(model.entityId(), record);
      }
    }

    for (FieldDescriptor f : model.extractedFields()) {
      keys.extract(model, f, values::get, values::put, record);
    }

    try {
      T entity = accessor.newInstance();
      for (Map.Entry<String, Object> e : values.entrySet()) {
        if (e.getValue() != null) accessor.set(entity, e.getKey(), e.getValue());
      }
      return entity;
    } catch (MappingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EntityConstructionException(model.entityId(), record, null, e);
    }
  }

  @SuppressWarnings("unchecked")
  private RecordMapper<Object> relationshipMapper(RelationshipDescriptor r) {
    if (relationshipMappers == null) {
      throw new IllegalStateException(model.entityId() + "." + r.targetFieldName()
          + ": no mapper available for relationship target " + r.targetEntity());
    }
    return (RecordMapper<Object>) relationshipMappers.apply(r.targetEntity());
  }

  // =========================================================================
  // Encryption
  // =========================================================================

  private AttributeValueNode encrypt(AttributeValueNode node, FieldDescriptor f) {
    FieldEncryptor hook = requireEncryptor(f, null, MappingException.Operation.ENCRYPT);
    byte[] plaintext = node instanceof AttributeValueNode.BinaryValue b
        ? b.value()
        : plaintextOf(node).getBytes(StandardCharsets.UTF_8);
    return AttributeValueNode.b(await(() -> hook.encrypt(plaintext, context(f)), f, null,
        MappingException.Operation.ENCRYPT));
  }

  private AttributeValueNode decrypt(AttributeValueNode node, FieldDescriptor f, RawRecord record) {
    if (!(node instanceof AttributeValueNode.BinaryValue ciphertext)) {
      throw new FieldEncryptionException("expected an encrypted B value but found " + node.kind(),
          model.entityId(), f.sourceName(), record, MappingException.Operation.DECRYPT, null);
    }
    FieldEncryptor hook = requireEncryptor(f, record, MappingException.Operation.DECRYPT);
    byte[] plaintext = await(() -> hook.decrypt(ciphertext.value(), context(f)), f, record,
        MappingException.Operation.DECRYPT);
    if (f.type() == FieldType.BINARY) {
      return AttributeValueNode.b(plaintext);
    }
    String text = new String(plaintext, StandardCharsets.UTF_8);
    if (f.type() == FieldType.BOOLEAN) {
      return AttributeValueNode.bool(Boolean.parseBoolean(text));
    }
    boolean number = f.type() == FieldType.EPOCH || (f.scalarType() == ScalarType.NUMBER && f.format() == null);
    return number ? AttributeValueNode.n(text) : AttributeValueNode.s(text);
  }

  private static String plaintextOf(AttributeValueNode node) {
    if (node instanceof AttributeValueNode.BoolValue b) return Boolean.toString(b.value());
    return node.text();
  }

  private FieldEncryptor requireEncryptor(FieldDescriptor f, RawRecord record, MappingException.Operation op) {
    if (encryptor == null) {
      throw new FieldEncryptionException("field is encrypted but no field encryptor is configured",
          model.entityId(), f.sourceName(), record, op, null);
    }
    return encryptor;
  }

  private FieldEncryptionContext context(FieldDescriptor f) {
    return new FieldEncryptionContext(model.entityId(), f.sourceName(), f.storedName(),
        options.encryptionContextId());
  }

  /** Runs one hook call and waits for it; any failure becomes a {@link FieldEncryptionException}. */
  private byte[] await(HookCall call, FieldDescriptor f, RawRecord record, MappingException.Operation op) {
    byte[] result;
    try {
      result = call.start().join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new FieldEncryptionException("encryption hook failed: " + cause.getMessage(),
          model.entityId(), f.sourceName(), record, op, cause);
    } catch (RuntimeException e) {
      throw new FieldEncryptionException("encryption hook failed: " + e.getMessage(),
          model.entityId(), f.sourceName(), record, op, e);
    }
    if (result == null) {
      throw new FieldEncryptionException("encryption hook returned no value",
          model.entityId(), f.sourceName(), record, op, null);
    }
    return result;
  }

  @FunctionalInterface
  private interface HookCall {
    CompletableFuture<byte[]> start();
  }
}
