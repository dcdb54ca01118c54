package co.strata.mapper;

import co.strata.core.schema.SchemaCatalog;
import co.strata.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Everything the mappers of one catalog share: codec, key compiler, discriminator, encryption
 * hook, options and the accessor of each entity shape.
 *
 * <p>Mappers and reconstructors are built on first use and memoized per entity id. Each is
 * built at most once, even when first requested by many threads at the same time.
 */
public final class MappingContext {

  private static final Logger log = LoggerFactory.getLogger(MappingContext.class);

  private final SchemaCatalog catalog;
  private final ValueCodec codec;
  private final KeyCompiler keys;
  private final EntityDiscriminator discriminator;
  private final FieldEncryptor encryptor;
  private final MapperOptions options;
  private final Map<String, EntityAccessor<?>> accessors;

  private final ConcurrentHashMap<String, RecordMapper<?>> mappers = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, MultiRecordReconstructor<?>> reconstructors = new ConcurrentHashMap<>();
  private final AtomicInteger mappersBuilt = new AtomicInteger();

  private MappingContext(Builder b) {
    this.catalog = b.catalog;
    this.codec = b.codec;
    this.options = b.options;
    this.keys = new KeyCompiler(codec, options.extractionPolicy());
    this.discriminator = new EntityDiscriminator(options.warnOnAmbiguousDiscrimination());
    this.encryptor = b.encryptor;
    this.accessors = Map.copyOf(b.accessors);
  }

  public static Builder builder(SchemaCatalog catalog) {
    return new Builder(catalog);
  }

  /**
   * Mapper of one entity shape. Shapes without a registered accessor map to
   * {@link DynamicEntity}.
   *
   * @throws IllegalArgumentException if the catalog has no such entity
   */
  @SuppressWarnings("unchecked")
  public <T> RecordMapper<T> mapper(String entityId) {
    RecordMapper<?> existing = mappers.get(entityId);
    if (existing != null) return (RecordMapper<T>) existing;
    SchemaModel model = catalog.require(entityId);
    return (RecordMapper<T>) mappers.computeIfAbsent(entityId, id -> newMapper(model));
  }

  @SuppressWarnings("unchecked")
  public <T> MultiRecordReconstructor<T> reconstructor(String entityId) {
    RecordMapper<T> mapper = mapper(entityId);
    return (MultiRecordReconstructor<T>) reconstructors.computeIfAbsent(entityId,
        id -> new MultiRecordReconstructor<>(mapper, discriminator, this::mapper));
  }

  /** Shape of a record read from {@code tableName}, among the shapes stored there. */
  public Optional<SchemaModel> resolve(String tableName, RawRecord record) {
    return discriminator.resolve(record, catalog.modelsForTable(tableName));
  }

  public Optional<SchemaModel> resolve(String tableName, RawRecord record, Consumer<MappingWarning> warnings) {
    return discriminator.resolve(record, catalog.modelsForTable(tableName), warnings);
  }

  /** Map a record of a multi-shape table with whichever shape it belongs to. */
  public Optional<Object> fromRecord(String tableName, RawRecord record) {
    return resolve(tableName, record).map(model -> mapper(model.entityId()).fromRecord(record));
  }

  public SchemaCatalog catalog() { return catalog; }

  public ValueCodec codec() { return codec; }

  public KeyCompiler keyCompiler() { return keys; }

  public EntityDiscriminator discriminator() { return discriminator; }

  public MapperOptions options() { return options; }

  public List<String> registeredEntities() {
    return List.copyOf(accessors.keySet());
  }

  int mappersBuilt() {
    return mappersBuilt.get();
  }

  private RecordMapper<?> newMapper(SchemaModel model) {
    EntityAccessor<?> accessor = accessors.getOrDefault(model.entityId(), DynamicEntity.ACCESSOR);
    mappersBuilt.incrementAndGet();
    log.debug("Building mapper for {} (table {})", model.entityId(), model.tableName());
    return create(model, accessor);
  }

  private <T> RecordMapper<T> create(SchemaModel model, EntityAccessor<T> accessor) {
    return new RecordMapper<>(model, accessor, codec, keys, encryptor, options, this::mapper);
  }

  public static final class Builder {
    private final SchemaCatalog catalog;
    private ValueCodec codec = new ValueCodec();
    private FieldEncryptor encryptor;
    private MapperOptions options = MapperOptions.DEFAULTS;
    private final Map<String, EntityAccessor<?>> accessors = new HashMap<>();

    private Builder(SchemaCatalog catalog) {
      this.catalog = catalog;
    }

    /**
     * @throws IllegalArgumentException if the catalog has no such entity
     */
    public <T> Builder register(String entityId, EntityAccessor<T> accessor) {
      catalog.require(entityId);
      accessors.put(entityId, accessor);
      return this;
    }

    public Builder codec(ValueCodec codec) {
      this.codec = codec;
      return this;
    }

    public Builder encryptor(FieldEncryptor encryptor) {
      this.encryptor = encryptor;
      return this;
    }

    public Builder options(MapperOptions options) {
      this.options = options;
      return this;
    }

    public MappingContext build() {
      return new MappingContext(this);
    }
  }
}
