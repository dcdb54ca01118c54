package co.strata.mapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link EntityAccessor} assembled from constructor, getter and setter references.
 *
 * <pre>{@code
 * EntityAccessor<Order> accessor = StaticEntityAccessor.builder(Order::new)
 *     .field("orderId", String.class, Order::getOrderId, Order::setOrderId)
 *     .field("total", BigDecimal.class, Order::getTotal, Order::setTotal)
 *     .build();
 * }</pre>
 */
public final class StaticEntityAccessor<T> implements EntityAccessor<T> {

  private final Supplier<T> factory;
  private final Map<String, Function<T, Object>> getters;
  private final Map<String, BiConsumer<T, Object>> setters;

  private StaticEntityAccessor(Builder<T> b) {
    this.factory = b.factory;
    this.getters = Map.copyOf(b.getters);
    this.setters = Map.copyOf(b.setters);
  }

  public static <T> Builder<T> builder(Supplier<T> factory) {
    return new Builder<>(factory);
  }

  @Override
  public T newInstance() {
    return factory.get();
  }

  @Override
  public Object get(T entity, String field) {
    Function<T, Object> getter = getters.get(field);
    if (getter == null) {
      throw new IllegalArgumentException("No getter registered for field " + field);
    }
    return getter.apply(entity);
  }

  @Override
  public void set(T entity, String field, Object value) {
    BiConsumer<T, Object> setter = setters.get(field);
    if (setter == null) {
      throw new IllegalArgumentException("No setter registered for field " + field);
    }
    setter.accept(entity, value);
  }

  public static final class Builder<T> {
    private final Supplier<T> factory;
    private final Map<String, Function<T, Object>> getters = new LinkedHashMap<>();
    private final Map<String, BiConsumer<T, Object>> setters = new LinkedHashMap<>();

    private Builder(Supplier<T> factory) {
      this.factory = factory;
    }

    public <V> Builder<T> field(String name, Class<V> type, Function<T, V> getter, BiConsumer<T, V> setter) {
      getters.put(name, getter::apply);
      setters.put(name, (entity, value) -> {
        if (value != null && !type.isInstance(value)) {
          throw new ClassCastException(name + " expects " + type.getName() + " but got "
              + value.getClass().getName());
        }
        setter.accept(entity, type.cast(value));
      });
      return this;
    }

    /** Field that is only written on read, such as a relationship target or an extracted component. */
    public <V> Builder<T> setter(String name, Class<V> type, BiConsumer<T, V> setter) {
      setters.put(name, (entity, value) -> setter.accept(entity, type.cast(value)));
      return this;
    }

    public StaticEntityAccessor<T> build() {
      return new StaticEntityAccessor<>(this);
    }
  }
}
