package co.strata.mapper;

import co.strata.core.DefinitionLoader;
import co.strata.core.schema.SchemaBuilder;
import co.strata.core.schema.SchemaCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Order / OrderLine / Shipment single-table model shared by the mapper tests. */
final class Fixtures {

  private Fixtures() {}

  static SchemaCatalog catalog() {
    try (InputStream in = Fixtures.class.getResourceAsStream("/definitions/orders.json")) {
      return SchemaBuilder.build(DefinitionLoader.parse(in.readAllBytes()));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static SchemaCatalog catalog(String json) {
    try {
      return SchemaBuilder.build(DefinitionLoader.parse(json.getBytes()));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static MappingContext.Builder context() {
    return MappingContext.builder(catalog())
        .register("Order", ORDER)
        .register("OrderLine", ORDER_LINE)
        .register("Shipment", SHIPMENT);
  }

  static final EntityAccessor<Order> ORDER = orderAccessor();

  static final EntityAccessor<OrderLine> ORDER_LINE = StaticEntityAccessor.builder(OrderLine::new)
      .field("pk", String.class, OrderLine::getPk, OrderLine::setPk)
      .field("sk", String.class, OrderLine::getSk, OrderLine::setSk)
      .field("tenantId", String.class, OrderLine::getTenantId, OrderLine::setTenantId)
      .field("orderId", String.class, OrderLine::getOrderId, OrderLine::setOrderId)
      .field("lineNo", Integer.class, OrderLine::getLineNo, OrderLine::setLineNo)
      .field("sku", String.class, OrderLine::getSku, OrderLine::setSku)
      .field("qty", Integer.class, OrderLine::getQty, OrderLine::setQty)
      .field("price", BigDecimal.class, OrderLine::getPrice, OrderLine::setPrice)
      .build();

  static final EntityAccessor<Shipment> SHIPMENT = StaticEntityAccessor.builder(Shipment::new)
      .field("pk", String.class, Shipment::getPk, Shipment::setPk)
      .field("sk", String.class, Shipment::getSk, Shipment::setSk)
      .field("tenantId", String.class, Shipment::getTenantId, Shipment::setTenantId)
      .field("orderId", String.class, Shipment::getOrderId, Shipment::setOrderId)
      .field("shipmentId", String.class, Shipment::getShipmentId, Shipment::setShipmentId)
      .field("carrier", String.class, Shipment::getCarrier, Shipment::setCarrier)
      .field("shippedOn", LocalDate.class, Shipment::getShippedOn, Shipment::setShippedOn)
      .build();

  @SuppressWarnings("unchecked")
  private static EntityAccessor<Order> orderAccessor() {
    return StaticEntityAccessor.builder(Order::new)
        .field("pk", String.class, Order::getPk, Order::setPk)
        .field("sk", String.class, Order::getSk, Order::setSk)
        .field("tenantId", String.class, Order::getTenantId, Order::setTenantId)
        .field("orderId", String.class, Order::getOrderId, Order::setOrderId)
        .field("status", String.class,
            o -> o.getStatus() == null ? null : o.getStatus().name(),
            (o, v) -> o.setStatus(v == null ? null : Order.Status.valueOf(v)))
        .field("total", BigDecimal.class, Order::getTotal, Order::setTotal)
        .field("placedAt", OffsetDateTime.class, Order::getPlacedAt, Order::setPlacedAt)
        .field("note", String.class, Order::getNote, Order::setNote)
        .field("giftMessage", String.class, Order::getGiftMessage, Order::setGiftMessage)
        .field("tags", Set.class, Order::getTags, (o, v) -> o.setTags((Set<String>) v))
        .field("cardNumber", String.class, Order::getCardNumber, Order::setCardNumber)
        .field("lines", List.class, Order::getLines, (o, v) -> o.setLines((List<OrderLine>) v))
        .field("shipment", Shipment.class, Order::getShipment, Order::setShipment)
        .build();
  }

  static Order sampleOrder() {
    Order o = new Order("T1", "O1", Order.Status.OPEN);
    o.setTotal(new BigDecimal("19.90"));
    o.setPlacedAt(OffsetDateTime.parse("2024-05-01T10:15:30Z"));
    o.setTags(new LinkedHashSet<>(List.of("gift", "express")));
    return o;
  }
}
