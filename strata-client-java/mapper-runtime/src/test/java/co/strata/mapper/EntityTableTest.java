package co.strata.mapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class EntityTableTest {

  private static final String PK = "TENANT#T1#ORDER#O1";

  private InMemoryStore store;
  private EntityTable<Order> orders;
  private EntityTable<OrderLine> lines;

  @BeforeEach
  void setUp() {
    MappingContext context = Fixtures.context().build();
    store = new InMemoryStore("pk", "sk");
    orders = new EntityTable<>(context, "Order", store, store);
    lines = new EntityTable<>(context, "OrderLine", store, store);

    Order order = Fixtures.sampleOrder();
    order.setLines(List.of(
        new OrderLine("T1", "O1", 2, "SKU-2", 1),
        new OrderLine("T1", "O1", 1, "SKU-1", 3)));
    orders.put(order);
  }

  @Test
  void putWritesTheOrderAndItsLines() {
    assertThat(orders.tableName()).isEqualTo("app");
    assertThat(store.size("app")).isEqualTo(3);
  }

  @Test
  void getReadsOneEntityByPrimaryKey() {
    assertThat(orders.get(PK, "META")).hasValueSatisfying(order -> {
      assertThat(order.getOrderId()).isEqualTo("O1");
      assertThat(order.getTags()).containsExactly("gift", "express");
    });
    assertThat(lines.get(PK, "LINE#1")).hasValueSatisfying(line -> assertThat(line.getQty()).isEqualTo(3));
  }

  @Test
  void recordOfAnotherShapeReadsAsAbsent() {
    assertThat(orders.get(PK, "LINE#1")).isEmpty();
    assertThat(orders.get("TENANT#T1#ORDER#missing", "META")).isEmpty();
  }

  @Test
  void sortKeyIsRequiredWhenTheShapeHasOne() {
    assertThatThrownBy(() -> orders.get(PK))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("sort key");
    assertThatThrownBy(() -> orders.get(null, "META"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void queryAssemblesTheAggregate() {
    ReconstructionResult<Order> result = orders.query(PK);

    assertThat(result.hasWarnings()).isFalse();
    assertThat(result.entities()).singleElement().satisfies(order ->
        assertThat(order.getLines()).extracting(OrderLine::getLineNo).containsExactly(1, 2));
  }

  @Test
  void queryAllMapsMatchingRecordsOneByOne() {
    assertThat(lines.queryAll(PK)).extracting(OrderLine::getSku).containsExactly("SKU-1", "SKU-2");
    assertThat(orders.queryAll(PK)).hasSize(1);
  }

  @Test
  void putReplacesTheStoredRecord() {
    Order cancelled = Fixtures.sampleOrder();
    cancelled.setStatus(Order.Status.CANCELLED);

    orders.put(cancelled);

    assertThat(store.size("app")).isEqualTo(3);
    assertThat(orders.get(PK, "META")).hasValueSatisfying(
        order -> assertThat(order.getStatus()).isEqualTo(Order.Status.CANCELLED));
  }
}
