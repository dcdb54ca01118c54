package co.strata.mapper;

import co.strata.core.FieldType;
import co.strata.core.KeyRole;
import co.strata.core.schema.FieldDescriptor;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

public class ValueCodecTest {

  private final ValueCodec codec = new ValueCodec();

  private static FieldDescriptor field(String name, FieldType type, String format, String zone, List<String> enumValues) {
    return new FieldDescriptor(name, name, type, type.isSet() ? type.elementType() : null,
        false, false, false, KeyRole.NONE, null, format, zone == null ? null : ZoneId.of(zone),
        enumValues, false, null, null);
  }

  private static FieldDescriptor field(String name, FieldType type) {
    return FieldDescriptor.of(name, type);
  }

  @Test
  void stringsAndIntegersUseTheirNativeVariants() {
    assertThat(codec.encode("abc", field("s", FieldType.STRING))).isEqualTo(AttributeValueNode.s("abc"));
    assertThat(codec.encode(42, field("i", FieldType.INT))).isEqualTo(AttributeValueNode.n("42"));
    assertThat(codec.decode(AttributeValueNode.n("42"), field("i", FieldType.INT))).isEqualTo(42);
    assertThat(codec.decode(AttributeValueNode.n("9000000000"), field("l", FieldType.LONG))).isEqualTo(9_000_000_000L);
  }

  @Test
  void decimalsKeepTheirScale() {
    FieldDescriptor price = field("price", FieldType.DECIMAL);
    AttributeValueNode node = codec.encode(new BigDecimal("12.50"), price);

    assertThat(node).isEqualTo(AttributeValueNode.n("12.50"));
    assertThat(codec.decode(node, price)).isEqualTo(new BigDecimal("12.50"));
  }

  @Test
  void formattedNumberIsStoredAsTextAndReadBack() {
    FieldDescriptor total = field("total", FieldType.DECIMAL, "0.00", null, null);

    AttributeValueNode node = codec.encode(new BigDecimal("5"), total);

    assertThat(node).isEqualTo(AttributeValueNode.s("5.00"));
    assertThat((BigDecimal) codec.decode(node, total)).isEqualByComparingTo("5");
  }

  @Test
  void groupedFormatFallsBackToTheDeclaredPattern() {
    FieldDescriptor amount = field("amount", FieldType.DECIMAL, "#,##0.00", null, null);

    assertThat(codec.encode(new BigDecimal("1234.5"), amount)).isEqualTo(AttributeValueNode.s("1,234.50"));
    assertThat((BigDecimal) codec.decode(AttributeValueNode.s("1,234.50"), amount)).isEqualByComparingTo("1234.5");
  }

  @Test
  void nanCannotBeStored() {
    assertThatThrownBy(() -> codec.encode(Double.NaN, field("d", FieldType.DOUBLE)))
        .isInstanceOf(ConversionException.class)
        .extracting(e -> ((ConversionException) e).operation())
        .isEqualTo(MappingException.Operation.ENCODE);
  }

  @Test
  void integerFieldsRejectValuesTheyCannotReadBack() {
    FieldDescriptor count = field("count", FieldType.INT);

    assertThatThrownBy(() -> codec.encode(1.5, count))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("does not fit number.int");
    assertThatThrownBy(() -> codec.encode(9_000_000_000L, count))
        .isInstanceOf(ConversionException.class);
    assertThatThrownBy(() -> codec.encode(new LinkedHashSet<>(List.of(1, 2.5)), field("sizes", FieldType.LONG_SET)))
        .isInstanceOf(ConversionException.class);
    assertThatThrownBy(() -> codec.encode(new BigDecimal("1.5"), field("n", FieldType.LONG, "0", null, null)))
        .isInstanceOf(ConversionException.class);
    assertThat(codec.encode(new BigDecimal("2.0"), count)).isEqualTo(AttributeValueNode.n("2.0"));
    assertThat(codec.decode(AttributeValueNode.n("2.0"), count)).isEqualTo(2);
  }

  @Test
  void nonIntegralTextIsNotAnInt() {
    assertThatThrownBy(() -> codec.decode(AttributeValueNode.n("1.5"), field("i", FieldType.INT)))
        .isInstanceOf(ConversionException.class);
  }

  @Test
  void timestampIsNormalizedToTheDeclaredZone() {
    FieldDescriptor at = field("at", FieldType.TIMESTAMP, null, "Europe/Paris", null);
    OffsetDateTime utc = OffsetDateTime.parse("2024-01-15T10:00:00Z");

    AttributeValueNode node = codec.encode(utc, at);

    assertThat(node).isEqualTo(AttributeValueNode.s("2024-01-15T11:00:00+01:00"));
    OffsetDateTime back = (OffsetDateTime) codec.decode(node, at);
    assertThat(back.isEqual(utc)).isTrue();
    assertThat(back.getOffset().getTotalSeconds()).isEqualTo(3600);
  }

  @Test
  void formattedTimestampWithoutOffsetReadsInTheDeclaredZone() {
    FieldDescriptor at = field("at", FieldType.TIMESTAMP, "yyyy-MM-dd HH:mm", "UTC", null);
    OffsetDateTime time = OffsetDateTime.parse("2024-01-15T10:30:00Z");

    AttributeValueNode node = codec.encode(time, at);

    assertThat(node).isEqualTo(AttributeValueNode.s("2024-01-15 10:30"));
    assertThat(((OffsetDateTime) codec.decode(node, at)).isEqual(time)).isTrue();
  }

  @Test
  void formattedTimestampWithoutZoneKeepsTheInstant() {
    FieldDescriptor at = field("at", FieldType.TIMESTAMP, "yyyy-MM-dd HH:mm", null, null);
    OffsetDateTime paris = OffsetDateTime.parse("2024-01-15T10:30:00+02:00");

    AttributeValueNode node = codec.encode(paris, at);

    assertThat(node).isEqualTo(AttributeValueNode.s("2024-01-15 08:30"));
    assertThat(((OffsetDateTime) codec.decode(node, at)).isEqual(paris)).isTrue();
  }

  @Test
  void datesAndEpochs() {
    FieldDescriptor day = field("day", FieldType.DATE);
    FieldDescriptor epoch = field("seen", FieldType.EPOCH);
    Instant instant = Instant.ofEpochMilli(1_700_000_000_000L);

    assertThat(codec.encode(LocalDate.of(2024, 2, 29), day)).isEqualTo(AttributeValueNode.s("2024-02-29"));
    assertThat(codec.decode(AttributeValueNode.s("2024-02-29"), day)).isEqualTo(LocalDate.of(2024, 2, 29));
    assertThat(codec.encode(instant, epoch)).isEqualTo(AttributeValueNode.n("1700000000000"));
    assertThat(codec.decode(AttributeValueNode.n("1700000000000"), epoch)).isEqualTo(instant);
  }

  @Test
  void nullAndEmptySetEncodeToNull() {
    assertThat(codec.encode(null, field("s", FieldType.STRING)).kind()).isEqualTo(AttributeValueNode.Kind.NULL);
    assertThat(codec.encode(Set.of(), field("tags", FieldType.STRING_SET)).kind())
        .isEqualTo(AttributeValueNode.Kind.NULL);
    assertThat(codec.decode(AttributeValueNode.nul(), field("s", FieldType.STRING))).isNull();
    assertThat(codec.decode(null, field("s", FieldType.STRING))).isNull();
  }

  @Test
  void setsKeepTheirElementType() {
    Set<String> tags = new LinkedHashSet<>(List.of("b", "a"));
    FieldDescriptor strings = field("tags", FieldType.STRING_SET);
    FieldDescriptor ints = field("sizes", FieldType.INT_SET);

    AttributeValueNode node = codec.encode(tags, strings);

    assertThat(node).isEqualTo(new AttributeValueNode.StringSetValue(List.of("b", "a")));
    assertThat(codec.decode(node, strings)).isEqualTo(tags);
    assertThat(codec.encode(new LinkedHashSet<>(List.of(3, 1)), ints))
        .isEqualTo(new AttributeValueNode.NumberSetValue(List.of("3", "1")));
    assertThat(codec.decode(new AttributeValueNode.NumberSetValue(List.of("3", "1")), ints))
        .asInstanceOf(InstanceOfAssertFactories.ITERABLE)
        .containsExactly(3, 1);
  }

  @Test
  void kindMismatchNamesTheField() {
    assertThatThrownBy(() -> codec.decode(AttributeValueNode.n("1"), field("name", FieldType.STRING)))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("name")
        .satisfies(e -> {
          ConversionException ce = (ConversionException) e;
          assertThat(ce.targetType()).isEqualTo(FieldType.STRING);
          assertThat(ce.node()).isEqualTo(AttributeValueNode.n("1"));
          assertThat(ce.operation()).isEqualTo(MappingException.Operation.DECODE);
        });
  }

  @Test
  void enumValuesAreChecked() {
    FieldDescriptor status = field("status", FieldType.ENUM, null, null, List.of("OPEN", "SHIPPED"));

    assertThat(codec.encode(Order.Status.OPEN, status)).isEqualTo(AttributeValueNode.s("OPEN"));
    assertThatThrownBy(() -> codec.encode("LOST", status)).isInstanceOf(ConversionException.class);
    assertThatThrownBy(() -> codec.decode(AttributeValueNode.s("LOST"), status))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("LOST");
  }

  @Test
  void nestedDocumentsAreUntyped() {
    FieldDescriptor attrs = field("attrs", FieldType.MAP);
    Map<String, Object> value = Map.of("color", "red", "fragile", true);

    AttributeValueNode node = codec.encode(value, attrs);

    assertThat(node.kind()).isEqualTo(AttributeValueNode.Kind.M);
    assertThat(((AttributeValueNode.MapValue) node).values())
        .containsEntry("color", AttributeValueNode.s("red"))
        .containsEntry("fragile", AttributeValueNode.bool(true));
    assertThat(codec.decode(node, attrs)).isEqualTo(value);
  }

  @Test
  void typedListUsesItsElementType() {
    FieldDescriptor sizes = new FieldDescriptor("sizes", "sizes", FieldType.LIST, FieldType.INT,
        false, false, false, KeyRole.NONE, null, null, null, List.of(), false, null, null);

    AttributeValueNode node = codec.encode(List.of(3, 1, 3), sizes);

    assertThat(node).isEqualTo(new AttributeValueNode.ListValue(
        List.of(AttributeValueNode.n("3"), AttributeValueNode.n("1"), AttributeValueNode.n("3"))));
    assertThat(codec.decode(node, sizes)).isEqualTo(List.of(3, 1, 3));
  }

  @Test
  void binaryRoundTrip() {
    FieldDescriptor blob = field("blob", FieldType.BINARY);
    byte[] bytes = {1, 2, 3};

    AttributeValueNode node = codec.encode(bytes, blob);

    assertThat(node).isEqualTo(AttributeValueNode.b(new byte[] {1, 2, 3}));
    assertThat((byte[]) codec.decode(node, blob)).containsExactly(1, 2, 3);
  }

  @Test
  void keyTextUsesThePlaceholderFormat() {
    FieldDescriptor at = field("at", FieldType.TIMESTAMP, null, "UTC", null);
    OffsetDateTime time = OffsetDateTime.parse("2024-03-05T08:00:00Z");

    assertThat(codec.toKeyText(time, at, "yyyy-MM")).isEqualTo("2024-03");
    assertThat(codec.toKeyText(7, field("n", FieldType.INT), null)).isEqualTo("7");
    assertThat(codec.toKeyText(true, field("b", FieldType.BOOLEAN), null)).isEqualTo("true");
  }

  @Test
  void keyFormatOnUnformattableValueIsRejected() {
    assertThatThrownBy(() -> codec.toKeyText(true, field("b", FieldType.BOOLEAN), "x"))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("does not apply to boolean");
    assertThatThrownBy(() -> codec.toKeyText(new byte[] {1}, field("raw", FieldType.BINARY), "x"))
        .isInstanceOf(ConversionException.class);
    assertThat(codec.toKeyText(7, field("n", FieldType.INT), "000")).isEqualTo("007");
  }

  @ParameterizedTest
  @ValueSource(strings = {"yes", "TRUE", "1", ""})
  void booleanKeyComponentMustBeLiteral(String text) {
    assertThatThrownBy(() -> codec.fromKeyText(text, field("b", FieldType.BOOLEAN)))
        .isInstanceOf(ConversionException.class);
  }

  @Test
  void keyComponentsParseIntoTheFieldType() {
    assertThat(codec.fromKeyText("12", field("n", FieldType.INT))).isEqualTo(12);
    assertThat(codec.fromKeyText("false", field("b", FieldType.BOOLEAN))).isEqualTo(false);
    assertThat(codec.fromKeyText("2024-02-29", field("d", FieldType.DATE))).isEqualTo(LocalDate.of(2024, 2, 29));
  }
}
