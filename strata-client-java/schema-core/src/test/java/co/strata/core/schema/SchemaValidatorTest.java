package co.strata.core.schema;

import co.strata.core.model.EntityDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static co.strata.core.TestDefinitions.*;
import static org.assertj.core.api.Assertions.*;

public class SchemaValidatorTest {

  private static List<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
    return diagnostics.stream().map(Diagnostic::code).toList();
  }

  @Test
  void validatesHappyPath() {
    EntityDefinition d = entity("Order", "orders",
        key("pk", "partition"),
        key("sk", "sort"),
        field("total", "number.decimal"));

    assertThat(SchemaValidator.diagnose(List.of(d))).isEmpty();
    assertThatCode(() -> SchemaValidator.validate(d)).doesNotThrowAnyException();
  }

  @Test
  void rejectsMissingEntityNameAndTable() {
    EntityDefinition d = entity(null, null, key("pk", "partition"));

    assertThat(codes(SchemaValidator.diagnose(List.of(d))))
        .containsExactly(DiagnosticCode.MISSING_ENTITY_NAME, DiagnosticCode.MISSING_TABLE_NAME);
  }

  @Test
  void rejectsMissingPartitionKey() {
    EntityDefinition d = entity("Order", "orders", field("orderId", "string"));

    assertThatThrownBy(() -> SchemaValidator.validate(d))
        .isInstanceOf(SchemaBuildException.class)
        .hasMessageContaining("MISSING_PARTITION_KEY")
        .hasMessageContaining("Order: no partition key field");
  }

  @Test
  void rejectsMultiplePartitionAndSortKeys() {
    EntityDefinition d = entity("Order", "orders",
        key("a", "partition"), key("b", "partition"),
        key("c", "sort"), key("d", "sort"));

    assertThat(codes(SchemaValidator.diagnose(List.of(d))))
        .containsExactly(DiagnosticCode.MULTIPLE_PARTITION_KEYS, DiagnosticCode.MULTIPLE_SORT_KEYS);
  }

  @Test
  void rejectsDuplicateFieldsAndAttributeNames() {
    EntityDefinition.Field aliased = field("other", "string");
    aliased.attributeName = "pk";
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), field("pk", "string"), aliased);

    assertThat(codes(SchemaValidator.diagnose(List.of(d))))
        .contains(DiagnosticCode.DUPLICATE_FIELD, DiagnosticCode.DUPLICATE_ATTRIBUTE_NAME);
  }

  @Test
  void rejectsUnsupportedTypeAndBadKeyType() {
    EntityDefinition.Field flag = field("flag", "boolean");
    flag.keyRole = "sort";
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), field("x", "datetime"), flag);

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(d));
    assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.UNSUPPORTED_TYPE, DiagnosticCode.INVALID_KEY_ROLE);
    assertThat(diagnostics.get(0).fieldPath()).isEqualTo("Order.x");
  }

  @Test
  void rejectsEnumWithoutValues() {
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), field("status", "enum"));

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).containsExactly(DiagnosticCode.INVALID_ENUM_VALUES);
  }

  @Test
  void rejectsInvalidFormatAndTimezone() {
    EntityDefinition.Field created = field("created", "timestamp");
    created.format = "yyyy-MM-dd'";
    created.timezone = "Mars/Olympus";
    EntityDefinition.Field name = field("name", "string");
    name.format = "0.00";
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), created, name);

    assertThat(codes(SchemaValidator.diagnose(List.of(d))))
        .containsExactly(DiagnosticCode.INVALID_FORMAT, DiagnosticCode.INVALID_TIMEZONE, DiagnosticCode.INVALID_FORMAT);
  }

  @Test
  void rejectsEncryptedKeys() {
    EntityDefinition.Field pk = key("pk", "partition");
    pk.encrypted = true;

    assertThat(codes(SchemaValidator.diagnose(List.of(entity("Order", "orders", pk)))))
        .containsExactly(DiagnosticCode.ENCRYPTED_KEY_FIELD);
  }

  @Test
  void rejectsFieldThatIsBothDerivedAndExtracted() {
    EntityDefinition.Field both = derived("both", "#", "a");
    both.extractedFrom = extracted("x", "pk", 0).extractedFrom;
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), field("a", "string"), both);

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).contains(DiagnosticCode.CONFLICTING_FIELD_ROLES);
  }

  @Test
  void warnsOnRequiredAndNullable() {
    EntityDefinition.Field note = field("note", "string");
    note.required = true;
    note.nullable = true;

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(entity("Order", "orders", key("pk", "partition"), note)));
    assertThat(diagnostics).singleElement().satisfies(d -> {
      assertThat(d.code()).isEqualTo(DiagnosticCode.REQUIRED_AND_NULLABLE);
      assertThat(d.isError()).isFalse();
    });
  }

  @Test
  void detectsCircularKeyDependency() {
    EntityDefinition d = entity("Order", "orders",
        key("pk", "partition"),
        derived("a", "#", "b"),
        derived("b", "#", "a"));

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(d));
    assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.CIRCULAR_KEY_DEPENDENCY);
    assertThat(diagnostics.get(0).message()).contains("a -> b -> a");
  }

  @Test
  void detectsSelfReference() {
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), derived("a", "#", "a"));

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).containsExactly(DiagnosticCode.CIRCULAR_KEY_DEPENDENCY);
  }

  @Test
  void reportsStructuralBeforeGraphBeforeCrossFieldProblems() {
    EntityDefinition d = entity("Order", "orders",
        field("id", "string"),
        derived("a", "#", "b"),
        derived("b", "#", "a", "missing"));

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).containsExactly(
        DiagnosticCode.MISSING_PARTITION_KEY,
        DiagnosticCode.CIRCULAR_KEY_DEPENDENCY,
        DiagnosticCode.INVALID_DERIVED_KEY_SOURCE);
  }

  @Test
  void rejectsUnknownDerivedSourceAndBadTemplate() {
    EntityDefinition.Field templated = derived("sk", "#", "tenantId");
    templated.derivedFrom.format = "T#{0}#{1}";
    EntityDefinition d = entity("Order", "orders",
        derived("pk", "#", "tenantId", "customerId"),
        field("tenantId", "string"),
        templated);
    d.fields.get(0).keyRole = "partition";

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(d));
    assertThat(codes(diagnostics)).containsExactly(
        DiagnosticCode.INVALID_DERIVED_KEY_SOURCE, DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE);
    assertThat(diagnostics.get(0).message()).contains("'customerId' does not exist");
  }

  @Test
  void rejectsPlaceholderFormatOnUnformattableSource() {
    EntityDefinition.Field pk = derived("pk", "#", "active", "count", "at");
    pk.derivedFrom.format = "A#{0:x}#{1:yyyy-MM}#{2:yyyy-MM}";
    pk.keyRole = "partition";
    EntityDefinition d = entity("Flag", "flags",
        pk,
        field("active", "boolean"),
        field("count", "number.int"),
        field("at", "timestamp"));

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(d));
    assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.INVALID_DERIVED_KEY_TEMPLATE);
    assertThat(diagnostics.get(0).message()).contains("'active'").contains("boolean takes no format");
  }

  @Test
  void acceptsPlaceholderFormatsOnNumbersAndDates() {
    EntityDefinition.Field pk = derived("pk", "#", "count", "at", "day");
    pk.derivedFrom.format = "C#{0:0000}#{1:yyyy-MM}#{2:yyyyMMdd}";
    pk.keyRole = "partition";
    EntityDefinition d = entity("Tally", "tallies",
        pk,
        field("count", "number.int"),
        field("at", "timestamp"),
        field("day", "timestamp.date"));

    assertThat(SchemaValidator.diagnose(List.of(d))).isEmpty();
  }

  @Test
  void rejectsInvalidExtractedSourceIndexAndPolicy() {
    EntityDefinition.Field bad = extracted("tenantId", "missing", -1);
    bad.extractedFrom.policy = "sometimes";
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"), bad);

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).containsExactly(
        DiagnosticCode.INVALID_EXTRACTED_KEY_SOURCE,
        DiagnosticCode.INVALID_EXTRACTED_KEY_INDEX,
        DiagnosticCode.INVALID_EXTRACTION_POLICY);
  }

  @Test
  void rejectsRelationshipProblems() {
    EntityDefinition order = entity("Order", "orders", key("pk", "partition"));
    order.relationships = List.of(relationship("lines", "LINE#*", "OrderLine", true));

    assertThat(codes(SchemaValidator.diagnose(List.of(order)))).containsExactly(
        DiagnosticCode.UNKNOWN_RELATIONSHIP_TARGET, DiagnosticCode.RELATIONSHIP_WITHOUT_SORT_KEY);
  }

  @Test
  void rejectsRelationshipToAnotherTable() {
    EntityDefinition order = entity("Order", "orders", key("pk", "partition"), key("sk", "sort"));
    order.relationships = List.of(relationship("notes", "NOTE#*", "Note", true));
    EntityDefinition note = entity("Note", "notes", key("pk", "partition"), key("sk", "sort"));

    assertThat(SchemaValidator.diagnose(List.of(order, note)))
        .singleElement()
        .satisfies(d -> assertThat(d.message()).contains("is stored in notes"));
  }

  @Test
  void rejectsDiscriminatorWithoutValue() {
    EntityDefinition d = entity("Order", "orders", key("pk", "partition"));
    d.discriminator = attributeDiscriminator("entity_type", null);

    assertThat(codes(SchemaValidator.diagnose(List.of(d)))).containsExactly(DiagnosticCode.INVALID_KEY_PATTERN);
  }

  @Test
  void rejectsShapesThatCannotBeToldApart() {
    EntityDefinition a = entity("Customer", "single", key("pk", "partition"), key("sk", "sort"));
    EntityDefinition b = entity("Supplier", "single", key("pk", "partition"), key("sk", "sort"));

    List<Diagnostic> diagnostics = SchemaValidator.diagnose(List.of(a, b));
    assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.CONFLICTING_ENTITY_SHAPES);
    assertThat(diagnostics.get(0).fieldPath()).isEqualTo("Supplier");
  }

  @Test
  void acceptsShapesWithDistinctDiscriminators() {
    EntityDefinition a = entity("Customer", "single", key("pk", "partition"), key("sk", "sort"));
    a.discriminator = attributeDiscriminator("entity_type", "CUSTOMER");
    EntityDefinition b = entity("Supplier", "single", key("pk", "partition"), key("sk", "sort"));
    b.discriminator = sortKeyDiscriminator("SUPPLIER#*");
    EntityDefinition c = entity("Audit", "single", key("pk", "partition"), key("sk", "sort"));
    c.discriminator = sortKeyDiscriminator("AUDIT#*");

    assertThat(SchemaValidator.diagnose(List.of(a, b, c))).isEmpty();
  }

  @Test
  void reportsEveryProblemAtOnce() {
    EntityDefinition a = entity("A", "t", field("x", "nope"));
    EntityDefinition b = entity("B", null, key("pk", "partition"), derived("c", "#", "c"));

    SchemaBuildException e = catchThrowableOfType(
        () -> SchemaBuilder.build(List.of(a, b)), SchemaBuildException.class);

    assertThat(codes(e.diagnostics())).containsExactly(
        DiagnosticCode.UNSUPPORTED_TYPE,
        DiagnosticCode.MISSING_PARTITION_KEY,
        DiagnosticCode.MISSING_TABLE_NAME,
        DiagnosticCode.CIRCULAR_KEY_DEPENDENCY);
    assertThat(e).hasMessageStartingWith("4 schema error(s)");
  }
}
