package co.strata.mapper;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class AwsAttributeValuesTest {

  @Test
  void scalarsMapToTheirSdkVariants() {
    assertThat(AwsAttributeValues.toAttributeValue(AttributeValueNode.s("x"))).isEqualTo(AttributeValue.fromS("x"));
    assertThat(AwsAttributeValues.toAttributeValue(AttributeValueNode.n("1.5"))).isEqualTo(AttributeValue.fromN("1.5"));
    assertThat(AwsAttributeValues.toAttributeValue(AttributeValueNode.bool(true))).isEqualTo(AttributeValue.fromBool(true));
    assertThat(AwsAttributeValues.toAttributeValue(AttributeValueNode.nul())).isEqualTo(AttributeValue.fromNul(true));
    assertThat(AwsAttributeValues.toAttributeValue(AttributeValueNode.b(new byte[] {7})))
        .isEqualTo(AttributeValue.fromB(SdkBytes.fromByteArray(new byte[] {7})));
  }

  @Test
  void setsAndDocumentsAreConvertedRecursively() {
    AttributeValueNode nested = new AttributeValueNode.MapValue(Map.of(
        "tags", new AttributeValueNode.StringSetValue(List.of("a", "b")),
        "sizes", new AttributeValueNode.NumberSetValue(List.of("1", "2")),
        "blobs", new AttributeValueNode.BinarySetValue(List.of(ByteBuffer.wrap(new byte[] {1}))),
        "items", new AttributeValueNode.ListValue(List.of(AttributeValueNode.s("x"), AttributeValueNode.nul()))));

    AttributeValue value = AwsAttributeValues.toAttributeValue(nested);

    assertThat(value.type()).isEqualTo(AttributeValue.Type.M);
    assertThat(value.m().get("tags").ss()).containsExactly("a", "b");
    assertThat(value.m().get("sizes").ns()).containsExactly("1", "2");
    assertThat(value.m().get("blobs").bs()).containsExactly(SdkBytes.fromByteArray(new byte[] {1}));
    assertThat(value.m().get("items").l()).containsExactly(AttributeValue.fromS("x"), AttributeValue.fromNul(true));
    assertThat(AwsAttributeValues.fromAttributeValue(value)).isEqualTo(nested);
  }

  @Test
  void itemKeepsAttributeOrder() {
    RawRecord record = RawRecord.builder().s("pk", "P").s("sk", "META").n("qty", 3).build();

    Map<String, AttributeValue> item = AwsAttributeValues.toItem(record);

    assertThat(item.keySet()).containsExactly("pk", "sk", "qty");
    assertThat(AwsAttributeValues.fromItem(item)).isEqualTo(record);
  }

  @Test
  void sdkValuesReadBackAsNodes() {
    assertThat(AwsAttributeValues.fromAttributeValue(AttributeValue.fromBool(false)))
        .isEqualTo(AttributeValueNode.bool(false));
    assertThat(AwsAttributeValues.fromAttributeValue(AttributeValue.fromNul(true)).kind())
        .isEqualTo(AttributeValueNode.Kind.NULL);
    assertThat(AwsAttributeValues.fromAttributeValue(AttributeValue.fromB(SdkBytes.fromUtf8String("hi"))))
        .isEqualTo(AttributeValueNode.b("hi".getBytes()));
  }

  @Test
  void unknownSdkValueIsRejected() {
    assertThatThrownBy(() -> AwsAttributeValues.fromAttributeValue(AttributeValue.builder().build()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
