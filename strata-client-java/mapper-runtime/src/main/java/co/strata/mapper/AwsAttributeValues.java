package co.strata.mapper;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts records to and from the AWS SDK v2 item shape, {@code Map<String, AttributeValue>},
 * so a DynamoDB client can serve as the read and write collaborator.
 */
public final class AwsAttributeValues {

  private AwsAttributeValues() {}

  public static Map<String, AttributeValue> toItem(RawRecord record) {
    Map<String, AttributeValue> item = new LinkedHashMap<>();
    record.attributes().forEach((name, node) -> item.put(name, toAttributeValue(node)));
    return item;
  }

  public static RawRecord fromItem(Map<String, AttributeValue> item) {
    RawRecord.Builder b = RawRecord.builder();
    item.forEach((name, value) -> b.put(name, fromAttributeValue(value)));
    return b.build();
  }

  public static AttributeValue toAttributeValue(AttributeValueNode node) {
    if (node instanceof AttributeValueNode.StringValue s) return AttributeValue.fromS(s.value());
    if (node instanceof AttributeValueNode.NumberValue n) return AttributeValue.fromN(n.value());
    if (node instanceof AttributeValueNode.BinaryValue b) return AttributeValue.fromB(SdkBytes.fromByteArray(b.value()));
    if (node instanceof AttributeValueNode.StringSetValue ss) return AttributeValue.fromSs(ss.values());
    if (node instanceof AttributeValueNode.NumberSetValue ns) return AttributeValue.fromNs(ns.values());
    if (node instanceof AttributeValueNode.BinarySetValue bs) {
      List<SdkBytes> bytes = new ArrayList<>(bs.values().size());
      for (ByteBuffer buffer : bs.values()) bytes.add(SdkBytes.fromByteBuffer(buffer.duplicate()));
      return AttributeValue.fromBs(bytes);
    }
    if (node instanceof AttributeValueNode.ListValue l) {
      List<AttributeValue> values = new ArrayList<>(l.values().size());
      for (AttributeValueNode n : l.values()) values.add(toAttributeValue(n));
      return AttributeValue.fromL(values);
    }
    if (node instanceof AttributeValueNode.MapValue m) {
      Map<String, AttributeValue> values = new LinkedHashMap<>();
      m.values().forEach((k, v) -> values.put(k, toAttributeValue(v)));
      return AttributeValue.fromM(values);
    }
    if (node instanceof AttributeValueNode.BoolValue b) return AttributeValue.fromBool(b.value());
    return AttributeValue.fromNul(true);
  }

  /**
   * @throws IllegalArgumentException for values of a type this SDK version does not know
   */
  public static AttributeValueNode fromAttributeValue(AttributeValue value) {
    switch (value.type()) {
      case S:
        return AttributeValueNode.s(value.s());
      case N:
        return AttributeValueNode.n(value.n());
      case B:
        return AttributeValueNode.b(value.b().asByteArray());
      case SS:
        return new AttributeValueNode.StringSetValue(value.ss());
      case NS:
        return new AttributeValueNode.NumberSetValue(value.ns());
      case BS: {
        List<ByteBuffer> buffers = new ArrayList<>(value.bs().size());
        for (SdkBytes b : value.bs()) buffers.add(b.asByteBuffer());
        return new AttributeValueNode.BinarySetValue(buffers);
      }
      case L: {
        List<AttributeValueNode> nodes = new ArrayList<>(value.l().size());
        for (AttributeValue v : value.l()) nodes.add(fromAttributeValue(v));
        return new AttributeValueNode.ListValue(nodes);
      }
      case M: {
        Map<String, AttributeValueNode> nodes = new LinkedHashMap<>();
        value.m().forEach((k, v) -> nodes.put(k, fromAttributeValue(v)));
        return new AttributeValueNode.MapValue(nodes);
      }
      case BOOL:
        return AttributeValueNode.bool(value.bool());
      case NUL:
        return AttributeValueNode.nul();
      default:
        throw new IllegalArgumentException("Unsupported attribute value type: " + value);
    }
  }
}
