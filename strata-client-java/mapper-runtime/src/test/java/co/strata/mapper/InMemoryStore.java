package co.strata.mapper;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Table store keeping AWS SDK items, the way a DynamoDB-backed source and sink would. */
final class InMemoryStore implements RecordSource, RecordSink {

  private final Map<String, List<Map<String, AttributeValue>>> tables = new HashMap<>();
  private final String partitionAttribute;
  private final String sortAttribute;

  InMemoryStore(String partitionAttribute, String sortAttribute) {
    this.partitionAttribute = partitionAttribute;
    this.sortAttribute = sortAttribute;
  }

  @Override
  public void put(String tableName, RawRecord record) {
    List<Map<String, AttributeValue>> items = tables.computeIfAbsent(tableName, k -> new ArrayList<>());
    Map<String, AttributeValue> item = AwsAttributeValues.toItem(record);
    items.removeIf(existing -> sameKey(existing, item));
    items.add(item);
  }

  @Override
  public Optional<RawRecord> get(String tableName, RawRecord key) {
    Map<String, AttributeValue> wanted = AwsAttributeValues.toItem(key);
    return tables.getOrDefault(tableName, List.of()).stream()
        .filter(item -> sameKey(item, wanted))
        .findFirst()
        .map(AwsAttributeValues::fromItem);
  }

  @Override
  public List<RawRecord> query(String tableName, String partitionAttribute, AttributeValueNode partitionValue) {
    AttributeValue wanted = AwsAttributeValues.toAttributeValue(partitionValue);
    return tables.getOrDefault(tableName, List.of()).stream()
        .filter(item -> wanted.equals(item.get(partitionAttribute)))
        .sorted(Comparator.comparing(item -> item.get(sortAttribute) == null ? "" : item.get(sortAttribute).s()))
        .map(AwsAttributeValues::fromItem)
        .toList();
  }

  int size(String tableName) {
    return tables.getOrDefault(tableName, List.of()).size();
  }

  private boolean sameKey(Map<String, AttributeValue> a, Map<String, AttributeValue> b) {
    return a.get(partitionAttribute).equals(b.get(partitionAttribute))
        && Objects.equals(a.get(sortAttribute), b.get(sortAttribute));
  }
}
