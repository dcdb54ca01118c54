package co.strata.mapper;

import java.util.List;
import java.util.Optional;

/** Read side of the store: supplies raw records. Transport and retries are its business. */
public interface RecordSource {

  /** Single record by its full primary key. */
  Optional<RawRecord> get(String tableName, RawRecord key);

  /** Every record sharing one partition key value, in sort key order. */
  List<RawRecord> query(String tableName, String partitionAttribute, AttributeValueNode partitionValue);
}
