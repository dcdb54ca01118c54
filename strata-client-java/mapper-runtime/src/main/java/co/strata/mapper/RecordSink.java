package co.strata.mapper;

import java.util.List;

/** Write side of the store: persists raw records. */
public interface RecordSink {

  void put(String tableName, RawRecord record);

  default void putAll(String tableName, List<RawRecord> records) {
    for (RawRecord r : records) {
      put(tableName, r);
    }
  }
}
