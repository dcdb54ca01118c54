package co.strata.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Declarative definition of one entity shape, as loaded from JSON.
 *
 * <p>Definitions are plain data. {@link co.strata.core.schema.SchemaBuilder} validates a batch
 * of them and compiles each into an immutable {@link co.strata.core.schema.SchemaModel}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityDefinition {
  public String schemaVersion;
  public String entityName;
  @JsonAlias({"table", "tableName"})
  public String tableName;
  public String description;
  public List<Field> fields;
  public List<Relationship> relationships;
  public Discriminator discriminator;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Field {
    public String name;
    /** Stored attribute name. Defaults to {@link #name}. */
    @JsonAlias({"attribute", "attributeName", "storedName"})
    public String attributeName;
    /**
     * Full field type, including optional dot-notation sub-type qualifier.
     *
     * <p>Examples:
     * <ul>
     *   <li>{@code "string"}          – plain string (S)</li>
     *   <li>{@code "number.long"}     – long integer (N)</li>
     *   <li>{@code "number.decimal"}  – arbitrary-precision decimal (N)</li>
     *   <li>{@code "boolean"}         – boolean (BOOL)</li>
     *   <li>{@code "binary"}          – raw bytes (B)</li>
     *   <li>{@code "timestamp"}       – ISO-8601 offset date-time (S)</li>
     *   <li>{@code "timestamp.epoch"} – epoch milliseconds (N)</li>
     *   <li>{@code "timestamp.date"}  – ISO-8601 date (S)</li>
     *   <li>{@code "enum"}            – one of {@link #enumValues} (S)</li>
     *   <li>{@code "map"}             – nested document (M)</li>
     *   <li>{@code "list"}            – list, element type from {@link #items} (L)</li>
     *   <li>{@code "stringSet"}, {@code "numberSet.*"}, {@code "binarySet"} – sets (SS, NS, BS)</li>
     * </ul>
     */
    public String type;
    /** Element type for {@code list} fields. */
    public String items;
    public boolean required;
    /** When true, field explicitly allows null values. */
    public Boolean nullable;
    /** When true, a null value of a nullable field is written as a NULL attribute instead of being omitted. */
    public boolean storeNull;
    /** One of {@code partition}, {@code sort}, {@code gsiPartition}, {@code gsiSort}. */
    public String keyRole;
    /** Index name for {@code gsiPartition}/{@code gsiSort} fields. */
    public String indexName;
    /** Display format applied on write: a date-time pattern or a decimal pattern such as {@code 0.00}. */
    public String format;
    /** Zone id that timestamp values are normalized to, e.g. {@code UTC} or {@code Europe/Paris}. */
    @JsonAlias({"timezone", "timeZone", "zone"})
    public String timezone;
    @JsonAlias({"enum", "enumValues"})
    public List<String> enumValues;
    public boolean encrypted;
    public String description;
    public DerivedFrom derivedFrom;
    public ExtractedFrom extractedFrom;
  }

  /**
   * Rule for a field computed from other fields before write.
   * Either {@link #format} (placeholders {@code {0}}, {@code {1:yyyy-MM}}) or the
   * {@link #separator} joins the source values.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DerivedFrom {
    @JsonAlias({"sources", "sourceFields"})
    public List<String> sources;
    @JsonAlias({"format", "template"})
    public String format;
    public String separator = "#";
  }

  /**
   * Rule for a non-stored field parsed out of another field after read.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExtractedFrom {
    @JsonAlias({"source", "sourceField"})
    public String source;
    public int index;
    public String separator = "#";
    /** {@code lenient} or {@code strict}; unset means the mapper default. */
    public String policy;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Relationship {
    /** Field on this entity that receives the related entities. */
    @JsonAlias({"field", "targetField"})
    public String field;
    /** Sort key pattern, e.g. {@code "LINE#*"} or {@code "SUMMARY"}. */
    public String sortKeyPattern;
    @JsonAlias({"entity", "targetEntity"})
    public String targetEntity;
    public boolean collection;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Discriminator {
    /** Attribute holding the type tag, e.g. {@code entity_type}. */
    @JsonAlias({"attribute", "property"})
    public String attribute;
    /** Exact tag value. Takes precedence over {@link #pattern}. */
    public String value;
    /** Tag pattern such as {@code "USER*"}. */
    public String pattern;
    /** Sort key pattern used when no attribute is declared. */
    public String sortKeyPattern;
  }
}
