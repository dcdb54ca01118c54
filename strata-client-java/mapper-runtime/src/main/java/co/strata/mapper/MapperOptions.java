package co.strata.mapper;

import co.strata.core.schema.ExtractionPolicy;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runtime knobs of the mappers.
 *
 * @param extractionPolicy policy for extracted fields that do not declare their own
 * @param warnOnAmbiguousDiscrimination report records that match more than one shape
 * @param encryptionContextId passed to the field encryption hook, e.g. a tenant id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MapperOptions(
    ExtractionPolicy extractionPolicy,
    boolean warnOnAmbiguousDiscrimination,
    String encryptionContextId
) {

  public static final MapperOptions DEFAULTS = new MapperOptions(ExtractionPolicy.LENIENT, true, null);

  private static final ObjectMapper JSON = new ObjectMapper();

  @JsonCreator
  public static MapperOptions create(@JsonProperty("extractionPolicy") String extractionPolicy,
                                     @JsonProperty("warnOnAmbiguousDiscrimination") Boolean warnOnAmbiguous,
                                     @JsonProperty("encryptionContextId") String encryptionContextId) {
    ExtractionPolicy policy = extractionPolicy == null
        ? DEFAULTS.extractionPolicy()
        : ExtractionPolicy.parse(extractionPolicy)
            .orElseThrow(() -> new IllegalArgumentException("Unknown extraction policy: " + extractionPolicy));
    return new MapperOptions(policy,
        warnOnAmbiguous == null ? DEFAULTS.warnOnAmbiguousDiscrimination() : warnOnAmbiguous,
        encryptionContextId);
  }

  public MapperOptions {
    if (extractionPolicy == null) extractionPolicy = ExtractionPolicy.LENIENT;
  }

  public static MapperOptions load(Path path) throws IOException {
    return JSON.readValue(Files.readAllBytes(path), MapperOptions.class);
  }

  public static MapperOptions load(InputStream in) throws IOException {
    return JSON.readValue(in, MapperOptions.class);
  }

  public MapperOptions withExtractionPolicy(ExtractionPolicy policy) {
    return new MapperOptions(policy, warnOnAmbiguousDiscrimination, encryptionContextId);
  }

  public MapperOptions withEncryptionContextId(String contextId) {
    return new MapperOptions(extractionPolicy, warnOnAmbiguousDiscrimination, contextId);
  }

  public MapperOptions withWarnOnAmbiguousDiscrimination(boolean warn) {
    return new MapperOptions(extractionPolicy, warn, encryptionContextId);
  }
}
