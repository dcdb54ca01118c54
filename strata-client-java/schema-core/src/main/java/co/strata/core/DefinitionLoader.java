package co.strata.core;

import co.strata.core.model.EntityDefinition;
import co.strata.core.schema.SchemaBuilder;
import co.strata.core.schema.SchemaCatalog;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads entity definitions from JSON files. A file holds either one definition object or an
 * array of them.
 */
public final class DefinitionLoader {
  private static final ObjectMapper JSON = new ObjectMapper();

  private DefinitionLoader() {}

  public static List<EntityDefinition> load(Path path) throws IOException {
    return parse(Files.readAllBytes(path));
  }

  public static List<EntityDefinition> parse(byte[] json) throws IOException {
    JsonNode root = JSON.readTree(json);
    if (root == null || root.isMissingNode()) {
      throw new IOException("empty definition document");
    }
    if (root.isArray()) {
      return JSON.convertValue(root, new TypeReference<List<EntityDefinition>>() {});
    }
    return List.of(JSON.treeToValue(root, EntityDefinition.class));
  }

  /**
   * Load every file and build them as one batch, so relationships and table checks
   * can span files.
   *
   * @throws co.strata.core.schema.SchemaBuildException if the definitions do not validate
   */
  public static SchemaCatalog loadCatalog(Path... paths) throws IOException {
    List<EntityDefinition> all = new ArrayList<>();
    for (Path p : paths) {
      all.addAll(load(p));
    }
    return SchemaBuilder.build(all);
  }
}
