package co.strata.mapper;

import co.strata.core.schema.DiscriminatorRule;
import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decides which entity shape a raw record belongs to.
 *
 * <p>A shape's most specific declared rule decides:
 * <ol>
 *   <li>discriminator attribute: its value must match the expected tag</li>
 *   <li>sort key pattern: the record's sort key must match</li>
 *   <li>otherwise every required stored attribute must be present</li>
 * </ol>
 * Matching never throws; a record that cannot be read simply does not match.
 */
public class EntityDiscriminator {

  private static final Logger log = LoggerFactory.getLogger(EntityDiscriminator.class);

  private final boolean warnOnAmbiguous;

  public EntityDiscriminator() {
    this(true);
  }

  public EntityDiscriminator(boolean warnOnAmbiguous) {
    this.warnOnAmbiguous = warnOnAmbiguous;
  }

  public boolean warnsOnAmbiguity() {
    return warnOnAmbiguous;
  }

  public boolean matches(RawRecord record, SchemaModel model) {
    return strength(record, model) > 0;
  }

  /**
   * How specifically {@code record} matches {@code model}: 3 by discriminator attribute, 2 by
   * sort key pattern, 1 by attribute presence, 0 not at all.
   */
  int strength(RawRecord record, SchemaModel model) {
    if (record == null || model == null) return 0;
    try {
      DiscriminatorRule rule = model.discriminator();
      if (rule.hasAttribute()) {
        return rule.attributeValue().matches(record.text(rule.attributeName())) ? 3 : 0;
      }
      if (rule.hasSortKeyPattern()) {
        Optional<FieldDescriptor> sortKey = model.sortKey();
        boolean hit = sortKey.isPresent() && rule.sortKeyPattern().matches(record.text(sortKey.get().storedName()));
        return hit ? 2 : 0;
      }
      for (String attribute : model.requiredAttributes()) {
        if (!record.hasValue(attribute)) return 0;
      }
      return 1;
    } catch (RuntimeException e) {
      log.debug("Record does not match {}: {}", model.entityId(), e.toString());
      return 0;
    }
  }

  /** Best matching shape among {@code candidates}; ties go to the first. */
  public Optional<SchemaModel> resolve(RawRecord record, List<SchemaModel> candidates) {
    return resolve(record, candidates, w -> { });
  }

  /**
   * Best matching shape among {@code candidates}. A tag match beats a sort key match, which
   * beats a presence match. Ties go to the first candidate; when warnings are enabled the tie
   * is logged and passed to {@code warnings} as
   * {@link MappingWarning.Kind#AMBIGUOUS_DISCRIMINATION}.
   */
  public Optional<SchemaModel> resolve(RawRecord record, List<SchemaModel> candidates,
                                       Consumer<MappingWarning> warnings) {
    List<SchemaModel> best = new ArrayList<>(2);
    int bestStrength = 0;
    for (SchemaModel m : candidates) {
      int s = strength(record, m);
      if (s > bestStrength) {
        best.clear();
        best.add(m);
        bestStrength = s;
      } else if (s > 0 && s == bestStrength) {
        best.add(m);
      }
    }
    if (best.isEmpty()) return Optional.empty();
    if (best.size() > 1 && warnOnAmbiguous) {
      List<String> ids = new ArrayList<>(best.size());
      for (SchemaModel m : best) ids.add(m.entityId());
      MappingWarning warning = new MappingWarning(MappingWarning.Kind.AMBIGUOUS_DISCRIMINATION,
          "record matches " + ids + "; using " + ids.get(0), best.get(0).tableName());
      log.warn("{}", warning);
      warnings.accept(warning);
    }
    return Optional.of(best.get(0));
  }
}
