package co.strata.core.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matcher for sort key values and discriminator tags.
 *
 * <ul>
 *   <li>{@code "META"}    – exact match</li>
 *   <li>{@code "LINE#*"}  – prefix</li>
 *   <li>{@code "*#USER"}  – suffix</li>
 *   <li>{@code "*AUDIT*"} – contains</li>
 *   <li>anything else with {@code *} or {@code ?} – glob</li>
 * </ul>
 */
public final class KeyPattern {

  public enum Strategy { EXACT, PREFIX, SUFFIX, CONTAINS, GLOB }

  private final String pattern;
  private final Strategy strategy;
  private final String literal;
  private final Pattern glob;

  private KeyPattern(String pattern, Strategy strategy, String literal, Pattern glob) {
    this.pattern = pattern;
    this.strategy = strategy;
    this.literal = literal;
    this.glob = glob;
  }

  /**
   * @throws IllegalArgumentException if the pattern is empty or contains control characters
   */
  public static KeyPattern parse(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new IllegalArgumentException("pattern cannot be empty");
    }
    for (int i = 0; i < pattern.length(); i++) {
      if (Character.isISOControl(pattern.charAt(i))) {
        throw new IllegalArgumentException("pattern contains control characters: " + pattern.strip());
      }
    }

    int stars = count(pattern, '*');
    boolean hasQuestion = pattern.indexOf('?') >= 0;
    if (stars == 0 && !hasQuestion) {
      return new KeyPattern(pattern, Strategy.EXACT, pattern, null);
    }
    if (!hasQuestion) {
      if (stars == 1 && pattern.endsWith("*")) {
        return new KeyPattern(pattern, Strategy.PREFIX, pattern.substring(0, pattern.length() - 1), null);
      }
      if (stars == 1 && pattern.startsWith("*")) {
        return new KeyPattern(pattern, Strategy.SUFFIX, pattern.substring(1), null);
      }
      if (stars == 2 && pattern.length() > 2 && pattern.startsWith("*") && pattern.endsWith("*")) {
        return new KeyPattern(pattern, Strategy.CONTAINS, pattern.substring(1, pattern.length() - 1), null);
      }
    }
    return new KeyPattern(pattern, Strategy.GLOB, null, toRegex(pattern));
  }

  /** Exact match on {@code value}, even when it contains wildcard characters. */
  public static KeyPattern literal(String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("value cannot be empty");
    }
    return new KeyPattern(value, Strategy.EXACT, value, null);
  }

  /** Never throws; {@code null} never matches. */
  public boolean matches(String value) {
    if (value == null) return false;
    return switch (strategy) {
      case EXACT -> value.equals(literal);
      case PREFIX -> value.startsWith(literal);
      case SUFFIX -> value.endsWith(literal);
      case CONTAINS -> value.contains(literal);
      case GLOB -> glob.matcher(value).matches();
    };
  }

  public String pattern() { return pattern; }

  public Strategy strategy() { return strategy; }

  private static Pattern toRegex(String pattern) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literalRun = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c == '*' || c == '?') {
        if (literalRun.length() > 0) {
          regex.append(Pattern.quote(literalRun.toString()));
          literalRun.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literalRun.append(c);
      }
    }
    if (literalRun.length() > 0) {
      regex.append(Pattern.quote(literalRun.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) n++;
    }
    return n;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof KeyPattern)) return false;
    return pattern.equals(((KeyPattern) o).pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pattern);
  }

  @Override
  public String toString() {
    return pattern;
  }
}
