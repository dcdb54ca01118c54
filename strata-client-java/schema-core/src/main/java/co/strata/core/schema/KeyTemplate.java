package co.strata.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Composite key template such as {@code "TENANT#{0}#CUST#{1}"} or {@code "{0}#{1:yyyy-MM}"}.
 *
 * <p>A placeholder is {@code {index}} or {@code {index:format}}; {@code {{} and {@code }}}
 * write literal braces.
 */
public final class KeyTemplate {

  /** A literal run or a placeholder. Exactly one of {@code literal} and {@code index >= 0} applies. */
  public record Segment(String literal, int index, String format) {
    public boolean isPlaceholder() { return literal == null; }
  }

  private final String template;
  private final List<Segment> segments;
  private final int maxIndex;

  private KeyTemplate(String template, List<Segment> segments, int maxIndex) {
    this.template = template;
    this.segments = segments;
    this.maxIndex = maxIndex;
  }

  /**
   * @throws IllegalArgumentException on unmatched braces or non-numeric / negative indices
   */
  public static KeyTemplate parse(String template) {
    if (template == null || template.isEmpty()) {
      throw new IllegalArgumentException("template cannot be empty");
    }
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int maxIndex = -1;
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
        literal.append('{');
        i += 2;
      } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
        literal.append('}');
        i += 2;
      } else if (c == '{') {
        int close = template.indexOf('}', i);
        if (close < 0) {
          throw new IllegalArgumentException("unmatched '{' at position " + i + " in '" + template + "'");
        }
        String body = template.substring(i + 1, close);
        int colon = body.indexOf(':');
        String indexPart = colon >= 0 ? body.substring(0, colon) : body;
        String format = colon >= 0 ? body.substring(colon + 1) : null;
        int index;
        try {
          index = Integer.parseInt(indexPart.trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid placeholder '{" + body + "}' in '" + template + "'", e);
        }
        if (index < 0) {
          throw new IllegalArgumentException("placeholder index must be non-negative in '" + template + "'");
        }
        if (literal.length() > 0) {
          segments.add(new Segment(literal.toString(), -1, null));
          literal.setLength(0);
        }
        segments.add(new Segment(null, index, format == null || format.isEmpty() ? null : format));
        maxIndex = Math.max(maxIndex, index);
        i = close + 1;
      } else if (c == '}') {
        throw new IllegalArgumentException("unmatched '}' at position " + i + " in '" + template + "'");
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) {
      segments.add(new Segment(literal.toString(), -1, null));
    }
    return new KeyTemplate(template, List.copyOf(segments), maxIndex);
  }

  /**
   * Render the template.
   *
   * @param placeholder receives (index, format or null) and returns the text for that placeholder
   */
  public String render(BiFunction<Integer, String, String> placeholder) {
    StringBuilder sb = new StringBuilder();
    for (Segment s : segments) {
      if (s.isPlaceholder()) {
        sb.append(placeholder.apply(s.index(), s.format()));
      } else {
        sb.append(s.literal());
      }
    }
    return sb.toString();
  }

  public List<Segment> segments() { return segments; }

  /** Highest placeholder index, or -1 when the template has none. */
  public int maxIndex() { return maxIndex; }

  public String template() { return template; }

  @Override
  public String toString() {
    return template;
  }
}
