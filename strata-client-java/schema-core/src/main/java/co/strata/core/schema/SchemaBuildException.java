package co.strata.core.schema;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when one or more definitions cannot be compiled. Carries every diagnostic found,
 * not just the first, so a build can report all problems at once.
 */
public class SchemaBuildException extends IllegalArgumentException {

  private final List<Diagnostic> diagnostics;

  public SchemaBuildException(List<Diagnostic> diagnostics) {
    super(summarize(diagnostics));
    this.diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean hasCode(DiagnosticCode code) {
    return diagnostics.stream().anyMatch(d -> d.code() == code);
  }

  private static String summarize(List<Diagnostic> diagnostics) {
    long errors = diagnostics.stream().filter(Diagnostic::isError).count();
    return errors + " schema error(s):\n" + diagnostics.stream()
        .map(Diagnostic::toString)
        .collect(Collectors.joining("\n  ", "  ", ""));
  }
}
