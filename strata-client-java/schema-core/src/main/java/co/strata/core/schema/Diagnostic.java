package co.strata.core.schema;

/**
 * One problem found in a batch of entity definitions.
 *
 * @param code what went wrong
 * @param severity errors fail the build, warnings are only logged
 * @param message human readable description
 * @param fieldPath {@code Entity.field} (or just {@code Entity}) the problem belongs to
 */
public record Diagnostic(DiagnosticCode code, Severity severity, String message, String fieldPath) {

  public enum Severity { ERROR, WARNING }

  public static Diagnostic error(DiagnosticCode code, String fieldPath, String message) {
    return new Diagnostic(code, Severity.ERROR, message, fieldPath);
  }

  public static Diagnostic warning(DiagnosticCode code, String fieldPath, String message) {
    return new Diagnostic(code, Severity.WARNING, message, fieldPath);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + code + " [" + fieldPath + "]: " + message;
  }
}
