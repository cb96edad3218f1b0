package diagnostics;

import model.Position;

import java.util.Objects;

public final class Diagnostic {
  private final DiagnosticDetail detail; // what went wrong, with structured context
  private final Severity severity;       // blocking or not
  private final Position position;       // where (file row, column); may be null for document-level issues
  private final String message;          // short human line

  public Diagnostic(DiagnosticDetail detail, Severity severity, Position position, String message) {
    this.detail = Objects.requireNonNull(detail, "detail");
    this.severity = Objects.requireNonNull(severity, "severity");
    this.position = position;
    this.message = message == null ? "" : message;
  }

  public DiagnosticKind getKind()     { return detail.kind(); }
  public DiagnosticDetail getDetail() { return detail; }
  public Severity getSeverity()       { return severity; }
  public Position getPosition()       { return position; }
  public String getMessage()          { return message; }

  public boolean isError()   { return severity == Severity.ERROR; }
  public boolean isWarning() { return severity == Severity.WARNING; }

  /** Same diagnostic moved {@code rows} lines down. */
  public Diagnostic shift(int rows) {
    if (rows == 0) return this;
    Position p = position == null ? null : position.down(rows);
    return new Diagnostic(detail.shift(rows), severity, p, message);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Diagnostic)) return false;
    Diagnostic d = (Diagnostic) o;
    return detail.equals(d.detail) && severity == d.severity
        && Objects.equals(position, d.position) && message.equals(d.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(detail, severity, position, message);
  }

  @Override
  public String toString() {
    return severity + " " + getKind() + " at " + position + ": " + message;
  }
}
