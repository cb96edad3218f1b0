package parser;

import diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/** Thrown by {@link WireframeParser#parseOrThrow(String)} when the text has errors. */
public class WireframeParseException extends RuntimeException {

    private final List<Diagnostic> errors;

    public WireframeParseException(List<Diagnostic> errors) {
        super("Parse failed:\n" + errors.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }
}
