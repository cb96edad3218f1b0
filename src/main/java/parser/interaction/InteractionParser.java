package parser.interaction;

import diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the interaction language that attaches behaviour to wireframe
 * elements by id. The wireframe parser depends only on this contract.
 */
public interface InteractionParser {

    Result parse(List<SourceLine> lines);

    default Result parse(String dsl) {
        List<SourceLine> lines = new ArrayList<>();
        if (dsl != null && !dsl.isEmpty()) {
            String[] raw = dsl.replace("\r\n", "\n").split("\n", -1);
            for (int i = 0; i < raw.length; i++) lines.add(new SourceLine(i, raw[i]));
        }
        return parse(lines);
    }

    record Result(List<ElementInteraction> interactions, List<Diagnostic> diagnostics) {
        public Result {
            interactions = List.copyOf(interactions);
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean isOk() {
            return diagnostics.stream().noneMatch(Diagnostic::isError);
        }
    }
}
