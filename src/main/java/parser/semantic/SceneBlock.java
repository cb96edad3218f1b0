package parser.semantic;

import model.DeviceType;
import parser.interaction.SourceLine;

import java.util.List;

/**
 * One scene's slice of the document. {@code lines} keeps every row of the
 * slice (directive and interaction lines are blanked), so grid row
 * {@code r} is file line {@code lineOffset + r}.
 */
public record SceneBlock(String id, String title, String transition, DeviceType device,
                         boolean explicitId, int declaredAt, int lineOffset,
                         List<String> lines, List<SourceLine> interactionLines) {

    public SceneBlock {
        lines = List.copyOf(lines);
        interactionLines = List.copyOf(interactionLines);
    }
}
