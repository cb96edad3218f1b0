package parser.interaction;

import model.Action;
import model.Position;

import java.util.List;
import java.util.Map;

/** Properties and actions declared for one element id. */
public record ElementInteraction(String elementId, Map<String, Object> properties,
                                 List<Action> actions, Position position) {

    public ElementInteraction {
        properties = Map.copyOf(properties);
        actions = List.copyOf(actions);
    }
}
