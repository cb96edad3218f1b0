package model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Behaviour attached to an element by the interaction layer. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Action.Goto.class, name = "goto"),
        @JsonSubTypes.Type(value = Action.Back.class, name = "back"),
        @JsonSubTypes.Type(value = Action.Forward.class, name = "forward")
})
public sealed interface Action {

    /** Navigate to another scene. {@code transition} may be null (scene default). */
    record Goto(String target, String transition) implements Action {}

    record Back() implements Action {}

    record Forward() implements Action {}
}
