package model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;

/**
 * A node of a scene. The set of variants is closed; callers dispatch on
 * {@link #kind()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Element.BoxElement.class, name = "Box"),
        @JsonSubTypes.Type(value = Element.Button.class, name = "Button"),
        @JsonSubTypes.Type(value = Element.Input.class, name = "Input"),
        @JsonSubTypes.Type(value = Element.Link.class, name = "Link"),
        @JsonSubTypes.Type(value = Element.Checkbox.class, name = "Checkbox"),
        @JsonSubTypes.Type(value = Element.Text.class, name = "Text"),
        @JsonSubTypes.Type(value = Element.Divider.class, name = "Divider"),
        @JsonSubTypes.Type(value = Element.Row.class, name = "Row"),
        @JsonSubTypes.Type(value = Element.Spacer.class, name = "Spacer")
})
public sealed interface Element {

    @JsonIgnore
    ElementKind kind();

    /** Top-left cell the element was read from, in file coordinates. */
    Position position();

    // ---- containers ----

    record BoxElement(String name, Bounds bounds, List<Element> children) implements Element {
        public BoxElement {
            children = List.copyOf(children);
        }
        @Override public ElementKind kind() { return ElementKind.BOX; }
        @Override public Position position() { return bounds.topLeft(); }
    }

    record Row(List<Element> children, Alignment align, Position position) implements Element {
        public Row {
            children = List.copyOf(children);
        }
        @Override public ElementKind kind() { return ElementKind.ROW; }
    }

    // ---- interactive ----

    record Button(String id, String text, Position position, Alignment align,
                  Map<String, Object> properties, List<Action> actions) implements Element {
        public Button {
            properties = Map.copyOf(properties);
            actions = List.copyOf(actions);
        }
        public Button(String id, String text, Position position, Alignment align) {
            this(id, text, position, align, Map.of(), List.of());
        }
        @Override public ElementKind kind() { return ElementKind.BUTTON; }
    }

    record Input(String id, Position position, Map<String, Object> properties,
                 List<Action> actions) implements Element {
        public Input {
            properties = Map.copyOf(properties);
            actions = List.copyOf(actions);
        }
        public Input(String id, Position position) {
            this(id, position, Map.of(), List.of());
        }
        /** Placeholder text, if an interaction block supplied one. */
        public String placeholder() {
            Object p = properties.get("placeholder");
            return p == null ? null : p.toString();
        }
        @Override public ElementKind kind() { return ElementKind.INPUT; }
    }

    record Link(String id, String text, Position position, Alignment align,
                Map<String, Object> properties, List<Action> actions) implements Element {
        public Link {
            properties = Map.copyOf(properties);
            actions = List.copyOf(actions);
        }
        public Link(String id, String text, Position position, Alignment align) {
            this(id, text, position, align, Map.of(), List.of());
        }
        @Override public ElementKind kind() { return ElementKind.LINK; }
    }

    record Checkbox(boolean checked, String label, Position position) implements Element {
        @Override public ElementKind kind() { return ElementKind.CHECKBOX; }
    }

    // ---- passive ----

    record Text(String content, boolean emphasis, Position position, Alignment align) implements Element {
        @Override public ElementKind kind() { return ElementKind.TEXT; }
    }

    record Divider(Position position) implements Element {
        @Override public ElementKind kind() { return ElementKind.DIVIDER; }
    }

    record Spacer(Position position) implements Element {
        @Override public ElementKind kind() { return ElementKind.SPACER; }
    }
}
