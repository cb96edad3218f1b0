package parser.interaction;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import model.Action;
import model.Element;
import model.Scene;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches interactions to the elements of a scene by id. Never creates
 * elements: an id with no match is reported as UNKNOWN_ELEMENT_ID.
 */
public final class InteractionMerger {

    public Scene merge(Scene scene, List<ElementInteraction> interactions, List<Diagnostic> diagnostics) {
        if (interactions.isEmpty()) return scene;

        // several blocks may target the same id
        Map<String, ElementInteraction> byId = new LinkedHashMap<>();
        for (ElementInteraction i : interactions) {
            byId.merge(i.elementId(), i, InteractionMerger::combine);
        }

        Set<String> matched = new HashSet<>();
        List<Element> elements = attach(scene.elements(), byId, matched);

        for (ElementInteraction i : byId.values()) {
            if (!matched.contains(i.elementId())) {
                diagnostics.add(DiagnosticFactory.unknownElementId(i.position(), i.elementId(), scene.id()));
            }
        }
        return new Scene(scene.id(), scene.title(), scene.transition(), scene.device(), elements);
    }

    private static List<Element> attach(List<Element> elements, Map<String, ElementInteraction> byId, Set<String> matched) {
        List<Element> out = new ArrayList<>(elements.size());
        for (Element e : elements) {
            out.add(attach(e, byId, matched));
        }
        return out;
    }

    private static Element attach(Element e, Map<String, ElementInteraction> byId, Set<String> matched) {
        switch (e.kind()) {
            case BOX: {
                Element.BoxElement b = (Element.BoxElement) e;
                return new Element.BoxElement(b.name(), b.bounds(), attach(b.children(), byId, matched));
            }
            case ROW: {
                Element.Row r = (Element.Row) e;
                return new Element.Row(attach(r.children(), byId, matched), r.align(), r.position());
            }
            case BUTTON: {
                Element.Button b = (Element.Button) e;
                ElementInteraction i = byId.get(b.id());
                if (i == null) return e;
                matched.add(b.id());
                return new Element.Button(b.id(), b.text(), b.position(), b.align(),
                        mergeProps(b.properties(), i), mergeActions(b.actions(), i));
            }
            case LINK: {
                Element.Link l = (Element.Link) e;
                ElementInteraction i = byId.get(l.id());
                if (i == null) return e;
                matched.add(l.id());
                return new Element.Link(l.id(), l.text(), l.position(), l.align(),
                        mergeProps(l.properties(), i), mergeActions(l.actions(), i));
            }
            case INPUT: {
                Element.Input in = (Element.Input) e;
                ElementInteraction i = byId.get(in.id());
                if (i == null) return e;
                matched.add(in.id());
                return new Element.Input(in.id(), in.position(),
                        mergeProps(in.properties(), i), mergeActions(in.actions(), i));
            }
            case CHECKBOX:
            case TEXT:
            case DIVIDER:
            case SPACER:
                return e;
            default:
                throw new IllegalStateException("Unhandled element kind " + e.kind());
        }
    }

    private static Map<String, Object> mergeProps(Map<String, Object> existing, ElementInteraction i) {
        Map<String, Object> m = new LinkedHashMap<>(existing);
        m.putAll(i.properties());
        return m;
    }

    private static List<Action> mergeActions(List<Action> existing, ElementInteraction i) {
        List<Action> a = new ArrayList<>(existing);
        a.addAll(i.actions());
        return a;
    }

    private static ElementInteraction combine(ElementInteraction a, ElementInteraction b) {
        Map<String, Object> props = new LinkedHashMap<>(a.properties());
        props.putAll(b.properties());
        List<Action> actions = new ArrayList<>(a.actions());
        actions.addAll(b.actions());
        return new ElementInteraction(a.elementId(), props, actions, a.position());
    }
}
