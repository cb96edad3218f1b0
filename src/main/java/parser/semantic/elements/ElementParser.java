package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;

import java.util.Optional;

/**
 * Recognises one kind of inline element in a trimmed content line.
 * Higher priorities are tried first.
 */
public interface ElementParser {

    int priority();

    /** Cheap trigger test on the trimmed content. */
    boolean canParse(String content);

    /**
     * @param content  trimmed content
     * @param position where the content starts (file coordinates)
     * @param box      bounds of the enclosing box, for alignment
     * @return the element, or empty to let lower priorities try
     */
    Optional<Element> parse(String content, Position position, Bounds box);
}
