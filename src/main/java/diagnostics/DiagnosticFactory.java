package diagnostics;

import diagnostics.DiagnosticDetail.*;
import model.Bounds;
import model.Position;

import java.util.Locale;

/** Small helpers to create consistent Diagnostic lines. */
public final class DiagnosticFactory {
  private DiagnosticFactory() {}

  private static Diagnostic of(DiagnosticDetail detail, Position at, String message) {
    return new Diagnostic(detail, detail.kind().severity(), at, message);
  }

  // ---- structural ----

  public static Diagnostic unclosedBox(Position corner, Direction direction) {
    return of(new UnclosedBox(direction, corner), corner,
        "Box is not closed on its " + direction.name().toLowerCase(Locale.ROOT) + " edge");
  }

  public static Diagnostic mismatchedWidth(Position topLeft, Position bottomLeft, int topWidth, int bottomWidth) {
    return of(new MismatchedWidth(topLeft, bottomLeft.row(), bottomLeft.col(), topWidth, bottomWidth), topLeft,
        "Top border is " + topWidth + " wide but bottom border is " + bottomWidth);
  }

  public static Diagnostic misalignedPipe(int row, int expectedCol, int actualCol) {
    return of(new MisalignedPipe(row, expectedCol, actualCol), new Position(row, actualCol),
        "Pipe should be at column " + (expectedCol + 1) + " but is at column " + (actualCol + 1));
  }

  public static Diagnostic overlappingBoxes(Bounds box1, Bounds box2) {
    return of(new OverlappingBoxes(box1, box2), box2.topLeft(),
        "Box " + box2 + " partially overlaps box " + box1);
  }

  // ---- syntax ----

  public static Diagnostic invalidElement(Position at, String content) {
    return of(new InvalidElement(content), at, "Cannot read element: " + content);
  }

  public static Diagnostic unclosedBracket(Position at, int contentEnd) {
    return of(new UnclosedBracket(at.row(), contentEnd), at, "Bracket opened here is never closed");
  }

  public static Diagnostic emptyButton(Position at) {
    return of(new EmptyButton(), at, "Button has no label");
  }

  public static Diagnostic invalidInteraction(Position at, String reason) {
    return of(new InvalidInteractionDsl(reason), at, "Invalid interaction: " + reason);
  }

  public static Diagnostic unknownElementId(Position at, String elementId, String sceneId) {
    return of(new UnknownElementId(elementId, sceneId), at,
        "No element '" + elementId + "' in scene '" + sceneId + "'");
  }

  public static Diagnostic duplicateSceneId(Position at, String sceneId, Position first) {
    String where = first == null ? "" : " (first declared on line " + (first.row() + 1) + ")";
    return of(new DuplicateSceneId(sceneId, first), at, "Scene id '" + sceneId + "' is already used" + where);
  }

  // ---- style ----

  public static Diagnostic unusualSpacing(Position at) {
    return of(new UnusualSpacing(at.row(), at.col()), at, "Tab character breaks column alignment");
  }

  public static Diagnostic deepNesting(Position at, int depth) {
    return of(new DeepNesting(depth), at, "Boxes are nested " + depth + " levels deep");
  }
}
