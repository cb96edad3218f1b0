package diagnostics;

import model.Bounds;
import model.Position;

/**
 * Structured context of a diagnostic, one record per {@link DiagnosticKind}.
 * All positions are grid coordinates until {@link #shift(int)} moves them to
 * file lines.
 */
public sealed interface DiagnosticDetail {

    DiagnosticKind kind();

    DiagnosticDetail shift(int rows);

    record UnclosedBox(Direction direction, Position corner) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.UNCLOSED_BOX; }
        public UnclosedBox shift(int rows) { return new UnclosedBox(direction, corner.down(rows)); }
    }

    /**
     * {@code bottomRow}/{@code bottomLeftCol} locate the bottom-left corner; widths are
     * column distances between the corners of each border.
     */
    record MismatchedWidth(Position topLeft, int bottomRow, int bottomLeftCol, int topWidth, int bottomWidth)
            implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.MISMATCHED_WIDTH; }
        public MismatchedWidth shift(int rows) {
            return new MismatchedWidth(topLeft.down(rows), bottomRow + rows, bottomLeftCol, topWidth, bottomWidth);
        }
    }

    record MisalignedPipe(int row, int expectedCol, int actualCol) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.MISALIGNED_PIPE; }
        public MisalignedPipe shift(int rows) { return new MisalignedPipe(row + rows, expectedCol, actualCol); }
    }

    record OverlappingBoxes(Bounds box1, Bounds box2) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.OVERLAPPING_BOXES; }
        public OverlappingBoxes shift(int rows) { return new OverlappingBoxes(box1.shift(rows), box2.shift(rows)); }
    }

    record InvalidElement(String content) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.INVALID_ELEMENT; }
        public InvalidElement shift(int rows) { return this; }
    }

    /** {@code contentEnd} is the column just past the last non-blank character of the content. */
    record UnclosedBracket(int row, int contentEnd) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.UNCLOSED_BRACKET; }
        public UnclosedBracket shift(int rows) { return new UnclosedBracket(row + rows, contentEnd); }
    }

    record EmptyButton() implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.EMPTY_BUTTON; }
        public EmptyButton shift(int rows) { return this; }
    }

    record InvalidInteractionDsl(String reason) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.INVALID_INTERACTION_DSL; }
        public InvalidInteractionDsl shift(int rows) { return this; }
    }

    record UnknownElementId(String elementId, String sceneId) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.UNKNOWN_ELEMENT_ID; }
        public UnknownElementId shift(int rows) { return this; }
    }

    /** {@code first} is where the winning scene was declared. */
    record DuplicateSceneId(String sceneId, Position first) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.DUPLICATE_SCENE_ID; }
        public DuplicateSceneId shift(int rows) { return this; }
    }

    record UnusualSpacing(int row, int col) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.UNUSUAL_SPACING; }
        public UnusualSpacing shift(int rows) { return new UnusualSpacing(row + rows, col); }
    }

    record DeepNesting(int depth) implements DiagnosticDetail {
        public DiagnosticKind kind() { return DiagnosticKind.DEEP_NESTING; }
        public DeepNesting shift(int rows) { return this; }
    }
}
