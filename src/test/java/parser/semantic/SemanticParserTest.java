package parser.semantic;

import model.Alignment;
import model.Bounds;
import model.Element;
import model.ElementKind;
import model.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static testutil.Wireframes.*;

public class SemanticParserTest {

	private static SemanticParser.SceneResult parse(List<String> lines) {
		List<SceneBlock> blocks = new SceneSplitter(false).split(lines);
		return new SemanticParser().parse(blocks.get(0));
	}

	private static Element.BoxElement onlyBox(List<String> lines) {
		SemanticParser.SceneResult r = parse(lines);
		assertTrue(r.diagnostics().isEmpty(), () -> "unexpected: " + r.diagnostics());
		assertEquals(1, r.scene().elements().size());
		return assertInstanceOf(Element.BoxElement.class, r.scene().elements().get(0));
	}

	private static List<ElementKind> kinds(List<Element> elements) {
		return elements.stream().map(Element::kind).toList();
	}

	@Test
	void emptyBox_hasNoChildren() {
		Element.BoxElement b = onlyBox(lines("+----+", "|    |", "+----+"));

		assertEquals(new Bounds(0, 0, 2, 5), b.bounds());
		assertTrue(b.children().isEmpty());
	}

	@Test
	void loginForm() {
		Element.BoxElement b = onlyBox(namedBox("Login", 23, "", "  #email", "", "  [ Sign In ]"));

		assertEquals("Login", b.name());
		assertEquals(List.of(ElementKind.INPUT, ElementKind.SPACER, ElementKind.BUTTON), kinds(b.children()));
		Element.Input in = (Element.Input) b.children().get(0);
		assertEquals("email", in.id());
		assertEquals(Position.of(2, 3), in.position());
		Element.Button btn = (Element.Button) b.children().get(2);
		assertEquals("sign-in", btn.id());
		assertEquals(Alignment.LEFT, btn.align());
	}

	@Test
	void centeredButton() {
		Element.BoxElement b = onlyBox(box(21, "      [ Login ]"));

		Element.Button btn = (Element.Button) b.children().get(0);
		assertEquals("login", btn.id());
		assertEquals("Login", btn.text());
		assertEquals(Alignment.CENTER, btn.align());
	}

	@Test
	void blankRowsBetweenElementsAreSpacers_edgesAreTrimmed() {
		assertEquals(List.of(ElementKind.TEXT, ElementKind.SPACER, ElementKind.TEXT),
				kinds(onlyBox(box(10, "Hello", "", "World")).children()));
		assertEquals(List.of(ElementKind.TEXT),
				kinds(onlyBox(box(10, "", "Hello", "")).children()));
	}

	@Test
	void dividerRows() {
		assertEquals(List.of(ElementKind.TEXT, ElementKind.DIVIDER, ElementKind.TEXT),
				kinds(onlyBox(box(10, "Top", "==========", "Bottom")).children()));
	}

	@Test
	void rowsOwnedByAChildBoxBelongToTheChild() {
		List<String> doc = frame(20, stack(
				lines("Title"),
				indent(2, box(10, "", "x", "")),
				lines("", "End")));

		Element.BoxElement outer = onlyBox(doc);

		assertEquals(List.of(ElementKind.TEXT, ElementKind.BOX, ElementKind.SPACER, ElementKind.TEXT),
				kinds(outer.children()));
		Element.BoxElement inner = (Element.BoxElement) outer.children().get(1);
		assertEquals(new Bounds(2, 3, 6, 14), inner.bounds());
		assertEquals(List.of(ElementKind.TEXT), kinds(inner.children()));
		assertEquals("x", ((Element.Text) inner.children().get(0)).content());
	}

	@Test
	void sideBySideBoxesBecomeACenteredRow() {
		List<String> child = box(10, " [ OK ]");
		List<String> doc = frame(30, indent(2, beside(child, 2, child)));

		Element.BoxElement outer = onlyBox(doc);

		assertEquals(1, outer.children().size());
		Element.Row row = assertInstanceOf(Element.Row.class, outer.children().get(0));
		assertEquals(Alignment.CENTER, row.align());
		assertEquals(Position.of(1, 3), row.position());
		assertEquals(2, row.children().size());
		for (Element e : row.children()) {
			Element.BoxElement b = assertInstanceOf(Element.BoxElement.class, e);
			assertEquals(1, b.children().size());
			assertEquals("ok", ((Element.Button) b.children().get(0)).id());
		}
	}

	@Test
	void stackedBoxesAreNotARow() {
		List<String> doc = frame(14, indent(1, stack(box(10, "A"), box(10, "B"))));

		assertEquals(List.of(ElementKind.BOX, ElementKind.BOX), kinds(onlyBox(doc).children()));
	}

	@Test
	void sceneRootsAreGroupedToo() {
		SemanticParser.SceneResult r = parse(beside(box(4, "a"), 2, box(4, "b")));

		assertEquals(List.of(ElementKind.ROW), kinds(r.scene().elements()));
	}

	@Test
	void rowGroupingIsDeterministic() {
		List<String> child = box(10, " [ OK ]");
		List<String> doc = frame(30, indent(2, beside(child, 2, child)));

		assertEquals(parse(doc).scene(), parse(doc).scene());
	}

	@Test
	void positionsAreInFileCoordinates() {
		List<String> doc = stack(lines("@scene: a", "---", "@scene: b"), box(6, "hi"));
		List<SceneBlock> blocks = new SceneSplitter(false).split(doc);

		SemanticParser.SceneResult r = new SemanticParser().parse(blocks.get(1));

		Element.BoxElement b = (Element.BoxElement) r.scene().elements().get(0);
		assertEquals(new Bounds(3, 0, 5, 7), b.bounds());
		assertEquals(Position.of(4, 1), b.children().get(0).position());
	}
}
