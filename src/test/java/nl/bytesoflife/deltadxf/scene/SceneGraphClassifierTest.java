package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.model.shape.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SceneGraphClassifierTest {

    private final ShapeFactory factory = new ShapeFactory();
    private final SceneGraphClassifier classifier = new SceneGraphClassifier();
    private InMemoryCadDocument doc;

    @BeforeEach
    void setUp() {
        doc = new InMemoryCadDocument();
    }

    private Edge edge(double x) {
        return factory.makeEdgeFromLine(new Coordinate(x, 0), new Coordinate(x + 1, 0));
    }

    @Test
    void labelWithoutChildrenIsMesh() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");

        assertTrue(classifier.isMeshNode(doc, part));
    }

    @Test
    void subShapeChildMakesMeshRegardlessOfOtherChildren() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        doc.addShape(part, edge(5), "Free child");
        doc.addSubShape(part, edge(0), "Sub");

        assertTrue(classifier.isMeshNode(doc, part));
    }

    @Test
    void freeShapeChildMakesGroup() {
        DocumentLabel assembly = doc.addShape(doc.mainLabel(), edge(0), "Assembly");
        doc.addShape(assembly, edge(1), "Child");

        assertFalse(classifier.isMeshNode(doc, assembly));
    }

    @Test
    void childrenWithoutShapeMakeMesh() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        doc.addLabel(part, "No shape");

        assertTrue(classifier.isMeshNode(doc, part));
    }

    @Test
    void referencedChildrenMakeMesh() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        DocumentLabel shared = doc.addShape(part, edge(3), "Shared");
        doc.addReference(doc.mainLabel(), shared, "Instance");

        assertFalse(doc.isFree(shared));
        assertTrue(classifier.isMeshNode(doc, part));
    }

    @Test
    void rootIsGroupOfFreeShapes() {
        doc.setColor(doc.mainLabel(), ColorType.GENERIC, "#123456");
        doc.addShape(doc.mainLabel(), edge(0), "A");
        doc.addLabel(doc.mainLabel(), "Not a shape");
        doc.addShape(doc.mainLabel(), edge(2), "B");

        ShapeNode root = classifier.classify(doc);

        assertTrue(root.isGroup());
        assertEquals("", root.getName());
        assertEquals("#123456", root.getColor());
        assertEquals(List.of("A", "B"), root.getChildren().stream().map(ShapeNode::getName).toList());
        assertFalse(root.getChildren().get(0).isGroup());
    }

    @Test
    void assemblyWithReferencedPart() {
        Edge boltShape = edge(0);
        DocumentLabel bolt = doc.addShape(doc.mainLabel(), boltShape, "Bolt");
        doc.setColor(bolt, ColorType.SURFACE, "ff0000");
        DocumentLabel assembly = doc.addShape(doc.mainLabel(), factory.makeCompound(List.of(boltShape)), "Assembly");
        doc.addReference(assembly, bolt, "Bolt instance");

        ShapeNode root = classifier.classify(doc);

        // Bolt is referenced, so only the assembly is a top-level child
        assertEquals(1, root.getChildren().size());
        ShapeNode asm = root.getChildren().get(0);
        assertTrue(asm.isGroup());
        assertEquals("Assembly", asm.getName());

        ShapeNode leaf = asm.getChildren().get(0);
        assertSame(boltShape, leaf.getShape());
        assertEquals("Bolt", leaf.getName());
        assertEquals("#FF0000", leaf.getColor());
    }

    @Test
    void nestedGroups() {
        DocumentLabel outer = doc.addShape(doc.mainLabel(), edge(0), "Outer");
        DocumentLabel inner = doc.addShape(outer, edge(1), "Inner");
        doc.addShape(inner, edge(2), "Leaf");

        ShapeNode root = classifier.classify(doc);

        ShapeNode outerNode = root.getChildren().get(0);
        ShapeNode innerNode = outerNode.getChildren().get(0);
        ShapeNode leaf = innerNode.getChildren().get(0);
        assertTrue(outerNode.isGroup());
        assertTrue(innerNode.isGroup());
        assertEquals("Inner", innerNode.getName());
        assertEquals("Leaf", leaf.getName());
        assertFalse(leaf.isGroup());
        assertEquals(4, ShapeNodes.count(root));
    }

    @Test
    void meshCompoundIsDecomposed() {
        Edge a = edge(0);
        Edge b = edge(2);
        Edge c = edge(4);
        Compound inner = factory.makeCompound(List.of(b, c));
        Compound shape = factory.makeCompound(List.of(a, inner));
        DocumentLabel part = doc.addShape(doc.mainLabel(), shape, "Part");
        doc.addSubShape(part, b, "Inner edge");
        doc.setColor(doc.findLabel(b), ColorType.CURVE, "#00ff00");

        ShapeNode root = classifier.classify(doc);

        ShapeNode partNode = root.getChildren().get(0);
        assertTrue(partNode.isGroup());
        assertEquals("Part", partNode.getName());
        assertEquals(2, partNode.getChildren().size());

        ShapeNode first = partNode.getChildren().get(0);
        assertSame(a, first.getShape());
        assertEquals("", first.getName());
        assertNull(first.getColor());

        ShapeNode group = partNode.getChildren().get(1);
        assertTrue(group.isGroup());
        assertEquals(2, group.getChildren().size());
        assertEquals("Inner edge", group.getChildren().get(0).getName());
        assertEquals("#00FF00", group.getChildren().get(0).getColor());
        assertSame(c, group.getChildren().get(1).getShape());
    }

    @Test
    void compSolidIsDecomposed() {
        Face f = factory.makeFaceFromPolygon(List.of(
                new Coordinate(0, 0, 0), new Coordinate(1, 0, 0), new Coordinate(0, 1, 0)));
        Solid s1 = new Solid(List.of(f));
        Solid s2 = new Solid(List.of(f));

        ShapeNode node = classifier.decompose(doc, new CompSolid(List.of(s1, s2)));

        assertTrue(node.isGroup());
        assertSame(s1, node.getChildren().get(0).getShape());
        assertSame(s2, node.getChildren().get(1).getShape());
    }

    @Test
    void nameFollowsReferenceChain() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        DocumentLabel ref = doc.addReference(doc.mainLabel(), part, "Instance");
        DocumentLabel refOfRef = doc.addReference(doc.mainLabel(), ref, null);

        assertEquals("Part", classifier.labelName(doc, ref));
        assertEquals("Part", classifier.labelName(doc, refOfRef));
        assertSame(part, refOfRef.resolve());
    }

    @Test
    void missingNameIsEmpty() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), null);

        assertEquals("", classifier.labelName(doc, part));
    }

    @Test
    void colorSlotsAreTriedInOrder() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        doc.setColor(part, ColorType.GENERIC, "#0000FF");
        doc.setColor(part, ColorType.CURVE, "#00FF00");

        assertEquals("#00FF00", classifier.labelColor(doc, part));

        doc.setColor(part, ColorType.SURFACE, "#ff0000");
        assertEquals("#FF0000", classifier.labelColor(doc, part));
    }

    @Test
    void referenceOwnColorWinsOverReferred() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        doc.setColor(part, ColorType.SURFACE, "#111111");
        DocumentLabel ref = doc.addReference(doc.mainLabel(), part, "Instance");
        doc.setColor(ref, ColorType.GENERIC, "#222222");

        assertEquals("#222222", classifier.labelColor(doc, ref));
    }

    @Test
    void invalidColorFallsThroughToNextCandidate() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        doc.setColor(part, ColorType.CURVE, "00ff00");
        DocumentLabel ref = doc.addReference(doc.mainLabel(), part, "Instance");
        doc.setColor(ref, ColorType.SURFACE, "red");

        assertEquals("#00FF00", classifier.labelColor(doc, ref));
    }

    @Test
    void noColorAnywhere() {
        DocumentLabel part = doc.addShape(doc.mainLabel(), edge(0), "Part");
        DocumentLabel ref = doc.addReference(doc.mainLabel(), part, "Instance");

        assertNull(classifier.labelColor(doc, ref));
    }

    @Test
    void emptyDocumentGivesEmptyRoot() {
        ShapeNode root = classifier.classify(doc);

        assertTrue(root.isGroup());
        assertTrue(root.getChildren().isEmpty());
    }
}
