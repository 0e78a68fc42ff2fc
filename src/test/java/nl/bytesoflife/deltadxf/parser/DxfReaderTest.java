package nl.bytesoflife.deltadxf.parser;

import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.lexer.DxfLexer;
import nl.bytesoflife.deltadxf.model.dxf.DxfDrawing;
import nl.bytesoflife.deltadxf.model.shape.*;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DxfReaderTest {

    private static final double EPS = 1e-9;

    private final ShapeFactory kernel = new ShapeFactory();
    private final DxfReader reader = new DxfReader(kernel);

    static byte[] sample() throws IOException {
        try (InputStream in = DxfReaderTest.class.getResourceAsStream("/dxf/sample.dxf")) {
            assertNotNull(in, "sample.dxf fixture missing");
            return in.readAllBytes();
        }
    }

    @Test
    void lineAndCircleWithoutSections() {
        String dxf = "0\nLINE\n8\n0\n10\n0.0\n20\n0.0\n11\n100.0\n21\n100.0\n" +
                "0\nCIRCLE\n8\n0\n10\n50.0\n20\n50.0\n40\n25.0\n0\nEOF";

        DxfDrawing drawing = reader.read(dxf.getBytes(StandardCharsets.US_ASCII));

        assertEquals(2, drawing.getRecognizedCount());
        assertEquals(0, drawing.getUnsupportedCount());
        assertEquals(0, drawing.getIncompleteCount());

        Edge line = (Edge) drawing.getShapes().get(0);
        assertEquals(CurveKind.LINE, kernel.classifyCurve(line));
        assertEquals(0, line.getStart().x, EPS);
        assertEquals(0, line.getStart().y, EPS);
        assertEquals(100, line.getEnd().x, EPS);
        assertEquals(100, line.getEnd().y, EPS);

        Edge circle = (Edge) drawing.getShapes().get(1);
        assertEquals(CurveKind.CIRCLE, kernel.classifyCurve(circle));
        CircleCurve curve = (CircleCurve) circle.getCurve();
        assertEquals(50, curve.getCenter().x, EPS);
        assertEquals(50, curve.getCenter().y, EPS);
        assertEquals(25, curve.getRadius(), EPS);

        assertEquals(2, drawing.getCompound().getChildren().size());
    }

    @Test
    void readsSampleDrawing() throws IOException {
        DxfDrawing drawing = reader.read(sample());

        assertEquals(24, drawing.getEntities().size());
        assertEquals(6, drawing.getRecognizedCount());
        assertEquals(1, drawing.getUnsupportedCount());
        assertEquals(1, drawing.getIncompleteCount());
        assertEquals(List.of("0", "Outline", "Holes", "Faces"), List.copyOf(drawing.getLayers()));
        assertEquals("1", drawing.getLayerColor("Outline"));
        assertEquals("5", drawing.getLayerColor("Holes"));
        assertNull(drawing.getLayerColor("Faces"));

        List<Shape> shapes = drawing.getShapes();
        assertEquals(ShapeType.EDGE, shapes.get(0).getShapeType());
        assertEquals(CurveKind.CIRCLE, kernel.classifyCurve((Edge) shapes.get(1)));
        assertEquals(CurveKind.TRIMMED_CIRCLE, kernel.classifyCurve((Edge) shapes.get(2)));

        Wire lw = (Wire) shapes.get(3);
        assertEquals(4, lw.getEdges().size());
        assertTrue(lw.isClosed());

        Wire polyline = (Wire) shapes.get(4);
        assertEquals(2, polyline.getEdges().size());
        assertFalse(polyline.isClosed());
        assertEquals(20, polyline.getEdges().get(0).getStart().x, EPS);

        Face face = (Face) shapes.get(5);
        assertEquals(3, kernel.faceBoundary(face).size());
        assertEquals("3", drawing.getBuilt().get(5).entity().getColor());
    }

    @Test
    void sampleEnvelope() throws IOException {
        Envelope env = reader.read(sample()).getEnvelope();

        assertEquals(0, env.getMinX(), EPS);
        assertEquals(0, env.getMinY(), EPS);
        assertEquals(100, env.getMaxX(), EPS);
        assertEquals(60, env.getMaxY(), EPS);
    }

    @Test
    void blockGeometryIsBuiltLikeEntities() {
        String dxf = "0\nSECTION\n2\nBLOCKS\n0\nBLOCK\n0\nLINE\n10\n0\n20\n0\n11\n1\n21\n1\n" +
                "0\nINSERT\n0\nENDBLK\n0\nENDSEC\n" +
                "0\nSECTION\n2\nENTITIES\n0\nLINE\n10\n0\n20\n0\n11\n2\n21\n2\n0\nENDSEC\n0\nEOF\n";

        DxfDrawing drawing = reader.read(dxf);

        // the block's LINE is built, INSERT is an unmodeled type
        assertEquals(2, drawing.getRecognizedCount());
        assertEquals(1, drawing.getUnsupportedCount());
        assertEquals(0, drawing.getIncompleteCount());
        Edge blockLine = (Edge) drawing.getShapes().get(0);
        assertEquals(1, blockLine.getEnd().x, EPS);
        assertEquals(1, blockLine.getEnd().y, EPS);
    }

    @Test
    void housekeepingSectionsAreNotCountedAsUnsupported() {
        String dxf = "0\nSECTION\n2\nOBJECTS\n0\nDICTIONARY\n0\nLAYOUT\n0\nENDSEC\n" +
                "0\nSECTION\n2\nENTITIES\n0\nLINE\n10\n0\n20\n0\n11\n2\n21\n2\n0\nENDSEC\n0\nEOF\n";

        DxfDrawing drawing = reader.read(dxf);

        assertEquals(1, drawing.getRecognizedCount());
        assertEquals(0, drawing.getUnsupportedCount());
    }

    @Test
    void markersAreNotUnsupported() {
        String dxf = "0\nSECTION\n2\nENTITIES\n0\nPOLYLINE\n70\n0\n" +
                "0\nVERTEX\n10\n0\n20\n0\n0\nVERTEX\n10\n1\n20\n0\n0\nSEQEND\n" +
                "0\nSPLINE\n0\nENDSEC\n0\nEOF\n";

        DxfDrawing drawing = reader.read(dxf);

        assertEquals(1, drawing.getRecognizedCount());
        assertEquals(1, drawing.getUnsupportedCount());
    }

    @Test
    void flagsDoNotLeakBetweenEntities() {
        String dxf = "0\nLWPOLYLINE\n70\n9\n10\n0\n20\n0\n10\n1\n20\n0\n10\n1\n20\n1\n" +
                "0\nLWPOLYLINE\n10\n0\n20\n0\n10\n1\n20\n0\n10\n1\n20\n1\n";

        List<Shape> shapes = reader.read(dxf).getShapes();

        assertTrue(((Wire) shapes.get(0)).isClosed());
        assertFalse(((Wire) shapes.get(1)).isClosed());
    }

    @Test
    void emptyInputGivesEmptyCompound() {
        DxfDrawing drawing = reader.read(new byte[0]);

        assertEquals(0, drawing.getRecognizedCount());
        assertTrue(drawing.getCompound().isEmpty());
        assertTrue(drawing.getEnvelope().isNull());
    }

    @Test
    void malformedCodeAbortsRead() {
        assertThrows(DxfLexer.MalformedGroupCodeException.class,
                () -> reader.read("0\nLINE\n1O\n5\n"));
    }

    @Test
    void decodesWithConfiguredCharset() {
        byte[] latin1 = "0\nLINE\n8\nSchräg\n10\n0\n20\n0\n11\n1\n21\n0\n"
                .getBytes(StandardCharsets.ISO_8859_1);

        DxfDrawing drawing = new DxfReader().withCharset(StandardCharsets.ISO_8859_1).read(latin1);

        assertTrue(drawing.getLayers().contains("Schräg"));
    }
}
