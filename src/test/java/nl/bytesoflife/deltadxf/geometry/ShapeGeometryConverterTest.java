package nl.bytesoflife.deltadxf.geometry;

import nl.bytesoflife.deltadxf.model.shape.Edge;
import nl.bytesoflife.deltadxf.model.shape.Face;
import nl.bytesoflife.deltadxf.model.shape.Wire;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapeGeometryConverterTest {

    private static final double EPS = 1e-9;

    private final ShapeFactory factory = new ShapeFactory();
    private final ShapeGeometryConverter converter = new ShapeGeometryConverter();

    @Test
    void lineEdgeBecomesTwoPointLineString() {
        Edge edge = factory.makeEdgeFromLine(new Coordinate(0, 0), new Coordinate(3, 4));

        Geometry geom = converter.convertShape(edge);

        LineString line = assertInstanceOf(LineString.class, geom);
        assertEquals(2, line.getNumPoints());
        assertEquals(5, line.getLength(), EPS);
    }

    @Test
    void circleIsTessellated() {
        Edge circle = factory.makeEdgeFromCircle(new Coordinate(0, 0, 0), ShapeFactory.Z_AXIS, 1, 0, 2 * Math.PI);

        LineString ring = (LineString) converter.convertShape(circle);

        assertTrue(ring.getNumPoints() > 8);
        assertEquals(0, ring.getStartPoint().distance(ring.getEndPoint()), EPS);
        assertEquals(2 * Math.PI, ring.getLength(), 0.05);
    }

    @Test
    void shortArcStillHasMinimumSegments() {
        Edge arc = factory.makeEdgeFromCircle(new Coordinate(0, 0, 0), ShapeFactory.Z_AXIS, 1, 0, 0.1);

        assertEquals(9, converter.edgeToCoordinates(arc).size());
    }

    @Test
    void faceBecomesPolygon() {
        Face face = factory.makeFaceFromPolygon(List.of(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 10), new Coordinate(0, 10)));

        Polygon polygon = assertInstanceOf(Polygon.class, converter.convertShape(face));
        assertEquals(100, polygon.getArea(), EPS);
    }

    @Test
    void wireBecomesContinuousLineString() {
        Wire wire = factory.makeWireFromPoints(List.of(
                new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(1, 1)), false);

        LineString line = (LineString) converter.convertShape(wire);
        assertEquals(3, line.getNumPoints());
    }

    @Test
    void compoundBecomesCollection() {
        Edge a = factory.makeEdgeFromLine(new Coordinate(0, 0), new Coordinate(1, 0));
        Edge b = factory.makeEdgeFromLine(new Coordinate(0, 1), new Coordinate(1, 1));

        Geometry geom = converter.convertShape(factory.makeCompound(List.of(a, b)));

        assertInstanceOf(GeometryCollection.class, geom);
        assertEquals(2, geom.getNumGeometries());
    }

    @Test
    void envelopeCoversArcs() {
        Edge circle = factory.makeEdgeFromCircle(new Coordinate(5, 5, 0), ShapeFactory.Z_AXIS, 1, 0, 2 * Math.PI);
        Edge line = factory.makeEdgeFromLine(new Coordinate(0, 0), new Coordinate(2, 0));

        Envelope env = converter.envelope(List.of(circle, line));

        assertEquals(0, env.getMinX(), EPS);
        assertEquals(0, env.getMinY(), EPS);
        assertEquals(6, env.getMaxX(), EPS);
        assertEquals(6, env.getMaxY(), EPS);
    }

    @Test
    void envelopeOfNothingIsNull() {
        assertTrue(converter.envelope(List.of()).isNull());
    }
}
