package nl.bytesoflife.deltadxf.geometry;

import nl.bytesoflife.deltadxf.model.shape.*;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Primitive constructors and topological queries used by the DXF reader and writer.
 * Constructors throw {@link GeometryException} for degenerate input.
 */
public interface GeometryKernel {

    Edge makeEdgeFromLine(Coordinate p1, Coordinate p2);

    /**
     * Make an edge on a circle. A parameter range covering a full period gives an edge on
     * the bare circle; a partial range gives an edge on a trimmed circle. An end parameter
     * not greater than the start is advanced by whole periods.
     */
    Edge makeEdgeFromCircle(Coordinate center, double[] normal, double radius,
                            double startParam, double endParam);

    /**
     * Chain consecutive points with straight edges, optionally closing back to the first point.
     */
    Wire makeWireFromPoints(List<Coordinate> points, boolean closed);

    /**
     * Make a planar face whose outer boundary is the closed polygon through {@code points}.
     */
    Face makeFaceFromPolygon(List<Coordinate> points);

    Compound makeCompound(List<? extends Shape> shapes);

    ShapeType shapeKind(Shape shape);

    CurveKind classifyCurve(Edge edge);

    /**
     * All edges of a shape, depth-first in sub-shape order.
     */
    List<Edge> edges(Shape shape);

    /**
     * Edges of a wire in wire order.
     */
    List<Edge> wireEdges(Wire wire);

    /**
     * Edges of the outer boundary of a face, in boundary order.
     */
    List<Edge> faceBoundary(Face face);

    /**
     * All faces of a shape, depth-first in sub-shape order.
     */
    List<Face> faces(Shape shape);
}
