package nl.bytesoflife.deltadxf.writer;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.model.shape.*;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes shapes as ASCII DXF.
 * <p>
 * The output has a fixed HEADER and TABLES preamble (one layer "0") and an ENTITIES
 * section. For every shape, each edge is written as LINE, CIRCLE or ARC according to its
 * curve; other curves, circles outside the XY plane and arcs not oriented along +Z are
 * skipped. A wire additionally gives one LWPOLYLINE and a face one
 * 3DFACE. Entities are written in shape order, then edge order; all on layer "0".
 */
public class DxfWriter {

    private static final Logger log = LoggerFactory.getLogger(DxfWriter.class);

    public static final String DEFAULT_ACAD_VERSION = "AC1015";
    public static final int DEFAULT_INSUNITS = 4;
    private static final String LAYER = "0";
    private static final double NORMAL_TOLERANCE = 1e-9;

    private final GeometryKernel kernel;
    private String acadVersion = DEFAULT_ACAD_VERSION;
    private int insUnits = DEFAULT_INSUNITS;

    public DxfWriter() {
        this(new ShapeFactory());
    }

    public DxfWriter(GeometryKernel kernel) {
        this.kernel = kernel;
    }

    /**
     * Value written for {@code $ACADVER}. Defaults to AC1015 (AutoCAD 2000).
     */
    public DxfWriter withAcadVersion(String acadVersion) {
        this.acadVersion = acadVersion;
        return this;
    }

    /**
     * Value written for {@code $INSUNITS}. Defaults to 4 (millimetres).
     */
    public DxfWriter withInsUnits(int insUnits) {
        this.insUnits = insUnits;
        return this;
    }

    public String write(List<? extends Shape> shapes) {
        StringBuilder sb = new StringBuilder();
        writeHeader(sb);
        writeTables(sb);

        group(sb, 0, "SECTION");
        group(sb, 2, "ENTITIES");
        int count = 0;
        for (Shape shape : shapes) {
            count += writeShape(sb, shape);
        }
        group(sb, 0, "ENDSEC");
        group(sb, 0, "EOF");

        log.debug("Wrote {} entities for {} shapes", count, shapes.size());
        return sb.toString();
    }

    private void writeHeader(StringBuilder sb) {
        group(sb, 0, "SECTION");
        group(sb, 2, "HEADER");
        group(sb, 9, "$ACADVER");
        group(sb, 1, acadVersion);
        group(sb, 9, "$INSUNITS");
        group(sb, 70, Integer.toString(insUnits));
        group(sb, 0, "ENDSEC");
    }

    private void writeTables(StringBuilder sb) {
        group(sb, 0, "SECTION");
        group(sb, 2, "TABLES");
        group(sb, 0, "TABLE");
        group(sb, 2, "LAYER");
        group(sb, 0, "LAYER");
        group(sb, 2, LAYER);
        group(sb, 70, "0");
        group(sb, 62, "7");
        group(sb, 6, "CONTINUOUS");
        group(sb, 0, "ENDTAB");
        group(sb, 0, "ENDSEC");
    }

    private int writeShape(StringBuilder sb, Shape shape) {
        int count = 0;
        for (Edge edge : kernel.edges(shape)) {
            if (writeEdge(sb, edge)) {
                count++;
            }
        }

        ShapeType kind = kernel.shapeKind(shape);
        if (kind == ShapeType.WIRE && writeLwPolyline(sb, (Wire) shape)) {
            count++;
        } else if (kind == ShapeType.FACE && write3dFace(sb, (Face) shape)) {
            count++;
        }
        return count;
    }

    private boolean writeEdge(StringBuilder sb, Edge edge) {
        switch (kernel.classifyCurve(edge)) {
            case LINE -> {
                entity(sb, "LINE");
                point(sb, 0, edge.getStart());
                point(sb, 1, edge.getEnd());
                return true;
            }
            case CIRCLE -> {
                CircleCurve circle = circleOf(edge);
                if (!inDrawingPlane(circle)) {
                    log.debug("Skipping circle outside the XY plane: {}", circle);
                    return false;
                }
                entity(sb, "CIRCLE");
                point(sb, 0, circle.getCenter());
                group(sb, 40, number(circle.getRadius()));
                return true;
            }
            case TRIMMED_CIRCLE -> {
                CircleCurve circle = circleOf(edge);
                // ARC angles run counter-clockwise about +Z; no extrusion is written
                if (!inDrawingPlane(circle) || circle.getNormal()[2] < 0) {
                    log.debug("Skipping arc not oriented along +Z: {}", circle);
                    return false;
                }
                entity(sb, "ARC");
                point(sb, 0, circle.getCenter());
                group(sb, 40, number(circle.getRadius()));
                group(sb, 50, number(degrees(edge.getFirst())));
                group(sb, 51, number(degrees(edge.getLast())));
                return true;
            }
            default -> {
                log.debug("Skipping edge with unsupported curve: {}", edge);
                return false;
            }
        }
    }

    private boolean writeLwPolyline(StringBuilder sb, Wire wire) {
        List<Edge> edges = kernel.wireEdges(wire);
        if (edges.isEmpty()) return false;

        List<Coordinate> points = new ArrayList<>();
        for (Edge edge : edges) {
            points.add(edge.getStart());
        }
        boolean closed = wire.isClosed();
        if (!closed) {
            points.add(edges.get(edges.size() - 1).getEnd());
        }

        entity(sb, "LWPOLYLINE");
        group(sb, 90, Integer.toString(points.size()));
        group(sb, 70, closed ? "1" : "0");
        for (Coordinate p : points) {
            point(sb, 0, p);
        }
        return true;
    }

    private boolean write3dFace(StringBuilder sb, Face face) {
        List<Coordinate> corners = new ArrayList<>();
        for (Edge edge : kernel.faceBoundary(face)) {
            if (corners.size() == 4) break;
            corners.add(edge.getStart());
        }
        if (corners.size() < 3) return false;

        entity(sb, "3DFACE");
        for (int i = 0; i < corners.size(); i++) {
            point(sb, i, corners.get(i));
        }
        return true;
    }

    private static CircleCurve circleOf(Edge edge) {
        Curve curve = edge.getCurve();
        if (curve instanceof TrimmedCurve trimmed) {
            curve = trimmed.getBasis();
        }
        return (CircleCurve) curve;
    }

    private static boolean inDrawingPlane(CircleCurve circle) {
        double[] normal = circle.getNormal();
        return Math.abs(normal[0]) < NORMAL_TOLERANCE && Math.abs(normal[1]) < NORMAL_TOLERANCE;
    }

    private static void entity(StringBuilder sb, String type) {
        group(sb, 0, type);
        group(sb, 8, LAYER);
    }

    /**
     * Write a point with codes 1i/2i/3i.
     */
    private static void point(StringBuilder sb, int index, Coordinate p) {
        group(sb, 10 + index, number(p.x));
        group(sb, 20 + index, number(p.y));
        group(sb, 30 + index, number(Double.isNaN(p.getZ()) ? 0 : p.getZ()));
    }

    private static void group(StringBuilder sb, int code, String value) {
        String codeText = Integer.toString(code);
        for (int i = codeText.length(); i < 3; i++) {
            sb.append(' ');
        }
        sb.append(codeText).append('\n').append(value).append('\n');
    }

    /**
     * Angle in degrees, normalized into [0, 360).
     */
    static double degrees(double radians) {
        double deg = radians * 180.0 / Math.PI % 360.0;
        if (deg < 0) deg += 360.0;
        return deg >= 360.0 ? 0.0 : deg;
    }

    /**
     * Plain decimal text that parses back to the same double.
     */
    static String number(double value) {
        if (value == 0) return "0.0";
        String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }
}
