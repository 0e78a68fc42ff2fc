package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.lexer.GroupCode;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * POLYLINE and LWPOLYLINE: an ordered point list chained into straight edges.
 * <p>
 * Points come from linked VERTEX records when the polyline has them, otherwise from the
 * record's own repeated 10/20/30 codes, where each 10 starts a new point. Z is only read
 * for a POLYLINE with flag bit 3 (3D polyline). An LWPOLYLINE with flag bit 0 and more
 * than two points is closed back to its first point.
 */
public class PolylineBuilder extends AbstractEntityBuilder {

    static final int FLAG_CLOSED = 1;
    static final int FLAG_3D = 8;

    // VERTEX flags
    private static final int VERTEX_SPLINE_FRAME = 16;
    private static final int VERTEX_MESH = 64;
    private static final int VERTEX_FACE_RECORD = 128;

    public PolylineBuilder(GeometryKernel kernel) {
        super(kernel);
    }

    @Override
    public Shape build(DxfEntity entity) {
        int flags = entity.getInt(70, 0);
        boolean lightweight = EntityType.LWPOLYLINE.getDxfName().equals(entity.getType());
        boolean is3D = !lightweight && (flags & FLAG_3D) != 0;

        List<Coordinate> points = entity.getVertices().isEmpty()
                ? inlinePoints(entity, is3D)
                : vertexPoints(entity, is3D);
        if (points.size() < 2) {
            return null;
        }

        boolean closed = lightweight && points.size() > 2 && (flags & FLAG_CLOSED) != 0;
        return kernel.makeWireFromPoints(points, closed);
    }

    private List<Coordinate> inlinePoints(DxfEntity entity, boolean is3D) {
        List<Coordinate> points = new ArrayList<>();
        Double x = null;
        Double y = null;
        Double z = null;
        for (GroupCode field : entity.getFields()) {
            switch (field.code()) {
                case 10 -> {
                    addPoint(points, x, y, z, is3D);
                    x = parse(field.value());
                    y = null;
                    z = null;
                }
                case 20 -> y = parse(field.value());
                case 30 -> z = parse(field.value());
                default -> {
                }
            }
        }
        addPoint(points, x, y, z, is3D);
        return points;
    }

    private List<Coordinate> vertexPoints(DxfEntity entity, boolean is3D) {
        List<Coordinate> points = new ArrayList<>();
        for (DxfEntity vertex : entity.getVertices()) {
            int flags = vertex.getInt(70, 0);
            if ((flags & VERTEX_SPLINE_FRAME) != 0) continue;
            if ((flags & VERTEX_FACE_RECORD) != 0 && (flags & VERTEX_MESH) == 0) continue;
            addPoint(points, number(vertex, 10), number(vertex, 20), number(vertex, 30), is3D);
        }
        return points;
    }

    private static void addPoint(List<Coordinate> points, Double x, Double y, Double z, boolean is3D) {
        if (x == null || y == null) return;
        double zz = is3D && z != null ? z : 0;
        points.add(new Coordinate(x, y, zz));
    }

    @Override
    public Set<EntityType> getSupportedTypes() {
        return Set.of(EntityType.POLYLINE, EntityType.LWPOLYLINE);
    }
}
