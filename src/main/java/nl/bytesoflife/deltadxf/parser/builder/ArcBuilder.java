package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.Set;

/**
 * ARC: center 10/20, radius 40, start angle 50 and end angle 51 in degrees,
 * swept counter-clockwise.
 */
public class ArcBuilder extends AbstractEntityBuilder {

    public ArcBuilder(GeometryKernel kernel) {
        super(kernel);
    }

    @Override
    public Shape build(DxfEntity entity) {
        Double x = number(entity, 10);
        Double y = number(entity, 20);
        Double radius = number(entity, 40);
        Double startDeg = number(entity, 50);
        Double endDeg = number(entity, 51);
        if (x == null || y == null || radius == null || startDeg == null || endDeg == null) {
            return null;
        }
        double start = startDeg * Math.PI / 180.0;
        double end = endDeg * Math.PI / 180.0;
        return kernel.makeEdgeFromCircle(new Coordinate(x, y, 0), ShapeFactory.Z_AXIS, radius, start, end);
    }

    @Override
    public Set<EntityType> getSupportedTypes() {
        return Set.of(EntityType.ARC);
    }
}
