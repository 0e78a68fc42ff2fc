package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.Set;

/**
 * CIRCLE: center 10/20, radius 40, full period in the XY plane.
 */
public class CircleBuilder extends AbstractEntityBuilder {

    public CircleBuilder(GeometryKernel kernel) {
        super(kernel);
    }

    @Override
    public Shape build(DxfEntity entity) {
        Double x = number(entity, 10);
        Double y = number(entity, 20);
        Double radius = number(entity, 40);
        if (x == null || y == null || radius == null) {
            return null;
        }
        return kernel.makeEdgeFromCircle(new Coordinate(x, y, 0), ShapeFactory.Z_AXIS, radius,
                0, 2 * Math.PI);
    }

    @Override
    public Set<EntityType> getSupportedTypes() {
        return Set.of(EntityType.CIRCLE);
    }
}
