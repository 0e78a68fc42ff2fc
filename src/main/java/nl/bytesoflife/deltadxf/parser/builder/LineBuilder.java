package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.Set;

/**
 * LINE: start point 10/20, end point 11/21, in the XY plane.
 */
public class LineBuilder extends AbstractEntityBuilder {

    public LineBuilder(GeometryKernel kernel) {
        super(kernel);
    }

    @Override
    public Shape build(DxfEntity entity) {
        Double x1 = number(entity, 10);
        Double y1 = number(entity, 20);
        Double x2 = number(entity, 11);
        Double y2 = number(entity, 21);
        if (x1 == null || y1 == null || x2 == null || y2 == null) {
            return null;
        }
        return kernel.makeEdgeFromLine(new Coordinate(x1, y1, 0), new Coordinate(x2, y2, 0));
    }

    @Override
    public Set<EntityType> getSupportedTypes() {
        return Set.of(EntityType.LINE);
    }
}
