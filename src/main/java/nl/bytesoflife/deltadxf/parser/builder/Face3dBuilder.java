package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 3DFACE: up to four corners 1i/2i/3i for i = 0..3. Three corners give a triangle,
 * four a quad. A fourth corner equal to the third also gives a triangle.
 */
public class Face3dBuilder extends AbstractEntityBuilder {

    public Face3dBuilder(GeometryKernel kernel) {
        super(kernel);
    }

    @Override
    public Shape build(DxfEntity entity) {
        List<Coordinate> corners = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Double x = number(entity, 10 + i);
            Double y = number(entity, 20 + i);
            Double z = number(entity, 30 + i);
            if (x != null && y != null && z != null) {
                corners.add(new Coordinate(x, y, z));
            }
        }

        if (corners.size() == 4 && corners.get(3).equals3D(corners.get(2))) {
            corners.remove(3);
        }
        if (corners.size() < 3) {
            return null;
        }
        return kernel.makeFaceFromPolygon(corners);
    }

    @Override
    public Set<EntityType> getSupportedTypes() {
        return Set.of(EntityType.FACE_3D);
    }
}
