package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;

import java.util.Set;

/**
 * Converts one DXF record into a shape.
 */
public interface EntityBuilder {

    /**
     * Build the shape for {@code entity}, or return null when required fields are missing
     * or not numeric. May throw {@link nl.bytesoflife.deltadxf.geometry.GeometryException}
     * for degenerate geometry.
     */
    Shape build(DxfEntity entity);

    Set<EntityType> getSupportedTypes();
}
