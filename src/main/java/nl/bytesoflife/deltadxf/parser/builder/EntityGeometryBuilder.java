package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryException;
import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatches records to the builder registered for their type.
 */
public class EntityGeometryBuilder {

    private static final Logger log = LoggerFactory.getLogger(EntityGeometryBuilder.class);

    private final Map<EntityType, EntityBuilder> builders = new EnumMap<>(EntityType.class);

    public EntityGeometryBuilder registerBuilder(EntityBuilder builder) {
        for (EntityType type : builder.getSupportedTypes()) {
            builders.put(type, builder);
        }
        return this;
    }

    /**
     * A dispatcher with builders for every modeled entity type.
     */
    public static EntityGeometryBuilder withDefaults(GeometryKernel kernel) {
        return new EntityGeometryBuilder()
                .registerBuilder(new LineBuilder(kernel))
                .registerBuilder(new CircleBuilder(kernel))
                .registerBuilder(new ArcBuilder(kernel))
                .registerBuilder(new PolylineBuilder(kernel))
                .registerBuilder(new Face3dBuilder(kernel));
    }

    public boolean supports(String dxfType) {
        EntityType type = EntityType.fromDxfName(dxfType);
        return type != null && builders.containsKey(type);
    }

    /**
     * Build the shape for a record; null for unmodeled types, missing fields or degenerate geometry.
     */
    public Shape build(DxfEntity entity) {
        EntityType type = EntityType.fromDxfName(entity.getType());
        EntityBuilder builder = type != null ? builders.get(type) : null;
        if (builder == null) {
            return null;
        }

        try {
            Shape shape = builder.build(entity);
            if (shape == null) {
                log.debug("Skipping {}: required fields missing", entity);
            }
            return shape;
        } catch (GeometryException e) {
            log.debug("Skipping {}: {}", entity, e.getMessage());
            return null;
        }
    }
}
