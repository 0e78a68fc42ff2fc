package nl.bytesoflife.deltadxf.model.shape;

import java.util.List;

/**
 * An immutable topological shape.
 * Aggregates expose their direct sub-shapes in construction order.
 */
public sealed interface Shape permits Edge, Wire, Face, Solid, CompSolid, Compound {

    ShapeType getShapeType();

    /**
     * Direct sub-shapes, one level down. Edges have none.
     */
    List<? extends Shape> getSubShapes();
}
