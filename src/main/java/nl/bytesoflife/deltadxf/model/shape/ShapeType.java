package nl.bytesoflife.deltadxf.model.shape;

/**
 * Topological kind of a {@link Shape}, from the most to the least aggregated.
 */
public enum ShapeType {
    COMPOUND,
    COMPSOLID,
    SOLID,
    FACE,
    WIRE,
    EDGE
}
