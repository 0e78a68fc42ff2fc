package nl.bytesoflife.deltadxf.model.shape;

/**
 * Classification of the curve underlying an edge, as used by the DXF writer.
 */
public enum CurveKind {
    /** Straight line. */
    LINE,
    /** Circle traversed over its full period. */
    CIRCLE,
    /** Arc of a circle. */
    TRIMMED_CIRCLE,
    OTHER
}
