package nl.bytesoflife.deltadxf.geometry;

/**
 * Thrown by the geometry kernel when asked to build a degenerate primitive.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }
}
