package nl.bytesoflife.deltadxf.scene;

/**
 * Color slots of a document label, in lookup priority order.
 */
public enum ColorType {
    SURFACE,
    CURVE,
    GENERIC
}
