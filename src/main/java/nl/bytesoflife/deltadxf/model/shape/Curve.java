package nl.bytesoflife.deltadxf.model.shape;

import org.locationtech.jts.geom.Coordinate;

/**
 * A parametric 3D curve.
 */
public sealed interface Curve permits LineCurve, CircleCurve, TrimmedCurve {

    /**
     * Evaluate the curve at parameter {@code t}.
     */
    Coordinate value(double t);
}
