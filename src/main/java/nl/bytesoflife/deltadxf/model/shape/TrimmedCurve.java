package nl.bytesoflife.deltadxf.model.shape;

import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;

/**
 * A basis curve restricted to the parameter range [first, last].
 */
public final class TrimmedCurve implements Curve {

    private final Curve basis;
    private final double first;
    private final double last;

    public TrimmedCurve(Curve basis, double first, double last) {
        if (basis instanceof TrimmedCurve) {
            throw new IllegalArgumentException("Basis curve must not itself be trimmed");
        }
        this.basis = basis;
        this.first = first;
        this.last = last;
    }

    public Curve getBasis() {
        return basis;
    }

    public double getFirst() {
        return first;
    }

    public double getLast() {
        return last;
    }

    @Override
    public Coordinate value(double t) {
        return basis.value(t);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "TrimmedCurve[%s, %.6f..%.6f]", basis, first, last);
    }
}
