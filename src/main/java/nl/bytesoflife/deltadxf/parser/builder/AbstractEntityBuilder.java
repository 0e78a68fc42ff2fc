package nl.bytesoflife.deltadxf.parser.builder;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;

abstract class AbstractEntityBuilder implements EntityBuilder {

    protected final GeometryKernel kernel;

    protected AbstractEntityBuilder(GeometryKernel kernel) {
        this.kernel = kernel;
    }

    /**
     * Last value of {@code code} as a double, or null when absent or not a finite number.
     */
    protected static Double number(DxfEntity entity, int code) {
        return parse(entity.getValue(code));
    }

    protected static Double parse(String value) {
        if (value == null) return null;
        try {
            double d = Double.parseDouble(value);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
