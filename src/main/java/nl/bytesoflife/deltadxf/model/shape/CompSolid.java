package nl.bytesoflife.deltadxf.model.shape;

import java.util.List;

/**
 * A set of solids sharing faces.
 */
public final class CompSolid implements Shape {

    private final List<Solid> solids;

    public CompSolid(List<Solid> solids) {
        this.solids = List.copyOf(solids);
    }

    public List<Solid> getSolids() {
        return solids;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.COMPSOLID;
    }

    @Override
    public List<Solid> getSubShapes() {
        return solids;
    }

    @Override
    public String toString() {
        return "CompSolid[" + solids.size() + " solids]";
    }
}
