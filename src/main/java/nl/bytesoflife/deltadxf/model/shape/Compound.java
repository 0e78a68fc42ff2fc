package nl.bytesoflife.deltadxf.model.shape;

import java.util.List;

/**
 * An arbitrary collection of shapes, possibly empty.
 */
public final class Compound implements Shape {

    private final List<Shape> children;

    public Compound(List<? extends Shape> children) {
        this.children = List.copyOf(children);
    }

    public List<Shape> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.COMPOUND;
    }

    @Override
    public List<Shape> getSubShapes() {
        return children;
    }

    @Override
    public String toString() {
        return "Compound[" + children.size() + " shapes]";
    }
}
