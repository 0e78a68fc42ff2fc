package nl.bytesoflife.deltadxf.model.shape;

import java.util.List;

/**
 * A solid described by its boundary faces.
 */
public final class Solid implements Shape {

    private final List<Face> faces;

    public Solid(List<Face> faces) {
        this.faces = List.copyOf(faces);
    }

    public List<Face> getFaces() {
        return faces;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.SOLID;
    }

    @Override
    public List<Face> getSubShapes() {
        return faces;
    }

    @Override
    public String toString() {
        return "Solid[" + faces.size() + " faces]";
    }
}
