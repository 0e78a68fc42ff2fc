package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.model.shape.Shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, optionally colored node of an imported scene.
 * A node without a shape is a group whose content is its children; a node with a shape
 * is a leaf.
 */
public class ShapeNode {

    private final Shape shape;
    private final String color;
    private final String name;
    private final List<ShapeNode> children = new ArrayList<>();

    private ShapeNode(Shape shape, String color, String name) {
        this.shape = shape;
        this.color = color;
        this.name = name != null ? name : "";
    }

    public static ShapeNode leaf(Shape shape, String name, String color) {
        if (shape == null) {
            throw new IllegalArgumentException("A leaf node needs a shape");
        }
        return new ShapeNode(shape, color, name);
    }

    public static ShapeNode group(String name, String color) {
        return new ShapeNode(null, color, name);
    }

    /**
     * The node's shape, or null for a group node.
     */
    public Shape getShape() {
        return shape;
    }

    /**
     * Color as upper-case {@code #RRGGBB}, or null.
     */
    public String getColor() {
        return color;
    }

    public String getName() {
        return name;
    }

    public boolean isGroup() {
        return shape == null;
    }

    public List<ShapeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ShapeNode addChild(ShapeNode child) {
        if (!isGroup()) {
            throw new IllegalStateException("Leaf node '" + name + "' cannot have children");
        }
        children.add(child);
        return this;
    }

    @Override
    public String toString() {
        return "ShapeNode{name='" + name + "'" +
                (shape != null ? ", shape=" + shape.getShapeType() : ", children=" + children.size()) +
                (color != null ? ", color=" + color : "") + "}";
    }
}
