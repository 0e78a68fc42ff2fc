package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.model.shape.Shape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Helpers over {@link ShapeNode} trees.
 */
public final class ShapeNodes {

    private ShapeNodes() {
    }

    /**
     * Shapes of all nodes that carry one, depth-first in child order.
     */
    public static List<Shape> collectShapes(ShapeNode root) {
        List<Shape> shapes = new ArrayList<>();
        Deque<ShapeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ShapeNode node = stack.pop();
            if (node.getShape() != null) {
                shapes.add(node.getShape());
            }
            List<ShapeNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return shapes;
    }

    /**
     * Number of nodes in the tree, root included.
     */
    public static int count(ShapeNode root) {
        int count = 0;
        Deque<ShapeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ShapeNode node = stack.pop();
            count++;
            node.getChildren().forEach(stack::push);
        }
        return count;
    }
}
