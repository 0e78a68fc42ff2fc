package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.model.shape.Shape;
import nl.bytesoflife.deltadxf.model.shape.ShapeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns a CAD document's label tree into a {@link ShapeNode} tree.
 * <p>
 * The main label becomes a group of its free-shape children. Every other label is either
 * a mesh node, whose shape becomes a leaf (compounds and compsolids are decomposed into
 * groups of their sub-shapes), or a group node whose children are its free-shape children.
 * Both walks use explicit stacks, so nesting depth does not consume call stack.
 */
public class SceneGraphClassifier {

    private static final Logger log = LoggerFactory.getLogger(SceneGraphClassifier.class);

    public ShapeNode classify(CadDocument doc) {
        DocumentLabel root = doc.mainLabel();
        ShapeNode rootNode = labelGroupNode(doc, root);

        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, rootNode));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            for (DocumentLabel child : doc.children(pending.label())) {
                if (!isFreeShape(doc, child)) continue;

                if (isMeshNode(doc, child)) {
                    pending.node().addChild(decompose(doc, doc.shape(child)));
                } else {
                    ShapeNode group = labelGroupNode(doc, child);
                    pending.node().addChild(group);
                    stack.push(new Pending(child, group));
                }
            }
        }

        log.debug("Classified document into {} nodes", ShapeNodes.count(rootNode));
        return rootNode;
    }

    /**
     * A label is a mesh node when it has no children, when any child is a sub-shape,
     * or when none of its children is a free shape.
     */
    public boolean isMeshNode(CadDocument doc, DocumentLabel label) {
        if (!doc.hasChildren(label)) {
            return true;
        }

        for (DocumentLabel child : doc.children(label)) {
            if (doc.isSubShape(child)) {
                return true;
            }
        }

        for (DocumentLabel child : doc.children(label)) {
            if (isFreeShape(doc, child)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Leaf node for a plain shape; group tree for a compound or compsolid.
     */
    public ShapeNode decompose(CadDocument doc, Shape shape) {
        if (!isAggregate(shape)) {
            return shapeLeafNode(doc, shape);
        }

        ShapeNode rootNode = shapeGroupNode(doc, shape);
        Deque<ShapeFrame> stack = new ArrayDeque<>();
        stack.push(new ShapeFrame(shape, rootNode));
        while (!stack.isEmpty()) {
            ShapeFrame frame = stack.pop();
            for (Shape sub : frame.shape().getSubShapes()) {
                if (isAggregate(sub)) {
                    ShapeNode group = shapeGroupNode(doc, sub);
                    frame.node().addChild(group);
                    stack.push(new ShapeFrame(sub, group));
                } else {
                    frame.node().addChild(shapeLeafNode(doc, sub));
                }
            }
        }
        return rootNode;
    }

    private static boolean isFreeShape(CadDocument doc, DocumentLabel label) {
        return doc.shape(label) != null && doc.isFree(label);
    }

    private static boolean isAggregate(Shape shape) {
        ShapeType type = shape.getShapeType();
        return type == ShapeType.COMPOUND || type == ShapeType.COMPSOLID;
    }

    private ShapeNode labelGroupNode(CadDocument doc, DocumentLabel label) {
        return ShapeNode.group(labelName(doc, label), labelColor(doc, label));
    }

    private ShapeNode shapeGroupNode(CadDocument doc, Shape shape) {
        DocumentLabel label = doc.findLabel(shape);
        return ShapeNode.group(label != null ? labelName(doc, label) : "", null);
    }

    private ShapeNode shapeLeafNode(CadDocument doc, Shape shape) {
        DocumentLabel label = doc.findLabel(shape);
        if (label == null) {
            return ShapeNode.leaf(shape, "", null);
        }
        return ShapeNode.leaf(shape, labelName(doc, label), labelColor(doc, label));
    }

    /**
     * Name of the label at the end of the reference chain.
     */
    String labelName(CadDocument doc, DocumentLabel label) {
        String name = doc.name(label.resolve());
        return name != null ? name : "";
    }

    /**
     * First valid color along the reference chain, trying the surface, curve and generic
     * slots of each label in turn.
     */
    String labelColor(CadDocument doc, DocumentLabel label) {
        DocumentLabel current = label;
        while (current != null) {
            for (ColorType type : ColorType.values()) {
                String raw = doc.color(current, type);
                if (raw == null) continue;
                String color = HexColor.normalize(raw);
                if (color != null) {
                    return color;
                }
                log.debug("Ignoring malformed {} color '{}' on label {}", type, raw, current.entry());
            }
            current = current instanceof DocumentLabel.Reference ref ? ref.referred() : null;
        }
        return null;
    }

    private record Pending(DocumentLabel label, ShapeNode node) {}

    private record ShapeFrame(Shape shape, ShapeNode node) {}
}
