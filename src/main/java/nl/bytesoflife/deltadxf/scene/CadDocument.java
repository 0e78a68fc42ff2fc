package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.model.shape.Shape;

import java.util.List;

/**
 * Read-only view of a CAD document's label tree (assembly structure, names, colors and
 * shapes), as produced by a STEP or IGES reader.
 * Attribute queries never follow references; the classifier resolves those itself.
 */
public interface CadDocument {

    /**
     * The shapes root label.
     */
    DocumentLabel mainLabel();

    List<DocumentLabel> children(DocumentLabel label);

    default boolean hasChildren(DocumentLabel label) {
        return !children(label).isEmpty();
    }

    /**
     * True if the label is top-level, i.e. not referenced as a component of another label.
     */
    boolean isFree(DocumentLabel label);

    /**
     * True if the label describes a sub-shape of its parent's shape.
     */
    boolean isSubShape(DocumentLabel label);

    /**
     * The label's own shape, or null.
     */
    Shape shape(DocumentLabel label);

    /**
     * The label's own name attribute, or null.
     */
    String name(DocumentLabel label);

    /**
     * The label's own color in the given slot, or null.
     */
    String color(DocumentLabel label, ColorType type);

    /**
     * The label that holds {@code shape}, or null.
     */
    DocumentLabel findLabel(Shape shape);
}
