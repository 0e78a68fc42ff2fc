package nl.bytesoflife.deltadxf.scene;

import nl.bytesoflife.deltadxf.model.shape.Shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A {@link CadDocument} held in memory, built label by label.
 * <p>
 * A label is free unless a reference points at it or it was added as a sub-shape.
 * A reference label reports the shape of the label it refers to.
 */
public class InMemoryCadDocument implements CadDocument {

    private final DocumentLabel main;
    private final Map<String, List<DocumentLabel>> children = new HashMap<>();
    private final Map<String, Shape> shapes = new HashMap<>();
    private final Map<String, String> names = new HashMap<>();
    private final Map<String, Map<ColorType, String>> colors = new HashMap<>();
    private final Set<String> referenced = new HashSet<>();
    private final Set<String> subShapes = new HashSet<>();
    private final Map<Shape, DocumentLabel> shapeLabels = new IdentityHashMap<>();

    public InMemoryCadDocument() {
        this("0:1:1");
    }

    public InMemoryCadDocument(String mainEntry) {
        this.main = new DocumentLabel.Direct(mainEntry);
    }

    @Override
    public DocumentLabel mainLabel() {
        return main;
    }

    /**
     * Add a child label without a shape, e.g. an assembly.
     */
    public DocumentLabel addLabel(DocumentLabel parent, String name) {
        DocumentLabel label = new DocumentLabel.Direct(nextEntry(parent));
        attach(parent, label, name);
        return label;
    }

    public DocumentLabel addShape(DocumentLabel parent, Shape shape, String name) {
        DocumentLabel label = addLabel(parent, name);
        setShape(label, shape);
        return label;
    }

    /**
     * Add a child that describes a sub-shape of the parent's shape.
     */
    public DocumentLabel addSubShape(DocumentLabel parent, Shape shape, String name) {
        DocumentLabel label = addShape(parent, shape, name);
        subShapes.add(label.entry());
        return label;
    }

    /**
     * Add a component referring to {@code referred}; the referred label stops being free.
     */
    public DocumentLabel addReference(DocumentLabel parent, DocumentLabel referred, String name) {
        DocumentLabel label = new DocumentLabel.Reference(nextEntry(parent), referred);
        attach(parent, label, name);
        referenced.add(referred.entry());
        return label;
    }

    public InMemoryCadDocument setShape(DocumentLabel label, Shape shape) {
        shapes.put(label.entry(), shape);
        shapeLabels.putIfAbsent(shape, label);
        return this;
    }

    public InMemoryCadDocument setColor(DocumentLabel label, ColorType type, String color) {
        colors.computeIfAbsent(label.entry(), k -> new EnumMap<>(ColorType.class)).put(type, color);
        return this;
    }

    @Override
    public List<DocumentLabel> children(DocumentLabel label) {
        return Collections.unmodifiableList(children.getOrDefault(label.entry(), List.of()));
    }

    @Override
    public boolean isFree(DocumentLabel label) {
        return !referenced.contains(label.entry()) && !subShapes.contains(label.entry());
    }

    @Override
    public boolean isSubShape(DocumentLabel label) {
        return subShapes.contains(label.entry());
    }

    @Override
    public Shape shape(DocumentLabel label) {
        Shape own = shapes.get(label.entry());
        if (own != null || !label.isReference()) {
            return own;
        }
        return shapes.get(label.resolve().entry());
    }

    @Override
    public String name(DocumentLabel label) {
        return names.get(label.entry());
    }

    @Override
    public String color(DocumentLabel label, ColorType type) {
        Map<ColorType, String> slots = colors.get(label.entry());
        return slots != null ? slots.get(type) : null;
    }

    @Override
    public DocumentLabel findLabel(Shape shape) {
        return shapeLabels.get(shape);
    }

    private void attach(DocumentLabel parent, DocumentLabel label, String name) {
        children.computeIfAbsent(parent.entry(), k -> new ArrayList<>()).add(label);
        if (name != null) {
            names.put(label.entry(), name);
        }
    }

    private String nextEntry(DocumentLabel parent) {
        int index = children.getOrDefault(parent.entry(), List.of()).size() + 1;
        return parent.entry() + ":" + index;
    }
}
