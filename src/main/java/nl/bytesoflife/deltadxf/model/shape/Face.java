package nl.bytesoflife.deltadxf.model.shape;

import java.util.ArrayList;
import java.util.List;

/**
 * A planar face bounded by an outer wire and optional hole wires.
 */
public final class Face implements Shape {

    private final Wire outerWire;
    private final List<Wire> innerWires;

    public Face(Wire outerWire) {
        this(outerWire, List.of());
    }

    public Face(Wire outerWire, List<Wire> innerWires) {
        this.outerWire = outerWire;
        this.innerWires = List.copyOf(innerWires);
    }

    public Wire getOuterWire() {
        return outerWire;
    }

    public List<Wire> getInnerWires() {
        return innerWires;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.FACE;
    }

    @Override
    public List<Wire> getSubShapes() {
        List<Wire> wires = new ArrayList<>(innerWires.size() + 1);
        wires.add(outerWire);
        wires.addAll(innerWires);
        return wires;
    }

    @Override
    public String toString() {
        return "Face[outer=" + outerWire + ", holes=" + innerWires.size() + "]";
    }
}
