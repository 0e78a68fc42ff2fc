package nl.bytesoflife.deltadxf.model.shape;

import java.util.List;

/**
 * An ordered chain of edges.
 */
public final class Wire implements Shape {

    private static final double CLOSE_TOLERANCE = 1e-9;

    private final List<Edge> edges;

    public Wire(List<Edge> edges) {
        this.edges = List.copyOf(edges);
    }

    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * True when the last edge ends where the first edge starts.
     */
    public boolean isClosed() {
        if (edges.isEmpty()) return false;
        return edges.get(edges.size() - 1).getEnd()
            .distance3D(edges.get(0).getStart()) < CLOSE_TOLERANCE;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.WIRE;
    }

    @Override
    public List<Edge> getSubShapes() {
        return edges;
    }

    @Override
    public String toString() {
        return "Wire[" + edges.size() + " edges" + (isClosed() ? ", closed" : "") + "]";
    }
}
