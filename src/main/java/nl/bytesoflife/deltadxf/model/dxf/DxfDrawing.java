package nl.bytesoflife.deltadxf.model.dxf;

import nl.bytesoflife.deltadxf.model.shape.Compound;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of reading a DXF file: the raw records and the geometry built from them.
 */
public class DxfDrawing {

    private final List<DxfEntity> entities;
    private final List<BuiltEntity> built = new ArrayList<>();
    private final Map<String, String> layerColors = new LinkedHashMap<>();
    private final Set<String> layers = new LinkedHashSet<>();
    private int unsupportedCount;
    private int incompleteCount;
    private Compound compound = new Compound(List.of());
    private Envelope envelope = new Envelope();

    public DxfDrawing(List<DxfEntity> entities) {
        this.entities = List.copyOf(entities);
    }

    public List<DxfEntity> getEntities() {
        return entities;
    }

    public void addBuilt(DxfEntity entity, Shape shape) {
        built.add(new BuiltEntity(entity, shape));
    }

    /**
     * Records that produced geometry, with their shapes, in record order.
     */
    public List<BuiltEntity> getBuilt() {
        return Collections.unmodifiableList(built);
    }

    public List<Shape> getShapes() {
        return built.stream().map(BuiltEntity::shape).toList();
    }

    public int getRecognizedCount() {
        return built.size();
    }

    public int getUnsupportedCount() {
        return unsupportedCount;
    }

    public void incrementUnsupported() {
        unsupportedCount++;
    }

    public int getIncompleteCount() {
        return incompleteCount;
    }

    public void incrementIncomplete() {
        incompleteCount++;
    }

    public void addLayer(String name) {
        layers.add(name);
    }

    /**
     * Layer names from the LAYER table and from entities, in first-seen order.
     */
    public Set<String> getLayers() {
        return Collections.unmodifiableSet(layers);
    }

    public void setLayerColor(String layer, String aciColor) {
        layerColors.put(layer, aciColor);
    }

    /**
     * Raw code-62 color of a LAYER table entry, or null.
     */
    public String getLayerColor(String layer) {
        return layerColors.get(layer);
    }

    public Compound getCompound() {
        return compound;
    }

    public void setCompound(Compound compound) {
        this.compound = compound;
    }

    /**
     * 2D extents of all built geometry; {@link Envelope#isNull()} when nothing was built.
     */
    public Envelope getEnvelope() {
        return envelope;
    }

    public void setEnvelope(Envelope envelope) {
        this.envelope = envelope;
    }

    @Override
    public String toString() {
        return "DxfDrawing{records=" + entities.size() + ", recognized=" + built.size() +
                ", unsupported=" + unsupportedCount + ", incomplete=" + incompleteCount +
                ", layers=" + layers + "}";
    }

    public record BuiltEntity(DxfEntity entity, Shape shape) {}
}
