package nl.bytesoflife.deltadxf;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.model.dxf.DxfDrawing;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import nl.bytesoflife.deltadxf.model.shape.ShapeType;
import nl.bytesoflife.deltadxf.parser.DxfReader;
import nl.bytesoflife.deltadxf.scene.CadDocument;
import nl.bytesoflife.deltadxf.scene.HexColor;
import nl.bytesoflife.deltadxf.scene.SceneGraphClassifier;
import nl.bytesoflife.deltadxf.scene.ShapeNode;
import nl.bytesoflife.deltadxf.scene.ShapeNodes;
import nl.bytesoflife.deltadxf.writer.DxfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for DXF import/export and CAD document classification.
 * <p>
 * Import fails only with {@link nl.bytesoflife.deltadxf.lexer.DxfLexer.MalformedGroupCodeException};
 * a file without usable geometry imports as an empty compound.
 */
public class DxfConverter {

    private static final Logger log = LoggerFactory.getLogger(DxfConverter.class);

    private final GeometryKernel kernel;
    private final DxfReader reader;
    private final DxfWriter writer;
    private final SceneGraphClassifier classifier = new SceneGraphClassifier();

    public DxfConverter() {
        this(new ShapeFactory());
    }

    public DxfConverter(GeometryKernel kernel) {
        this(kernel, new DxfReader(kernel), new DxfWriter(kernel));
    }

    public DxfConverter(GeometryKernel kernel, DxfReader reader, DxfWriter writer) {
        this.kernel = kernel;
        this.reader = reader;
        this.writer = writer;
    }

    public DxfDrawing read(byte[] content) {
        return reader.read(content);
    }

    /**
     * Import as a single node holding the compound of every recognized entity.
     */
    public ShapeNode importDxf(byte[] content) {
        DxfDrawing drawing = reader.read(content);
        log.debug("Imported {}", drawing);
        return ShapeNode.leaf(drawing.getCompound(), rootName(drawing), null);
    }

    /**
     * Import as a group with one compound per layer that has geometry.
     */
    public ShapeNode importDxfByLayer(byte[] content) {
        DxfDrawing drawing = reader.read(content);

        Map<String, List<Shape>> byLayer = new LinkedHashMap<>();
        Map<String, String> entityColors = new LinkedHashMap<>();
        for (DxfDrawing.BuiltEntity built : drawing.getBuilt()) {
            DxfEntity entity = built.entity();
            byLayer.computeIfAbsent(entity.getLayer(), k -> new ArrayList<>()).add(built.shape());
            String color = HexColor.fromAci(entity.getColor());
            if (color != null) {
                entityColors.putIfAbsent(entity.getLayer(), color);
            }
        }

        ShapeNode root = ShapeNode.group(rootName(drawing), null);
        for (String layer : drawing.getLayers()) {
            List<Shape> shapes = byLayer.get(layer);
            if (shapes == null) continue;
            String color = HexColor.fromAci(drawing.getLayerColor(layer));
            if (color == null) {
                color = entityColors.get(layer);
            }
            root.addChild(ShapeNode.leaf(kernel.makeCompound(shapes), layer, color));
        }
        log.debug("Imported {} into {} layers", drawing, root.getChildren().size());
        return root;
    }

    public String exportDxf(List<? extends Shape> shapes) {
        return writer.write(shapes);
    }

    public byte[] exportDxfBytes(List<? extends Shape> shapes) {
        return exportDxf(shapes).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Export every shape in the tree, depth-first.
     */
    public String exportDxf(ShapeNode root) {
        return exportDxf(ShapeNodes.collectShapes(root));
    }

    /**
     * Export only edges and wires; other shapes are dropped.
     */
    public String exportWireframe(List<? extends Shape> shapes) {
        List<Shape> wireframe = new ArrayList<>();
        for (Shape shape : shapes) {
            ShapeType kind = kernel.shapeKind(shape);
            if (kind == ShapeType.EDGE || kind == ShapeType.WIRE) {
                wireframe.add(shape);
            }
        }
        return exportDxf(wireframe);
    }

    /**
     * Export the faces of every shape; solids and aggregates are broken into faces.
     */
    public String exportMesh(List<? extends Shape> shapes) {
        List<Shape> faces = new ArrayList<>();
        for (Shape shape : shapes) {
            faces.addAll(kernel.faces(shape));
        }
        return exportDxf(faces);
    }

    public ShapeNode classify(CadDocument doc) {
        return classifier.classify(doc);
    }

    private static String rootName(DxfDrawing drawing) {
        return "DXF Import (" + drawing.getRecognizedCount() + " entities)";
    }
}
