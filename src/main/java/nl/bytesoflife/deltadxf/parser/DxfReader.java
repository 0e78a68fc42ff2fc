package nl.bytesoflife.deltadxf.parser;

import nl.bytesoflife.deltadxf.geometry.GeometryKernel;
import nl.bytesoflife.deltadxf.geometry.ShapeFactory;
import nl.bytesoflife.deltadxf.geometry.ShapeGeometryConverter;
import nl.bytesoflife.deltadxf.lexer.DxfLexer;
import nl.bytesoflife.deltadxf.model.dxf.DxfDrawing;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;
import nl.bytesoflife.deltadxf.model.dxf.EntityType;
import nl.bytesoflife.deltadxf.model.shape.Shape;
import nl.bytesoflife.deltadxf.parser.builder.EntityGeometryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads ASCII DXF into a {@link DxfDrawing}: tokenize, assemble records, build geometry.
 * <p>
 * Only a malformed group code aborts a read
 * ({@link DxfLexer.MalformedGroupCodeException}); records that cannot be built are
 * counted and skipped.
 */
public class DxfReader {

    private static final Logger log = LoggerFactory.getLogger(DxfReader.class);

    private final GeometryKernel kernel;
    private final DxfLexer lexer = new DxfLexer();
    private final DxfEntityAssembler assembler = new DxfEntityAssembler();
    private final EntityGeometryBuilder geometryBuilder;
    private final ShapeGeometryConverter geometryConverter = new ShapeGeometryConverter();
    private Charset charset = StandardCharsets.UTF_8;

    public DxfReader() {
        this(new ShapeFactory());
    }

    public DxfReader(GeometryKernel kernel) {
        this(kernel, EntityGeometryBuilder.withDefaults(kernel));
    }

    public DxfReader(GeometryKernel kernel, EntityGeometryBuilder geometryBuilder) {
        this.kernel = kernel;
        this.geometryBuilder = geometryBuilder;
    }

    /**
     * Charset used to decode byte input. Defaults to UTF-8.
     */
    public DxfReader withCharset(Charset charset) {
        this.charset = charset;
        return this;
    }

    public DxfDrawing read(byte[] content) {
        return read(new String(content, charset));
    }

    public DxfDrawing read(String content) {
        List<DxfEntity> entities = assembler.assemble(lexer.iterate(content));
        assembler.linkVertices(entities);

        DxfDrawing drawing = new DxfDrawing(entities);
        for (DxfEntity entity : entities) {
            if ("TABLES".equals(entity.getSection())) {
                collectLayerTableEntry(entity, drawing);
                continue;
            }
            if (EntityType.fromDxfName(entity.getType()) == null) {
                if (countsAsUnsupported(entity)) {
                    drawing.incrementUnsupported();
                }
                continue;
            }

            drawing.addLayer(entity.getLayer());
            Shape shape = geometryBuilder.build(entity);
            if (shape != null) {
                drawing.addBuilt(entity, shape);
            } else {
                drawing.incrementIncomplete();
            }
        }

        drawing.setCompound(kernel.makeCompound(drawing.getShapes()));
        drawing.setEnvelope(geometryConverter.envelope(drawing.getShapes()));

        log.debug("Read {} records: {} recognized, {} unsupported, {} incomplete",
                entities.size(), drawing.getRecognizedCount(),
                drawing.getUnsupportedCount(), drawing.getIncompleteCount());
        return drawing;
    }

    // Modeled geometry is built in any section; only drawable sections count unknown types
    private static boolean countsAsUnsupported(DxfEntity entity) {
        if (EntityType.isMarker(entity.getType())) return false;
        String section = entity.getSection();
        return section == null || "ENTITIES".equals(section) || "BLOCKS".equals(section);
    }

    private static void collectLayerTableEntry(DxfEntity entity, DxfDrawing drawing) {
        if (!"LAYER".equals(entity.getType())) return;
        String name = entity.getValue(DxfEntityAssembler.CODE_NAME);
        if (name == null) return;
        drawing.addLayer(name);
        String color = entity.getValue(DxfEntityAssembler.CODE_COLOR);
        if (color != null) {
            drawing.setLayerColor(name, color);
        }
    }
}
