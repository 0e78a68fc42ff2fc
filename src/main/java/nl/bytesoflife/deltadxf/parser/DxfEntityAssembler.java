package nl.bytesoflife.deltadxf.parser;

import nl.bytesoflife.deltadxf.lexer.GroupCode;
import nl.bytesoflife.deltadxf.model.dxf.DxfEntity;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Groups group-code tokens into records bounded by code-0 markers.
 * <p>
 * Code 0 closes the open record and opens a new one whose type is the token's value.
 * Code 8 updates the ambient layer, which a record receives when it is closed; code 62
 * sets the open record's color. Tokens before the first code 0 are ignored.
 */
public class DxfEntityAssembler {

    public static final int CODE_ENTITY = 0;
    public static final int CODE_NAME = 2;
    public static final int CODE_LAYER = 8;
    public static final int CODE_COLOR = 62;

    public List<DxfEntity> assemble(Iterator<GroupCode> tokens) {
        Context context = new Context();
        while (tokens.hasNext()) {
            GroupCode token = tokens.next();
            if (token.code() == CODE_ENTITY) {
                context.close();
                context.open(token.value());
            } else if (context.current != null) {
                context.current.addField(token);
                if (token.code() == CODE_LAYER) {
                    context.layer = token.value();
                } else if (token.code() == CODE_COLOR) {
                    context.current.setColor(token.value());
                }
            }
        }
        context.close();
        return context.entities;
    }

    public List<DxfEntity> assemble(List<GroupCode> tokens) {
        return assemble(tokens.iterator());
    }

    /**
     * Link the VERTEX records that follow a POLYLINE to it, up to the next non-VERTEX record.
     * The record list itself is left unchanged.
     */
    public void linkVertices(List<DxfEntity> entities) {
        DxfEntity polyline = null;
        for (DxfEntity entity : entities) {
            switch (entity.getType()) {
                case "POLYLINE" -> polyline = entity;
                case "VERTEX" -> {
                    if (polyline != null) {
                        polyline.addVertex(entity);
                    }
                }
                default -> polyline = null;
            }
        }
    }

    /**
     * Mutable state of one assembly run.
     */
    private static class Context {
        final List<DxfEntity> entities = new ArrayList<>();
        DxfEntity current;
        String layer = DxfEntity.DEFAULT_LAYER;
        String section;

        void open(String type) {
            current = new DxfEntity(type, section);
        }

        void close() {
            if (current == null) return;
            current.setLayer(layer);
            entities.add(current);
            if ("SECTION".equals(current.getType())) {
                section = current.getValue(CODE_NAME);
            } else if ("ENDSEC".equals(current.getType())) {
                section = null;
            }
            current = null;
        }
    }
}
