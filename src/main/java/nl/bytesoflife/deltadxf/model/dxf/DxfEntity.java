package nl.bytesoflife.deltadxf.model.dxf;

import nl.bytesoflife.deltadxf.lexer.GroupCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One record of a DXF stream, opened by a code-0 token.
 * <p>
 * Fields are kept as the ordered list of (code, value) pairs so that repeated codes,
 * such as the vertex coordinates of an LWPOLYLINE, survive. {@link #getValue(int)} gives
 * the last value for a code, {@link #getValues(int)} gives all of them.
 */
public class DxfEntity {

    public static final String DEFAULT_LAYER = "0";

    private final String type;
    private final String section;
    private final List<GroupCode> fields = new ArrayList<>();
    private final List<DxfEntity> vertices = new ArrayList<>();
    private String layer = DEFAULT_LAYER;
    private String color;

    public DxfEntity(String type) {
        this(type, null);
    }

    public DxfEntity(String type, String section) {
        this.type = type;
        this.section = section;
    }

    public String getType() {
        return type;
    }

    /**
     * Name of the enclosing DXF section, or null outside any section.
     */
    public String getSection() {
        return section;
    }

    public void addField(GroupCode field) {
        fields.add(field);
    }

    public List<GroupCode> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public String getValue(int code) {
        for (int i = fields.size() - 1; i >= 0; i--) {
            if (fields.get(i).code() == code) {
                return fields.get(i).value();
            }
        }
        return null;
    }

    public List<String> getValues(int code) {
        List<String> values = new ArrayList<>();
        for (GroupCode field : fields) {
            if (field.code() == code) {
                values.add(field.value());
            }
        }
        return values;
    }

    /**
     * Integer value of {@code code}, or {@code defaultValue} when absent or not an integer.
     */
    public int getInt(int code, int defaultValue) {
        String value = getValue(code);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public String getLayer() {
        return layer;
    }

    public void setLayer(String layer) {
        this.layer = layer;
    }

    /**
     * Raw code-62 color index text, or null when the record carries none.
     */
    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    /**
     * VERTEX records linked to this POLYLINE.
     */
    public List<DxfEntity> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public void addVertex(DxfEntity vertex) {
        vertices.add(vertex);
    }

    @Override
    public String toString() {
        return "DxfEntity{type='" + type + "', layer='" + layer + "', fields=" + fields.size() +
                (color != null ? ", color=" + color : "") +
                (!vertices.isEmpty() ? ", vertices=" + vertices.size() : "") + "}";
    }
}
