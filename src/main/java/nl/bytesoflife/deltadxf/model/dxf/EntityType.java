package nl.bytesoflife.deltadxf.model.dxf;

import java.util.Set;

/**
 * Entity types that are converted into geometry.
 */
public enum EntityType {
    LINE("LINE"),
    CIRCLE("CIRCLE"),
    ARC("ARC"),
    POLYLINE("POLYLINE"),
    LWPOLYLINE("LWPOLYLINE"),
    FACE_3D("3DFACE");

    /**
     * Structural record types; never counted as unsupported entities.
     */
    public static final Set<String> MARKERS = Set.of(
        "SECTION", "ENDSEC", "TABLE", "ENDTAB", "BLOCK", "ENDBLK", "SEQEND", "VERTEX", "EOF");

    private final String dxfName;

    EntityType(String dxfName) {
        this.dxfName = dxfName;
    }

    public String getDxfName() {
        return dxfName;
    }

    /**
     * Look up a modeled type by its DXF name; null for anything else.
     */
    public static EntityType fromDxfName(String name) {
        if (name == null) return null;
        return switch (name) {
            case "LINE" -> LINE;
            case "CIRCLE" -> CIRCLE;
            case "ARC" -> ARC;
            case "POLYLINE" -> POLYLINE;
            case "LWPOLYLINE" -> LWPOLYLINE;
            case "3DFACE" -> FACE_3D;
            default -> null;
        };
    }

    public static boolean isMarker(String name) {
        return MARKERS.contains(name);
    }
}
