package nl.bytesoflife.deltadxf.scene;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Color text normalization. All colors leave this class as upper-case {@code #RRGGBB}.
 */
public final class HexColor {

    private static final Pattern HEX = Pattern.compile("#?([0-9a-fA-F]{6})");

    // AutoCAD Color Index, standard colors
    private static final Map<Integer, String> ACI = Map.of(
            1, "#FF0000",
            2, "#FFFF00",
            3, "#00FF00",
            4, "#00FFFF",
            5, "#0000FF",
            6, "#FF00FF",
            7, "#FFFFFF",
            8, "#808080",
            9, "#C0C0C0");

    private HexColor() {
    }

    /**
     * {@code #RRGGBB} or {@code RRGGBB}, any case, to {@code #RRGGBB}; null for anything else.
     */
    public static String normalize(String color) {
        if (color == null) return null;
        var matcher = HEX.matcher(color.trim());
        if (!matcher.matches()) return null;
        return "#" + matcher.group(1).toUpperCase(Locale.ROOT);
    }

    /**
     * DXF code-62 color index to hex. Only indices 1..9 have a fixed color; BYBLOCK (0),
     * BYLAYER (256), negative (layer off) and other indices give null.
     */
    public static String fromAci(String index) {
        if (index == null) return null;
        try {
            return ACI.get(Integer.parseInt(index.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
