package nl.bytesoflife.deltadxf.lexer;

/**
 * One DXF (group code, value) pair. {@code line} is the 1-based line of the code.
 */
public record GroupCode(int code, String value, int line) {

    public GroupCode(int code, String value) {
        this(code, value, 0);
    }

    @Override
    public String toString() {
        return code + "=" + value;
    }
}
