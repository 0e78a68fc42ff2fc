package nl.bytesoflife.deltadxf.lexer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer for ASCII DXF files.
 * Turns the line-paired text into (group code, value) tokens in file order.
 */
public class DxfLexer {

    public List<GroupCode> tokenize(String content) {
        List<GroupCode> tokens = new ArrayList<>();
        Iterator<GroupCode> it = iterate(content);
        while (it.hasNext()) {
            tokens.add(it.next());
        }
        return tokens;
    }

    /**
     * Lazily tokenize {@code content}. A malformed code line is reported when the
     * iterator reaches it.
     */
    public Iterator<GroupCode> iterate(String content) {
        return new GroupCodeIterator(content);
    }

    /**
     * True if the trimmed line starts with a digit, or a minus sign followed by a digit.
     */
    static boolean isCodeLine(String line) {
        char c = line.charAt(0);
        if (Character.isDigit(c)) return true;
        return c == '-' && line.length() > 1 && Character.isDigit(line.charAt(1));
    }

    /**
     * Strip spaces, tabs, carriage returns and line feeds from both ends.
     */
    static String trim(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isBlank(line.charAt(start))) start++;
        while (end > start && isBlank(line.charAt(end - 1))) end--;
        return line.substring(start, end);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static class GroupCodeIterator implements Iterator<GroupCode> {

        private final BufferedReader reader;
        private int lineNum = 0;
        private GroupCode next;
        private boolean done;

        GroupCodeIterator(String content) {
            this.reader = new BufferedReader(new StringReader(content));
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = advance();
                done = next == null;
            }
            return next != null;
        }

        @Override
        public GroupCode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GroupCode token = next;
            next = null;
            return token;
        }

        private GroupCode advance() {
            String line;
            while ((line = nextNonBlankLine()) != null) {
                // Lines in code position that are not codes are skipped
                if (!isCodeLine(line)) continue;

                int codeLine = lineNum;
                int code;
                try {
                    code = Integer.parseInt(line);
                } catch (NumberFormatException e) {
                    throw new MalformedGroupCodeException("Malformed group code '" + line + "'", codeLine);
                }

                String value = nextNonBlankLine();
                if (value == null) {
                    // Dangling code at end of stream
                    return null;
                }
                return new GroupCode(code, value, codeLine);
            }
            return null;
        }

        private String nextNonBlankLine() {
            try {
                String raw;
                while ((raw = reader.readLine()) != null) {
                    lineNum++;
                    String line = trim(raw);
                    if (!line.isEmpty()) {
                        return line;
                    }
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    public static class MalformedGroupCodeException extends RuntimeException {
        private final int line;

        public MalformedGroupCodeException(String message, int line) {
            super(message + " at line " + line);
            this.line = line;
        }

        public int getLine() {
            return line;
        }
    }
}
