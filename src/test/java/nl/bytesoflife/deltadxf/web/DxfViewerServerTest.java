package nl.bytesoflife.deltadxf.web;

import nl.bytesoflife.deltadxf.model.dxf.DxfDrawing;
import nl.bytesoflife.deltadxf.parser.DxfReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DxfViewerServerTest {

    private DxfViewerServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new DxfViewerServer(0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void servesIndexPage() throws IOException {
        HttpURLConnection conn = open("/", "GET");

        assertEquals(200, conn.getResponseCode());
        assertTrue(read(conn.getInputStream()).contains("DXF Viewer"));
    }

    @Test
    void unknownPathIsNotFound() throws IOException {
        assertEquals(404, open("/nope", "GET").getResponseCode());
    }

    @Test
    void importReportsCounts() throws IOException {
        HttpURLConnection conn = post("/api/import", sample());

        assertEquals(200, conn.getResponseCode());
        String json = read(conn.getInputStream());
        assertTrue(json.contains("\"name\":\"DXF Import (6 entities)\""), json);
        assertTrue(json.contains("\"recognized\":6"), json);
        assertTrue(json.contains("\"unsupported\":1"), json);
        assertTrue(json.contains("\"incomplete\":1"), json);
        assertTrue(json.contains("\"layers\":[\"0\",\"Outline\",\"Holes\",\"Faces\"]"), json);
        assertTrue(json.contains("\"maxX\":100.0"), json);
    }

    @Test
    void importNumbersIgnoreDefaultLocale() throws IOException {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            String json = read(post("/api/import", sample()).getInputStream());

            assertTrue(json.contains("\"maxX\":100.0"), json);
            assertFalse(json.contains("100,0"), json);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void importOfEmptyDrawingHasNoEnvelope() throws IOException {
        HttpURLConnection conn = post("/api/import", new byte[0]);

        assertEquals(200, conn.getResponseCode());
        assertTrue(read(conn.getInputStream()).contains("\"envelope\":null"));
    }

    @Test
    void malformedDxfIsBadRequest() throws IOException {
        HttpURLConnection conn = post("/api/import", "0\nLINE\n1x\n2\n".getBytes(StandardCharsets.US_ASCII));

        assertEquals(400, conn.getResponseCode());
        assertTrue(read(conn.getErrorStream()).contains("line 3"));
    }

    @Test
    void importRequiresPost() throws IOException {
        assertEquals(405, open("/api/import", "GET").getResponseCode());
    }

    @Test
    void normalizeReturnsReadableDxf() throws IOException {
        HttpURLConnection conn = post("/api/normalize", sample());

        assertEquals(200, conn.getResponseCode());
        DxfDrawing drawing = new DxfReader().read(conn.getInputStream().readAllBytes());
        assertTrue(drawing.getRecognizedCount() >= 6);
        assertEquals(0, drawing.getUnsupportedCount());
    }

    @Test
    void escapesJsonStrings() {
        assertEquals("\"a\\\"b\\\\c\\n\"", DxfViewerServer.escapeJson("a\"b\\c\n"));
        assertEquals("null", DxfViewerServer.escapeJson(null));
    }

    private HttpURLConnection open(String path, String method) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL("http://localhost:" + server.getPort() + path).openConnection();
        conn.setRequestMethod(method);
        return conn;
    }

    private HttpURLConnection post(String path, byte[] body) throws IOException {
        HttpURLConnection conn = open(path, "POST");
        conn.setDoOutput(true);
        try (OutputStream out = conn.getOutputStream()) {
            out.write(body);
        }
        return conn;
    }

    private byte[] sample() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/dxf/sample.dxf")) {
            assertNotNull(in);
            return in.readAllBytes();
        }
    }

    private static String read(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
