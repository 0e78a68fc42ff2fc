package nl.bytesoflife.deltadxf.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import nl.bytesoflife.deltadxf.DxfConverter;
import nl.bytesoflife.deltadxf.lexer.DxfLexer;
import nl.bytesoflife.deltadxf.model.dxf.DxfDrawing;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Simple HTTP server for inspecting and normalizing DXF files.
 */
public class DxfViewerServer {

    private static final Logger log = LoggerFactory.getLogger(DxfViewerServer.class);

    private final int port;
    private final DxfConverter converter;
    private HttpServer server;

    public DxfViewerServer(int port) {
        this(port, new DxfConverter());
    }

    public DxfViewerServer(int port, DxfConverter converter) {
        this.port = port;
        this.converter = converter;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/", new StaticHandler());
        server.createContext("/api/import", new ImportHandler(converter));
        server.createContext("/api/normalize", new NormalizeHandler(converter));
        server.setExecutor(null);
        server.start();
        log.info("DXF Viewer Server started at http://localhost:{}", getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Serves the static HTML page.
     */
    static class StaticHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.equals("/") || path.equals("/index.html")) {
                sendResponse(exchange, 200, "text/html", getIndexHtml());
            } else {
                sendResponse(exchange, 404, "text/plain", "Not Found");
            }
        }
    }

    /**
     * Reads an uploaded DXF file and reports what was recognized.
     */
    static class ImportHandler implements HttpHandler {
        private static final Logger log = LoggerFactory.getLogger(ImportHandler.class);

        private final DxfConverter converter;

        ImportHandler(DxfConverter converter) {
            this.converter = converter;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }

            long startTime = System.currentTimeMillis();
            try {
                byte[] data = exchange.getRequestBody().readAllBytes();
                log.info("Received DXF file: {} bytes", data.length);

                DxfDrawing drawing = converter.read(data);
                String json = toJson(drawing);

                long elapsed = System.currentTimeMillis() - startTime;
                log.info("Import complete: {} recognized, {} unsupported, {} incomplete in {}ms",
                        drawing.getRecognizedCount(), drawing.getUnsupportedCount(),
                        drawing.getIncompleteCount(), elapsed);
                sendResponse(exchange, 200, "application/json", json);
            } catch (DxfLexer.MalformedGroupCodeException e) {
                log.warn("Rejected malformed DXF: {}", e.getMessage());
                sendResponse(exchange, 400, "application/json",
                        "{\"error\":" + escapeJson(e.getMessage()) + "}");
            } catch (Exception e) {
                log.error("Error importing file", e);
                sendResponse(exchange, 500, "application/json",
                        "{\"error\":" + escapeJson(e.getMessage()) + "}");
            }
        }

        static String toJson(DxfDrawing drawing) {
            StringBuilder json = new StringBuilder();
            json.append("{\"name\":").append(escapeJson(
                    "DXF Import (" + drawing.getRecognizedCount() + " entities)"));
            json.append(",\"recognized\":").append(drawing.getRecognizedCount());
            json.append(",\"unsupported\":").append(drawing.getUnsupportedCount());
            json.append(",\"incomplete\":").append(drawing.getIncompleteCount());
            json.append(",\"layers\":[");
            boolean first = true;
            for (String layer : drawing.getLayers()) {
                if (!first) json.append(",");
                first = false;
                json.append(escapeJson(layer));
            }
            json.append("],\"envelope\":");
            Envelope env = drawing.getEnvelope();
            if (env.isNull()) {
                json.append("null");
            } else {
                json.append("{\"minX\":").append(env.getMinX());
                json.append(",\"minY\":").append(env.getMinY());
                json.append(",\"maxX\":").append(env.getMaxX());
                json.append(",\"maxY\":").append(env.getMaxY());
                json.append("}");
            }
            json.append("}");
            return json.toString();
        }
    }

    /**
     * Re-exports an uploaded DXF file with only the geometry this library understands.
     */
    static class NormalizeHandler implements HttpHandler {
        private static final Logger log = LoggerFactory.getLogger(NormalizeHandler.class);

        private final DxfConverter converter;

        NormalizeHandler(DxfConverter converter) {
            this.converter = converter;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }

            try {
                byte[] data = exchange.getRequestBody().readAllBytes();
                DxfDrawing drawing = converter.read(data);
                String dxf = converter.exportDxf(drawing.getShapes());
                log.info("Normalized DXF: {} bytes in, {} shapes out", data.length, drawing.getShapes().size());
                sendResponse(exchange, 200, "application/dxf", dxf);
            } catch (DxfLexer.MalformedGroupCodeException e) {
                log.warn("Rejected malformed DXF: {}", e.getMessage());
                sendResponse(exchange, 400, "application/json",
                        "{\"error\":" + escapeJson(e.getMessage()) + "}");
            } catch (Exception e) {
                log.error("Error normalizing file", e);
                sendResponse(exchange, 500, "application/json",
                        "{\"error\":" + escapeJson(e.getMessage()) + "}");
            }
        }
    }

    private static void sendResponse(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType + "; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String escapeJson(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append("\"");
        return sb.toString();
    }

    private static String getIndexHtml() {
        return """
<!DOCTYPE html>
<html lang="en">
<head>
    <meta charset="UTF-8">
    <title>DXF Viewer</title>
    <style>
        body { font-family: -apple-system, 'Segoe UI', Roboto, sans-serif; background: #1a1a2e; color: #eee; margin: 0; }
        header { background: #16213e; padding: 12px 20px; border-bottom: 1px solid #0f3460; }
        header h1 { font-size: 1.3rem; font-weight: 500; color: #e94560; margin: 0; }
        main { padding: 20px; }
        pre { background: #0f3460; padding: 12px; border-radius: 4px; white-space: pre-wrap; }
        button { margin-left: 8px; }
    </style>
</head>
<body>
    <header><h1>DXF Viewer</h1></header>
    <main>
        <input type="file" id="file" accept=".dxf">
        <button id="import">Import</button>
        <button id="normalize">Normalize</button>
        <pre id="output"></pre>
    </main>
    <script>
        const output = document.getElementById('output');

        async function post(url) {
            const file = document.getElementById('file').files[0];
            if (!file) { output.textContent = 'Choose a DXF file first.'; return null; }
            const response = await fetch(url, { method: 'POST', body: await file.arrayBuffer() });
            return response;
        }

        document.getElementById('import').onclick = async () => {
            const response = await post('/api/import');
            if (response) output.textContent = JSON.stringify(await response.json(), null, 2);
        };

        document.getElementById('normalize').onclick = async () => {
            const response = await post('/api/normalize');
            if (!response) return;
            if (!response.ok) { output.textContent = await response.text(); return; }
            const blob = new Blob([await response.text()], { type: 'application/dxf' });
            const link = document.createElement('a');
            link.href = URL.createObjectURL(blob);
            link.download = 'normalized.dxf';
            link.click();
            output.textContent = 'Downloaded normalized.dxf';
        };
    </script>
</body>
</html>
""";
    }

    public static void main(String[] args) throws IOException {
        int port = 8080;
        if (args.length > 0) {
            port = Integer.parseInt(args[0]);
        }

        DxfViewerServer server = new DxfViewerServer(port);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
