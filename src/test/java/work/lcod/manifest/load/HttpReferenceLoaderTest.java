package work.lcod.manifest.load;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.error.LoadException;
import work.lcod.manifest.error.MissingReferenceException;

class HttpReferenceLoaderTest {
    private HttpServer server;
    private String baseUrl;
    private final HttpReferenceLoader loader = new HttpReferenceLoader(Duration.ofSeconds(5));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ui/nav.yaml", exchange -> {
            byte[] body = "metadata: {title: Nav}\n".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.createContext("/ui/broken.yaml", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void downloadsManifestText() {
        assertEquals("metadata: {title: Nav}\n", loader.load(baseUrl + "/ui/nav.yaml").join());
    }

    @Test
    void notFoundIsMissingReference() {
        var thrown = assertThrows(CompletionException.class, () -> loader.load(baseUrl + "/ui/none.yaml").join());

        assertInstanceOf(MissingReferenceException.class, thrown.getCause());
    }

    @Test
    void serverErrorIsLoadFailure() {
        var thrown = assertThrows(CompletionException.class, () -> loader.load(baseUrl + "/ui/broken.yaml").join());

        var failure = assertInstanceOf(LoadException.class, thrown.getCause());
        assertTrue(failure.getMessage().contains("500"));
    }
}
