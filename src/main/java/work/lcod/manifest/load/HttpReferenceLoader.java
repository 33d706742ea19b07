package work.lcod.manifest.load;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import work.lcod.manifest.error.LoadException;
import work.lcod.manifest.error.MissingReferenceException;

/**
 * Downloads remote manifests with the JDK {@link HttpClient}.
 */
public final class HttpReferenceLoader implements ReferenceLoader {
    private final HttpClient client;
    private final Duration timeout;

    public HttpReferenceLoader(Duration timeout) {
        this(
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(),
            timeout
        );
    }

    public HttpReferenceLoader(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public CompletableFuture<String> load(String locator) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(locator)).timeout(timeout).GET().build();
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(new LoadException(locator, "Invalid manifest URL: " + locator, ex));
        }
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    throw new CompletionException(new LoadException(locator, "Failed to download manifest: " + locator, cause));
                }
                int status = response.statusCode();
                if (status == 404) {
                    throw new CompletionException(new MissingReferenceException(locator, "Manifest not found: " + locator));
                }
                if (status >= 400) {
                    throw new CompletionException(
                        new LoadException(locator, "HTTP " + status + " while downloading manifest: " + locator)
                    );
                }
                return response.body();
            });
    }
}
