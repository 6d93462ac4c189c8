package edu.brandeis.cosi103a.league.network;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Thin seam over {@link HttpClient} so peers can be faked in tests.
 */
public interface HttpClientWrapper {

    HttpResponse<String> send(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler)
        throws IOException, InterruptedException;

    CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler);

    /**
     * Delegates to a shared JDK {@link HttpClient}.
     */
    class Default implements HttpClientWrapper {
        private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

        private final HttpClient httpClient;

        public Default() {
            this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        }

        @Override
        public HttpResponse<String> send(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler)
                throws IOException, InterruptedException {
            return httpClient.send(request, bodyHandler);
        }

        @Override
        public CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request,
                                                                 HttpResponse.BodyHandler<String> bodyHandler) {
            return httpClient.sendAsync(request, bodyHandler);
        }
    }
}
