package de.mirkosertic.docmirror.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Renders nodes through a remote export endpoint.
 * <p>
 * The URL template may contain the placeholders {@code {documentId}} and {@code {nodeId}},
 * e.g. {@code https://docs.example.com/document/d/{documentId}/export?format=pdf&tab={nodeId}}.
 * A non-blank token is sent as a bearer {@code Authorization} header.
 */
public class HttpExportRenderer implements Renderer {

    private static final Logger logger = LoggerFactory.getLogger(HttpExportRenderer.class);

    private final HttpClient httpClient;
    private final String urlTemplate;
    private final String authToken;
    private final Duration requestTimeout;

    public HttpExportRenderer(final String urlTemplate, final String authToken, final Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), urlTemplate, authToken, requestTimeout);
    }

    HttpExportRenderer(final HttpClient httpClient, final String urlTemplate, final String authToken,
                       final Duration requestTimeout) {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new IllegalArgumentException("An export URL template is required for the http renderer");
        }
        this.httpClient = httpClient;
        this.urlTemplate = urlTemplate;
        this.authToken = authToken == null ? "" : authToken.trim();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public RenderResponse render(final RenderRequest request) throws IOException {
        final URI uri = exportUri(request);
        final HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET();
        if (!authToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + authToken);
        }

        try {
            final HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            logger.debug("Export of node {} returned HTTP {}", request.nodeId(), response.statusCode());
            return new RenderResponse(response.statusCode(), response.body());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while exporting node " + request.nodeId(), e);
        }
    }

    URI exportUri(final RenderRequest request) {
        return URI.create(urlTemplate
                .replace("{documentId}", encode(request.documentId()))
                .replace("{nodeId}", encode(request.nodeId())));
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
