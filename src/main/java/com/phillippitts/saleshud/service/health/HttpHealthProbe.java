package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Probes a dependency by issuing an authenticated GET and expecting a 2xx response.
 */
public final class HttpHealthProbe implements HealthProbe {

    private final HttpClient client;
    private final Dependency dependency;
    private final URI uri;
    private final Map<String, String> headers;
    private final Duration timeout;

    public HttpHealthProbe(HttpClient client, Dependency dependency, URI uri, Map<String, String> headers,
                           Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.dependency = Objects.requireNonNull(dependency, "dependency");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Map.copyOf(headers);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void probe() throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout).GET();
        headers.forEach(builder::header);
        HttpResponse<Void> response = client.send(builder.build(), HttpResponse.BodyHandlers.discarding());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw ServiceExceptionBuilder.create("Health probe rejected", ErrorKind.NETWORK_ERROR)
                    .dependency(dependency)
                    .metadata("status", status)
                    .build();
        }
    }
}
