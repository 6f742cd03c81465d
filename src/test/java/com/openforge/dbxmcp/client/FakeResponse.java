package com.openforge.dbxmcp.client;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Canned HTTP response for a mocked {@link HttpClient}. */
record FakeResponse(int statusCode, String body, Map<String, List<String>> headerMap) implements HttpResponse<String> {

    static CompletableFuture<HttpResponse<String>> completed(int status, String body) {
        return CompletableFuture.completedFuture(new FakeResponse(status, body, Map.of()));
    }

    static CompletableFuture<HttpResponse<String>> completed(int status, String body, String header, String value) {
        return CompletableFuture.completedFuture(new FakeResponse(status, body, Map.of(header, List.of(value))));
    }

    @Override
    public HttpRequest request() {
        return HttpRequest.newBuilder(uri()).build();
    }

    @Override
    public Optional<HttpResponse<String>> previousResponse() {
        return Optional.empty();
    }

    @Override
    public HttpHeaders headers() {
        return HttpHeaders.of(headerMap, (name, value) -> true);
    }

    @Override
    public Optional<SSLSession> sslSession() {
        return Optional.empty();
    }

    @Override
    public URI uri() {
        return URI.create("https://test-workspace.cloud.databricks.com/");
    }

    @Override
    public HttpClient.Version version() {
        return HttpClient.Version.HTTP_1_1;
    }
}
