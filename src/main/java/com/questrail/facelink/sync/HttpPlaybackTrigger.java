package com.questrail.facelink.sync;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link PlaybackTrigger} that POSTs {@code {"url": ..., "format": ...}} to the speaker.
 */
public final class HttpPlaybackTrigger implements PlaybackTrigger
{
    private static final Gson GSON = new Gson();

    private final HttpClient http;
    private final Duration timeout;
    private final String format;

    public HttpPlaybackTrigger(HttpClient http, Duration timeout, String format) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.format = Objects.requireNonNull(format, "format");
    }

    public HttpPlaybackTrigger(Duration timeout, String format) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout, format);
    }

    static String requestBody(URI audioUrl, String format) {
        JsonObject body = new JsonObject();
        body.addProperty("url", audioUrl.toString());
        body.addProperty("format", format);
        return GSON.toJson(body);
    }

    @Override
    public void trigger(URI playEndpoint, URI audioUrl) throws IOException, InterruptedException {
        Objects.requireNonNull(playEndpoint, "playEndpoint");
        Objects.requireNonNull(audioUrl, "audioUrl");

        HttpRequest req = HttpRequest.newBuilder(playEndpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(audioUrl, format), StandardCharsets.UTF_8))
                .build();

        HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + resp.statusCode() + " from " + playEndpoint);
        }
    }
}
