package com.questrail.facelink.sync;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link AudioSource} over HTTP GET.
 */
public final class HttpAudioSource implements AudioSource
{
    private final HttpClient http;
    private final Duration timeout;

    public HttpAudioSource(HttpClient http, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public HttpAudioSource(Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    @Override
    public byte[] fetch(URI audioUrl) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(Objects.requireNonNull(audioUrl, "audioUrl"))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + resp.statusCode() + " fetching " + audioUrl);
        }
        return resp.body();
    }
}
