package com.questrail.facelink.sync;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP audio source and playback trigger against a loopback server.
 */
class HttpCollaboratorsTest {

    private HttpServer server;
    private final AtomicReference<String> postedBody = new AtomicReference<>();
    private final AtomicReference<String> postedType = new AtomicReference<>();
    private final byte[] clip = new byte[2048];

    @BeforeEach
    void setUp() throws IOException {
        for (int i = 0; i < clip.length; i++) {
            clip[i] = (byte) i;
        }
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/audio/reply.mp3", exchange -> {
            exchange.sendResponseHeaders(200, clip.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(clip);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.createContext("/play", exchange -> {
            postedType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            postedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    @Test
    void audioSourceDownloadsBody() throws Exception {
        byte[] got = new HttpAudioSource(Duration.ofSeconds(5)).fetch(uri("/audio/reply.mp3"));

        assertArrayEquals(clip, got);
    }

    @Test
    void audioSourceRejectsHttpErrors() {
        assertThrows(IOException.class, () -> new HttpAudioSource(Duration.ofSeconds(5)).fetch(uri("/missing")));
    }

    @Test
    void playbackTriggerPostsUrlAndFormat() throws Exception {
        URI audio = uri("/audio/reply.mp3");

        new HttpPlaybackTrigger(Duration.ofSeconds(5), "mp3").trigger(uri("/play"), audio);

        JsonObject body = JsonParser.parseString(postedBody.get()).getAsJsonObject();
        assertEquals(audio.toString(), body.get("url").getAsString());
        assertEquals("mp3", body.get("format").getAsString());
        assertEquals("application/json", postedType.get());
    }

    @Test
    void playbackTriggerRejectsHttpErrors() {
        assertThrows(IOException.class, () ->
            new HttpPlaybackTrigger(Duration.ofSeconds(5), "mp3").trigger(uri("/missing"), uri("/a.mp3")));
    }

    @Test
    void requestBodyIsCompactJson() {
        assertEquals("{\"url\":\"http://h/a.mp3\",\"format\":\"mp3\"}",
            HttpPlaybackTrigger.requestBody(URI.create("http://h/a.mp3"), "mp3"));
    }
}
