package com.questrail.facelink.protocol.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;
import java.util.Optional;

/**
 * DeviceResponse
 * -----------------------------------------------------------------------------
 * Reply to the most recently sent command ({@code {"status":"ok"}}).
 *
 * <p>The protocol carries no request identifiers, so a response is only
 * meaningful to the single command that was outstanding when it arrived.</p>
 *
 * <p>{@link #timeout()} is a locally produced sentinel: it never comes from the
 * wire and is returned when no response arrived before the caller's deadline.</p>
 */
public record DeviceResponse(String status, JsonObject body) implements LinkMessage
{
    public static final String OK = "ok";
    public static final String READY = "ready";
    public static final String ERROR = "error";
    public static final String TIMEOUT = "timeout";
    public static final String CONNECTED = "connected";

    public DeviceResponse {
        Objects.requireNonNull(status, "status");
        body = Objects.requireNonNull(body, "body").deepCopy();
    }

    public static DeviceResponse of(String status) {
        JsonObject body = new JsonObject();
        body.addProperty("status", status);
        return new DeviceResponse(status, body);
    }

    public static DeviceResponse timeout() {
        return of(TIMEOUT);
    }

    @Override
    public JsonObject body() {
        return body.deepCopy();
    }

    public boolean isOk() {
        return OK.equals(status);
    }

    public boolean isReady() {
        return READY.equals(status);
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(status);
    }

    /**
     * String field of the response body, e.g. the {@code msg} of an error.
     */
    public Optional<String> stringField(String key) {
        JsonElement e = body.get(key);
        if (e == null || !e.isJsonPrimitive()) {
            return Optional.empty();
        }
        return Optional.of(e.getAsString());
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
