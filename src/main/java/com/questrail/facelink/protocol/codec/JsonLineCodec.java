package com.questrail.facelink.protocol.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;
import com.questrail.facelink.protocol.model.LinkMessage;
import com.questrail.facelink.protocol.model.MalformedLine;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JsonLineCodec
 * -----------------------------------------------------------------------------
 * Encodes commands to wire lines and classifies inbound lines.
 *
 * <h2>Outbound</h2>
 * One compact JSON object followed by {@code '\n'}, UTF-8.
 *
 * <h2>Inbound</h2>
 * {@link #classify(String)} decides the {@link LinkMessage} variant once:
 * {@code event} key first, then {@code status}, otherwise malformed. It never
 * throws; anything that is not protocol traffic becomes a {@link MalformedLine}.
 */
public final class JsonLineCodec
{
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private static final byte NEWLINE = '\n';

    public byte[] encode(DeviceCommand command) {
        Objects.requireNonNull(command, "command");
        byte[] json = GSON.toJson(command.body()).getBytes(StandardCharsets.UTF_8);
        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = NEWLINE;
        return line;
    }

    public LinkMessage classify(String line) {
        Objects.requireNonNull(line, "line");

        final JsonElement parsed;
        try {
            parsed = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            return new MalformedLine(line, "not JSON");
        }

        if (parsed == null || !parsed.isJsonObject()) {
            return new MalformedLine(line, "not a JSON object");
        }

        JsonObject obj = parsed.getAsJsonObject();
        if (obj.has("event")) {
            return new DeviceEvent(text(obj.get("event")), obj);
        }
        if (obj.has("status")) {
            return new DeviceResponse(text(obj.get("status")), obj);
        }
        return new MalformedLine(line, "neither 'event' nor 'status' present");
    }

    private static String text(JsonElement e) {
        if (e.isJsonPrimitive()) {
            return e.getAsString();
        }
        return e.toString();
    }
}
