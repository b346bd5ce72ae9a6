package com.questrail.facelink.protocol.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Unsolicited notification produced by the device ({@code {"event":"touch","x":..,"y":..}}).
 *
 * <p>Known event names are {@code touch}, {@code button}, {@code button_down}
 * and {@code button_up}; unknown names are carried through unchanged.</p>
 */
public record DeviceEvent(String name, JsonObject body) implements LinkMessage
{
    public static final String TOUCH = "touch";
    public static final String BUTTON = "button";
    public static final String BUTTON_DOWN = "button_down";
    public static final String BUTTON_UP = "button_up";

    public DeviceEvent {
        Objects.requireNonNull(name, "name");
        body = Objects.requireNonNull(body, "body").deepCopy();
    }

    @Override
    public JsonObject body() {
        return body.deepCopy();
    }

    public boolean is(String eventName) {
        return name.equals(eventName);
    }

    /**
     * Integer field of the event body, if present and numeric.
     */
    public OptionalInt intField(String key) {
        JsonElement e = body.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(e.getAsInt());
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
