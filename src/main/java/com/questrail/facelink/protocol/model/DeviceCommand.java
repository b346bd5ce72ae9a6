package com.questrail.facelink.protocol.model;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * DeviceCommand
 * -----------------------------------------------------------------------------
 * Immutable command object sent by the controller: {@code {"cmd":name, ...fields}}.
 *
 * <p>The link layer treats commands opaquely. Apart from {@code image}, whose
 * {@code len} field drives the binary transfer, it never interprets fields.</p>
 */
public final class DeviceCommand
{
    public static final String IMAGE = "image";
    public static final String MOUTH = "mouth";

    private final String name;
    private final JsonObject body;

    private DeviceCommand(String name, JsonObject body) {
        this.name = name;
        this.body = body;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static DeviceCommand of(String name) {
        return builder(name).build();
    }

    /**
     * Header of the binary image transfer.
     */
    public static DeviceCommand image(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        return builder(IMAGE).put("len", length).build();
    }

    /**
     * Mouth openness frame, rounded to two decimals as the firmware expects.
     */
    public static DeviceCommand mouth(double openness) {
        double rounded = Math.round(openness * 100.0) / 100.0;
        return builder(MOUTH).put("open", rounded).build();
    }

    public String name() {
        return name;
    }

    /**
     * Full wire object, including the {@code cmd} key.
     */
    public JsonObject body() {
        return body.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceCommand other)) return false;
        return body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public String toString() {
        return body.toString();
    }

    public static final class Builder {
        private final String name;
        private final JsonObject body = new JsonObject();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("command name must not be blank");
            }
            body.addProperty("cmd", name);
        }

        public Builder put(String key, Number value) {
            body.addProperty(checkKey(key), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, String value) {
            body.addProperty(checkKey(key), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, boolean value) {
            body.addProperty(checkKey(key), value);
            return this;
        }

        public DeviceCommand build() {
            return new DeviceCommand(name, body.deepCopy());
        }

        private static String checkKey(String key) {
            Objects.requireNonNull(key, "key");
            if ("cmd".equals(key)) {
                throw new IllegalArgumentException("'cmd' is set from the command name");
            }
            return key;
        }
    }
}
