package com.questrail.facelink.protocol.codec;

import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;
import com.questrail.facelink.protocol.model.LinkMessage;
import com.questrail.facelink.protocol.model.MalformedLine;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonLineCodecTest {

    private final JsonLineCodec codec = new JsonLineCodec();

    @Test
    void encodesCompactJsonTerminatedByNewline() {
        DeviceCommand cmd = DeviceCommand.builder("clear").put("color", "#FF0000").build();

        String wire = new String(codec.encode(cmd), StandardCharsets.UTF_8);

        assertEquals("{\"cmd\":\"clear\",\"color\":\"#FF0000\"}\n", wire);
    }

    @Test
    void encodeDoesNotHtmlEscape() {
        DeviceCommand cmd = DeviceCommand.builder("melody").put("notes", "C4<4 & D4=4").build();

        String wire = new String(codec.encode(cmd), StandardCharsets.UTF_8);

        assertTrue(wire.contains("C4<4 & D4=4"), wire);
    }

    @Test
    void statusLineIsResponse() {
        LinkMessage m = codec.classify("{\"status\":\"error\",\"msg\":\"bad len 0\"}");

        DeviceResponse r = assertInstanceOf(DeviceResponse.class, m);
        assertEquals("error", r.status());
        assertEquals("bad len 0", r.stringField("msg").orElseThrow());
    }

    @Test
    void eventLineIsEvent() {
        LinkMessage m = codec.classify("{\"event\":\"touch\",\"x\":200,\"y\":420}");

        DeviceEvent e = assertInstanceOf(DeviceEvent.class, m);
        assertTrue(e.is(DeviceEvent.TOUCH));
        assertEquals(200, e.intField("x").getAsInt());
        assertEquals(420, e.intField("y").getAsInt());
    }

    @Test
    void eventKeyWinsOverStatusKey() {
        LinkMessage m = codec.classify("{\"status\":\"ok\",\"event\":\"button\"}");

        assertInstanceOf(DeviceEvent.class, m);
    }

    @Test
    void nonJsonIsMalformed() {
        assertInstanceOf(MalformedLine.class, codec.classify("ESP-ROM:esp32s3-20210327"));
        assertInstanceOf(MalformedLine.class, codec.classify("{\"status\":"));
    }

    @Test
    void jsonThatIsNotAnObjectIsMalformed() {
        assertInstanceOf(MalformedLine.class, codec.classify("[1,2,3]"));
        assertInstanceOf(MalformedLine.class, codec.classify("42"));
    }

    @Test
    void objectWithoutRoleKeyIsMalformed() {
        MalformedLine m = assertInstanceOf(MalformedLine.class, codec.classify("{\"cmd\":\"blink\"}"));
        assertEquals("{\"cmd\":\"blink\"}", m.text());
    }
}
