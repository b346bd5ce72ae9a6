package com.questrail.facelink.runtime;

import com.questrail.facelink.animation.AnimationHandle;
import com.questrail.facelink.animation.AnimationResult;
import com.questrail.facelink.audio.PcmAudio;
import com.questrail.facelink.observability.LinkErrorEvent;
import com.questrail.facelink.observability.LinkProtocolEvent;
import com.questrail.facelink.observability.RecordingObservabilitySink;
import com.questrail.facelink.protocol.model.DeviceResponse;
import com.questrail.facelink.session.LinkTimingPolicy;
import com.questrail.facelink.sync.MouthSyncConfig;
import com.questrail.facelink.transport.DeviceEndpoint;
import com.questrail.facelink.transport.ScriptedTransport;
import com.questrail.facelink.transport.TransportClosedException;
import com.questrail.facelink.transport.tcp.netty.LoopbackDisplayServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runtime tests over a loopback socket display.
 */
class FaceLinkRuntimeTest {

    private LoopbackDisplayServer server;
    private FaceLinkRuntime runtime;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() throws Exception {
        server = new LoopbackDisplayServer();
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (runtime != null) {
            runtime.stop();
        }
        server.close();
    }

    private static PcmAudio shortTone() {
        float[] s = new float[2400];
        for (int i = 0; i < s.length; i++) {
            s[i] = (float) (0.6 * Math.sin(2 * Math.PI * 300 * i / 8000.0));
        }
        return new PcmAudio(s, 8000f);
    }

    private FaceLinkRuntime.Builder socketRuntime(List<URI[]> triggers) {
        FaceLinkRuntimeConfig config = FaceLinkRuntimeConfig.builder()
            .withHost(server.host())
            .withMouthSyncConfig(MouthSyncConfig.defaults().withBufferDelay(Duration.ZERO))
            .withPlayEndpoint(URI.create("http://speaker.local/play"))
            .build();
        return FaceLinkRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(sink)
            .withAudioSource(url -> new byte[1024])
            .withPcmDecoder(bytes -> shortTone())
            .withPlaybackTrigger((endpoint, url) -> triggers.add(new URI[] {endpoint, url}));
    }

    @Test
    void socketStartupConsumesGreeting() {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();

        Optional<DeviceResponse> greeting = runtime.greeting();
        assertTrue(greeting.isPresent());
        assertEquals("connected", greeting.get().status());
        assertTrue(runtime.config().endpoint() instanceof DeviceEndpoint.Socket);
        assertTrue(runtime.link().describe().contains(String.valueOf(server.port())));
    }

    @Test
    void displayCommandsRoundTrip() {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();

        assertTrue(runtime.display().clear().isOk());
        assertTrue(runtime.display().faceOn().isOk());
        assertTrue(runtime.display().beep().isOk());

        assertEquals(List.of(
            "{\"cmd\":\"clear\",\"color\":\"#000000\"}",
            "{\"cmd\":\"face\",\"on\":true}",
            "{\"cmd\":\"tone\",\"freq\":1000,\"dur\":100}"
        ), server.lines());
    }

    @Test
    void jpegIsDeliveredVerbatim() {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();
        byte[] jpeg = new byte[30_000];
        for (int i = 0; i < jpeg.length; i++) {
            jpeg[i] = (byte) (i * 31);
        }
        jpeg[100] = '\n';

        assertTrue(runtime.display().showJpeg(jpeg).isOk());
        assertArrayEquals(jpeg, server.images().get(0));

        assertTrue(runtime.display().blink().isOk(), "link is back in line mode");
    }

    @Test
    void touchInsideButtonIsAPress() throws Exception {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();

        server.send("{\"event\":\"touch\",\"x\":10,\"y\":10}");
        server.send("{\"event\":\"touch\",\"x\":240,\"y\":430}");

        assertTrue(pollUntilPressed(false, 2_000));
    }

    @Test
    void touchOutsideButtonIsNotAPress() throws Exception {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();

        server.send("{\"event\":\"touch\",\"x\":10,\"y\":10}");
        Thread.sleep(100);

        assertFalse(runtime.pollButtonPress(false));
    }

    private boolean pollUntilPressed(boolean anywhere, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (runtime.pollButtonPress(anywhere)) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }

    @Test
    void mouthSyncAnimatesAndCloses() throws Exception {
        List<URI[]> triggers = new CopyOnWriteArrayList<>();
        runtime = socketRuntime(triggers).build();
        URI audio = URI.create("http://127.0.0.1:8000/audio/reply.mp3");

        Optional<AnimationHandle> handle = runtime.playWithMouthSync(audio);

        assertTrue(handle.isPresent());
        assertEquals(1, triggers.size());
        assertEquals(URI.create("http://speaker.local/play"), triggers.get(0)[0]);
        assertEquals(audio, triggers.get(0)[1]);

        Optional<AnimationResult> result = handle.get().await(Duration.ofSeconds(5));
        assertTrue(result.isPresent());
        assertFalse(result.get().cancelled());
        assertTrue(result.get().framesSent() > 0);

        assertTrue(server.awaitLine("{\"cmd\":\"mouth\",\"open\":0.0}"::equals, 2_000));
        List<String> lines = server.lines();
        assertEquals("{\"cmd\":\"mouth\",\"open\":0.0}", lines.get(lines.size() - 1));

        assertTrue(runtime.display().blink().isOk(), "commands still work after animation");
    }

    @Test
    void imageAfterMouthSyncedClipIsDelivered() throws Exception {
        runtime = socketRuntime(new CopyOnWriteArrayList<>()).build();

        AnimationHandle handle = runtime.playWithMouthSync(URI.create("http://127.0.0.1:8000/a.mp3")).orElseThrow();
        assertTrue(handle.await(Duration.ofSeconds(5)).isPresent());

        byte[] jpeg = new byte[4096];
        for (int i = 0; i < jpeg.length; i++) {
            jpeg[i] = (byte) (i * 7);
        }
        assertTrue(runtime.display().showJpeg(jpeg).isOk());
        assertEquals(1, server.images().size());
        assertArrayEquals(jpeg, server.images().get(0));

        assertTrue(runtime.display().blink().isOk());
        assertTrue(sink.hasEventOfType(LinkProtocolEvent.StaleResponseDropped.class));
    }

    @Test
    void serialStartupDrainsBootOutput() {
        ScriptedTransport transport = new ScriptedTransport()
            .inject("rst:0x1 (POWERON_RESET)\r\nboot ok\n");
        transport.replyOnWrite("{\"status\":\"ok\"}\n");

        FaceLinkRuntimeConfig config = FaceLinkRuntimeConfig.builder()
            .withEndpoint(new DeviceEndpoint.Serial("/dev/ttyACM0", DeviceEndpoint.DISPLAY_BAUD))
            .withTimingPolicy(LinkTimingPolicy.builder().bootDrainWait(Duration.ofMillis(10)).build())
            .build();
        runtime = FaceLinkRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(sink)
            .withTransport(transport)
            .build();

        assertTrue(runtime.greeting().isEmpty());
        assertTrue(sink.hasEventOfType(LinkProtocolEvent.BootOutputDiscarded.class));
        assertTrue(runtime.display().blink().isOk());
        assertEquals(List.of("{\"cmd\":\"blink\"}\n"), transport.writtenLines());
    }

    @Test
    void startupFailureIsReportedAndClosesTransport() {
        ScriptedTransport transport = new ScriptedTransport();
        transport.closeFromPeer();

        FaceLinkRuntimeConfig config = FaceLinkRuntimeConfig.builder()
            .withHost("127.0.0.1:" + server.port())
            .build();
        FaceLinkRuntime.Builder builder = FaceLinkRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(sink)
            .withTransport(transport);

        assertThrows(TransportClosedException.class, builder::build);
        assertTrue(sink.hasEventOfType(LinkErrorEvent.class));
        assertTrue(transport.isClosed());
    }
}
