package dev.debugclient.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class StdioTransportTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readsFramedMessages() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{\"seq\":1,\"type\":\"event\",\"event\":\"initialized\"}");
        StdioTransport transport = new StdioTransport("test", new ByteArrayInputStream(out.toByteArray()), () -> true);

        assertThat(transport.messageExists(0)).isTrue();
        JsonNode message = transport.readMessage();

        assertThat(message.path("event").asText()).isEqualTo("initialized");
    }

    @Test
    void pollTimesOutWhileAdapterIsSilent() throws IOException {
        try (PipedOutputStream adapterOut = new PipedOutputStream();
             InputStream in = new PipedInputStream(adapterOut)) {
            StdioTransport transport = new StdioTransport("test", in, () -> true);

            long start = System.nanoTime();
            assertThat(transport.messageExists(20)).isFalse();
            assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(20_000_000L);
        }
    }

    @Test
    void deadAdapterSurfacesEndOfStream() throws IOException {
        StdioTransport transport = new StdioTransport("test", new ByteArrayInputStream(new byte[0]), () -> false);

        assertThat(transport.messageExists(1000)).isTrue();
        assertThatThrownBy(transport::readMessage).isInstanceOf(EndOfStreamException.class);
    }

    @Test
    void adapterDyingMidFrameSurfacesEndOfStream() {
        byte[] truncated = "Content-Length: 50\r\n\r\n{\"seq\":1".getBytes(StandardCharsets.UTF_8);
        StdioTransport transport = new StdioTransport("test", new ByteArrayInputStream(truncated), () -> false);

        assertThatThrownBy(transport::readMessage)
            .isInstanceOf(EndOfStreamException.class)
            .hasMessageContaining("mid-frame")
            .hasCauseInstanceOf(EOFException.class);
    }

    @Test
    void createMessageFramesJson() throws IOException {
        StdioTransport transport = new StdioTransport("test", new ByteArrayInputStream(new byte[0]), () -> true);
        ObjectNode message = mapper.createObjectNode().put("seq", 3).put("type", "request").put("command", "threads");

        byte[] frame = transport.createMessage(message);

        String text = new String(frame, StandardCharsets.UTF_8);
        assertThat(text).startsWith("Content-Length: ");
        String frameBody = ContentLengthCodec.readFrame(new ByteArrayInputStream(frame));
        assertThat(mapper.readTree(frameBody)).isEqualTo(message);
    }
}
