package dev.debugclient.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentLengthCodecTest {

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodeCountsBytesNotCharacters() {
        byte[] frame = ContentLengthCodec.encode("{\"a\":\"é\"}");

        assertThat(new String(frame, StandardCharsets.UTF_8)).isEqualTo("Content-Length: 10\r\n\r\n{\"a\":\"é\"}");
    }

    @Test
    void readsConsecutiveFrames() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{\"seq\":1}");
        ContentLengthCodec.writeFrame(out, "{\"seq\":2}");
        InputStream in = new ByteArrayInputStream(out.toByteArray());

        assertThat(ContentLengthCodec.readFrame(in)).isEqualTo("{\"seq\":1}");
        assertThat(ContentLengthCodec.readFrame(in)).isEqualTo("{\"seq\":2}");
        assertThat(ContentLengthCodec.readFrame(in)).isNull();
    }

    @Test
    void skipsOtherHeadersAndAcceptsBareLineFeeds() throws IOException {
        InputStream in = stream("Content-Type: application/json\ncontent-length: 2\n\n{}");

        assertThat(ContentLengthCodec.readFrame(in)).isEqualTo("{}");
    }

    @Test
    void rejectsHeaderWithoutLength() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Type: json\r\n\r\n{}")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Content-Length");
    }

    @Test
    void rejectsInvalidLength() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: abc\r\n\r\n{}")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("abc");
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: -1\r\n\r\n")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void truncatedFramesAreEndOfFile() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 10\r\n\r\n{}")))
            .isInstanceOf(EOFException.class);
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 2\r\n")))
            .isInstanceOf(EOFException.class);
    }
}
