package dev.debugclient.transport;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Codec that writes and reads frames made of a {@code Content-Length: N} header block terminated by an empty
 * line, followed by N bytes of UTF-8 encoded JSON text.
 */
public final class ContentLengthCodec {

    static final String CONTENT_LENGTH = "Content-Length";

    private static final int MAX_HEADER_LINE = 1024;

    private ContentLengthCodec() {
    }

    public static byte[] encode(String json) {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        byte[] header = (CONTENT_LENGTH + ": " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] frame = new byte[header.length + payload.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(payload, 0, frame, header.length, payload.length);
        return frame;
    }

    public static void writeFrame(OutputStream out, String json) throws IOException {
        out.write(encode(json));
        out.flush();
    }

    public static String readFrame(InputStream in) throws IOException {
        String line = readHeaderLine(in);
        if (line == null) {
            return null; // EOF before header indicates the peer closed its stream.
        }
        int length = -1;
        while (!line.isEmpty()) {
            int colon = line.indexOf(':');
            if (colon > 0 && CONTENT_LENGTH.equalsIgnoreCase(line.substring(0, colon).trim())) {
                length = parseLength(line.substring(colon + 1).trim());
            }
            line = readHeaderLine(in);
            if (line == null) {
                throw new EOFException("Stream closed inside a frame header");
            }
        }
        if (length < 0) {
            throw new IOException("Frame header has no " + CONTENT_LENGTH);
        }
        byte[] payload = readFully(in, length);
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static int parseLength(String value) throws IOException {
        try {
            int length = Integer.parseInt(value);
            if (length < 0) {
                throw new IOException("Invalid frame length: " + length);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid frame length: " + value, e);
        }
    }

    /**
     * Reads one CRLF (or bare LF) terminated header line, without the terminator. Returns {@code null} when the
     * stream ends before the first byte.
     */
    private static String readHeaderLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        boolean any = false;
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (!any) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream inside header line");
            }
            any = true;
            if (b == '\n') {
                break;
            }
            if (line.size() >= MAX_HEADER_LINE) {
                throw new IOException("Header line longer than " + MAX_HEADER_LINE + " bytes");
            }
            line.write(b);
        }
        String text = line.toString(StandardCharsets.US_ASCII);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                throw new EOFException("Unexpected end of stream after reading " + offset + " of " + length + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
