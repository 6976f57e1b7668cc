package de.netcompliance.infrastructure.netconf;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * NETCONF message framing: the base:1.0 {@code ]]>]]>} end-of-message delimiter and the
 * base:1.1 chunked framing of RFC 6242.
 */
public final class NetconfFraming {

    public static final String END_OF_MESSAGE = "]]>]]>";
    private static final byte[] END_OF_MESSAGE_BYTES = END_OF_MESSAGE.getBytes(StandardCharsets.UTF_8);
    private static final int MAX_CHUNK_SIZE = Integer.MAX_VALUE;

    public enum Mode {
        END_OF_MESSAGE,
        CHUNKED
    }

    public static void write(final OutputStream out, final String message, final Mode mode) throws IOException {
        var payload = message.getBytes(StandardCharsets.UTF_8);
        if (mode == Mode.CHUNKED) {
            out.write("\n#%d\n".formatted(payload.length).getBytes(StandardCharsets.US_ASCII));
            out.write(payload);
            out.write("\n##\n".getBytes(StandardCharsets.US_ASCII));
        } else {
            out.write(payload);
            out.write(END_OF_MESSAGE_BYTES);
        }
        out.flush();
    }

    public static String read(final InputStream in, final Mode mode) throws IOException {
        return mode == Mode.CHUNKED ? readChunked(in) : readEndOfMessage(in);
    }

    static String readEndOfMessage(final InputStream in) throws IOException {
        var buffer = new ByteArrayOutputStream();
        var tail = new byte[END_OF_MESSAGE_BYTES.length];
        long count = 0;
        while (true) {
            int b = in.read();
            if (b < 0) throw new EOFException("Session closed before end of message");
            buffer.write(b);
            System.arraycopy(tail, 1, tail, 0, tail.length - 1);
            tail[tail.length - 1] = (byte) b;
            count++;
            if (count >= tail.length && Arrays.equals(tail, END_OF_MESSAGE_BYTES)) {
                var bytes = buffer.toByteArray();
                return new String(bytes, 0, bytes.length - END_OF_MESSAGE_BYTES.length, StandardCharsets.UTF_8);
            }
        }
    }

    static String readChunked(final InputStream in) throws IOException {
        var message = new ByteArrayOutputStream();
        while (true) {
            expect(in, '\n');
            expect(in, '#');
            int first = readByte(in);
            if (first == '#') {
                expect(in, '\n');
                return message.toString(StandardCharsets.UTF_8);
            }
            long size = chunkSize(in, first);
            var chunk = in.readNBytes((int) size);
            if (chunk.length < size) throw new EOFException("Session closed inside chunk");
            message.write(chunk);
        }
    }

    private static long chunkSize(final InputStream in, final int firstDigit) throws IOException {
        if (firstDigit < '1' || firstDigit > '9') {
            throw new IOException("Invalid chunk size start '%c'".formatted((char) firstDigit));
        }
        long size = firstDigit - '0';
        int b;
        while ((b = readByte(in)) != '\n') {
            if (b < '0' || b > '9') throw new IOException("Invalid chunk size digit '%c'".formatted((char) b));
            size = size * 10 + (b - '0');
            if (size > MAX_CHUNK_SIZE) throw new IOException("Chunk size exceeds %d".formatted(MAX_CHUNK_SIZE));
        }
        return size;
    }

    private static void expect(final InputStream in, final char expected) throws IOException {
        int b = readByte(in);
        if (b != expected) {
            throw new IOException("Malformed chunk framing, expected '%s' but got '%c'"
                    .formatted(expected == '\n' ? "\\n" : String.valueOf(expected), (char) b));
        }
    }

    private static int readByte(final InputStream in) throws IOException {
        int b = in.read();
        if (b < 0) throw new EOFException("Session closed inside chunked message");
        return b;
    }

    private NetconfFraming() {}
}
