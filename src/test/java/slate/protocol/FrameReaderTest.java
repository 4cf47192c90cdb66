package slate.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FrameReaderTest {

    private final FrameReader reader = new FrameReader();

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static void assertArgs(List<byte[]> args, String... expected) {
        assertEquals(expected.length, args.size());
        for (int i = 0; i < expected.length; i++) {
            assertArrayEquals(expected[i].getBytes(StandardCharsets.UTF_8), args.get(i), "arg " + i);
        }
    }

    @Test
    public void testArrayFrame() {
        ByteBuf in = buf("*2\r\n$4\r\nECHO\r\n$5\r\nvalue\r\n");
        Frame frame = reader.read(in);

        assertEquals(Frame.Kind.ARRAY, frame.getKind());
        assertArgs(frame.getArgs(), "ECHO", "value");
        assertFalse(in.isReadable());
    }

    @Test
    public void testInlineFrame() {
        ByteBuf in = buf("ECHO value\r\n");
        Frame frame = reader.read(in);

        assertEquals(Frame.Kind.INLINE, frame.getKind());
        assertArgs(frame.getArgs(), "ECHO", "value");
        assertFalse(in.isReadable());
    }

    @Test
    public void testInlineBareNewlineAndWhitespaceRuns() {
        Frame frame = reader.read(buf("  SET \t key   val \n"));

        assertEquals(Frame.Kind.INLINE, frame.getKind());
        assertArgs(frame.getArgs(), "SET", "key", "val");
    }

    @Test
    public void testBlankInlineLineIsEmptyCommand() {
        ByteBuf in = buf("   \r\nPING\r\n");

        Frame first = reader.read(in);
        assertEquals(Frame.Kind.INLINE, first.getKind());
        assertTrue(first.getArgs().isEmpty());

        Frame second = reader.read(in);
        assertArgs(second.getArgs(), "PING");
    }

    @Test
    public void testEmptyArray() {
        ByteBuf in = buf("*0\r\n");
        Frame frame = reader.read(in);

        assertEquals(Frame.Kind.ARRAY, frame.getKind());
        assertTrue(frame.getArgs().isEmpty());
        assertFalse(in.isReadable());
    }

    @Test
    public void testBinarySafeBulkPayload() {
        byte[] payload = {'a', '\r', '\n', 0, (byte) 0xff};
        ByteBuf in = Unpooled.buffer();
        in.writeBytes("*2\r\n$3\r\nSET\r\n$5\r\n".getBytes(StandardCharsets.US_ASCII));
        in.writeBytes(payload);
        in.writeBytes("\r\n".getBytes(StandardCharsets.US_ASCII));

        Frame frame = reader.read(in);
        assertEquals(Frame.Kind.ARRAY, frame.getKind());
        assertArrayEquals(payload, frame.getArgs().get(1));
    }

    @Test
    public void testEmptyBulkString() {
        Frame frame = reader.read(buf("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$0\r\n\r\n"));

        assertEquals(Frame.Kind.ARRAY, frame.getKind());
        assertEquals(0, frame.getArgs().get(2).length);
    }

    @Test
    public void testIncompleteLeavesReaderIndexUntouched() {
        String full = "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n";
        // Every strict prefix is incomplete
        for (int cut = 0; cut < full.length(); cut++) {
            ByteBuf in = buf(full.substring(0, cut));
            int before = in.readerIndex();
            Frame frame = reader.read(in);
            assertEquals(Frame.Kind.INCOMPLETE, frame.getKind(), "prefix of length " + cut);
            assertEquals(before, in.readerIndex());
        }
        assertEquals(Frame.Kind.ARRAY, reader.read(buf(full)).getKind());
    }

    @Test
    public void testIncompleteInlineLine() {
        ByteBuf in = buf("PIN");
        assertEquals(Frame.Kind.INCOMPLETE, reader.read(in).getKind());
        in.writeBytes("G\r\n".getBytes(StandardCharsets.US_ASCII));
        assertArgs(reader.read(in).getArgs(), "PING");
    }

    @Test
    public void testPipelinedFramesAreReadOneAtATime() {
        ByteBuf in = buf("PING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\nECHO x\r\n");

        assertEquals(Frame.Kind.INLINE, reader.read(in).getKind());
        Frame second = reader.read(in);
        assertEquals(Frame.Kind.ARRAY, second.getKind());
        assertArgs(second.getArgs(), "GET", "k");
        assertArgs(reader.read(in).getArgs(), "ECHO", "x");
        assertEquals(Frame.Kind.INCOMPLETE, reader.read(in).getKind());
    }

    @Test
    public void testMalformedCountIsFatal() {
        Frame frame = reader.read(buf("*abc\r\n"));
        assertEquals(Frame.Kind.FATAL, frame.getKind());
        assertEquals("invalid multibulk length", frame.getError());
    }

    @Test
    public void testNegativeCountIsFatal() {
        assertEquals(Frame.Kind.FATAL, reader.read(buf("*-1\r\n")).getKind());
    }

    @Test
    public void testMalformedBulkLengthIsFatal() {
        Frame frame = reader.read(buf("*2\r\n$3\r\nSET\r\n$garbage\r\n"));
        assertEquals(Frame.Kind.FATAL, frame.getKind());
        assertEquals("invalid bulk length", frame.getError());
    }

    @Test
    public void testNegativeBulkLengthIsFatal() {
        assertEquals(Frame.Kind.FATAL, reader.read(buf("*1\r\n$-1\r\n")).getKind());
    }

    @Test
    public void testBulkLengthAboveLimitIsFatal() {
        assertEquals(Frame.Kind.FATAL, reader.read(buf("*1\r\n$9999999999\r\n")).getKind());
    }

    @Test
    public void testElementWithoutDollarIsFatal() {
        Frame frame = reader.read(buf("*1\r\n:12\r\n"));
        assertEquals(Frame.Kind.FATAL, frame.getKind());
        assertEquals("expected '$', got ':'", frame.getError());
    }

    @Test
    public void testPayloadLongerThanDeclaredIsFatal() {
        assertEquals(Frame.Kind.FATAL, reader.read(buf("*1\r\n$3\r\nPINGX\r\n")).getKind());
    }

    @Test
    public void testOversizedInlineRequestIsFatal() {
        StringBuilder sb = new StringBuilder();
        while (sb.length() <= FrameReader.MAX_INLINE_LENGTH) sb.append("aaaaaaaa ");
        assertEquals(Frame.Kind.FATAL, reader.read(buf(sb.toString())).getKind());
    }

    @Test
    public void testEmptyBufferIsIncomplete() {
        assertEquals(Frame.Kind.INCOMPLETE, reader.read(Unpooled.EMPTY_BUFFER).getKind());
    }
}
