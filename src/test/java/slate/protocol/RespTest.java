package slate.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespTest {

    private static String encode(Reply reply) {
        return new String(Wire.reply(reply), StandardCharsets.UTF_8);
    }

    @Test
    public void testWireForms() {
        assertEquals("+PONG\r\n", encode(Reply.PONG));
        assertEquals("+OK\r\n", encode(Reply.OK));
        assertEquals("-ERR unknown command 'FOO'\r\n", encode(Reply.error("ERR unknown command 'FOO'")));
        assertEquals(":-10\r\n", encode(Reply.integer(-10)));
        assertEquals(":9223372036854775807\r\n", encode(Reply.integer(Long.MAX_VALUE)));
        assertEquals("$5\r\nvalue\r\n", encode(Reply.bulkString("value".getBytes(StandardCharsets.UTF_8))));
        assertEquals("$0\r\n\r\n", encode(Reply.bulkString(new byte[0])));
        assertEquals("$-1\r\n", encode(Reply.NIL));
    }

    @Test
    public void testBulkLengthCountsBytesNotChars() {
        byte[] utf8 = "héllo".getBytes(StandardCharsets.UTF_8);
        byte[] encoded = Wire.reply(Reply.bulkString(utf8));
        String header = new String(encoded, 0, 4, StandardCharsets.US_ASCII);
        assertEquals("$6\r\n", header);
        assertEquals(4 + 6 + 2, encoded.length);
    }

    @Test
    public void testNullBulkIsNil() {
        assertSame(Reply.NIL, Reply.bulkString(null));
    }

    @Test
    public void testLineRepliesRejectNewlines() {
        assertThrows(IllegalArgumentException.class, () -> Reply.simpleString("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> Reply.error("bad\n"));
    }
}
