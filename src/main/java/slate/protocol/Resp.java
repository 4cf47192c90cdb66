package slate.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

public class Resp {
    public static final byte ARRAY = '*';
    public static final byte BULK_STRING = '$';
    public static final byte SIMPLE_STRING = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';

    public static final byte CR = '\r';
    public static final byte LF = '\n';

    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private Resp() { }

    // --- SERIALIZATION ---
    public static void write(Reply reply, ByteBuf out) {
        switch (reply.getType()) {
            case SIMPLE_STRING:
                writeLine(out, SIMPLE_STRING, reply.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case ERROR:
                writeLine(out, ERROR, reply.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case INTEGER:
                writeLine(out, INTEGER, Long.toString(reply.getInteger()).getBytes(StandardCharsets.US_ASCII));
                break;
            case BULK_STRING:
                byte[] payload = reply.getBytes();
                writeLine(out, BULK_STRING, Integer.toString(payload.length).getBytes(StandardCharsets.US_ASCII));
                out.writeBytes(payload);
                out.writeBytes(CRLF);
                break;
            case NIL:
                out.writeBytes(NULL_BULK);
                break;
            default:
                throw new IllegalStateException("unhandled reply type " + reply.getType());
        }
    }

    private static void writeLine(ByteBuf out, byte prefix, byte[] body) {
        out.writeByte(prefix);
        out.writeBytes(body);
        out.writeBytes(CRLF);
    }
}
