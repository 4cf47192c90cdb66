package slate.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A typed reply value. Every command produces exactly one of these and only
 * {@link Resp} turns it into wire bytes.
 */
public final class Reply {

    public enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        NIL
    }

    public static final Reply OK = simpleString("OK");
    public static final Reply PONG = simpleString("PONG");
    public static final Reply NIL = new Reply(Type.NIL, null, null, 0);

    private final Type type;
    private final String text;
    private final byte[] bytes;
    private final long integer;

    private Reply(Type type, String text, byte[] bytes, long integer) {
        this.type = type;
        this.text = text;
        this.bytes = bytes;
        this.integer = integer;
    }

    public static Reply simpleString(String text) {
        return new Reply(Type.SIMPLE_STRING, checkLine(text), null, 0);
    }

    public static Reply error(String text) {
        return new Reply(Type.ERROR, checkLine(text), null, 0);
    }

    public static Reply integer(long value) {
        return new Reply(Type.INTEGER, null, null, value);
    }

    /**
     * Bulk string reply; a {@code null} payload becomes {@link #NIL}.
     */
    public static Reply bulkString(byte[] value) {
        if (value == null) return NIL;
        return new Reply(Type.BULK_STRING, null, value, 0);
    }

    private static String checkLine(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("line reply must not contain CR or LF: " + text);
        }
        return text;
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public byte[] getBytes() {
        return bytes;
    }

    public long getInteger() {
        return integer;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reply)) return false;
        Reply other = (Reply) o;
        return type == other.type
                && integer == other.integer
                && Objects.equals(text, other.text)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, text, integer);
        return 31 * result + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING: return "+" + text;
            case ERROR: return "-" + text;
            case INTEGER: return ":" + integer;
            case BULK_STRING: return "\"" + new String(bytes, StandardCharsets.UTF_8) + "\"";
            default: return "(nil)";
        }
    }
}
