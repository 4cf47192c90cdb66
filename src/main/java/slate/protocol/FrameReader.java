package slate.protocol;

import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts one command frame at a time from a connection buffer.
 * <p>
 * A frame starting with {@code *} is read as a RESP array of bulk strings,
 * anything else as an inline line split on whitespace. The reader index of the
 * buffer only moves when a complete frame was read; on {@link Frame.Kind#INCOMPLETE}
 * the caller appends more bytes and calls {@link #read(ByteBuf)} again.
 */
public class FrameReader {

    public static final int MAX_INLINE_LENGTH = 64 * 1024;
    public static final int MAX_MULTIBULK_LENGTH = 1024 * 1024;
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    private static final int INVALID = -1;

    public Frame read(ByteBuf in) {
        if (!in.isReadable()) return Frame.incomplete();

        int start = in.readerIndex();
        if (in.getByte(start) == Resp.ARRAY) {
            return readArray(in, start);
        }
        return readInline(in, start);
    }

    private Frame readInline(ByteBuf in, int start) {
        int eol = findLineFeed(in, start);
        if (eol == -1) {
            if (in.writerIndex() - start > MAX_INLINE_LENGTH) {
                return Frame.fatal("too big inline request");
            }
            return Frame.incomplete();
        }
        if (eol - start > MAX_INLINE_LENGTH) {
            return Frame.fatal("too big inline request");
        }

        int end = lineEnd(in, start, eol);
        List<byte[]> args = new ArrayList<>();
        int i = start;
        while (i < end) {
            while (i < end && isSpace(in.getByte(i))) i++;
            if (i == end) break;
            int tokenStart = i;
            while (i < end && !isSpace(in.getByte(i))) i++;
            byte[] token = new byte[i - tokenStart];
            in.getBytes(tokenStart, token);
            args.add(token);
        }

        in.readerIndex(eol + 1);
        return Frame.inline(args);
    }

    private Frame readArray(ByteBuf in, int start) {
        int pos = start + 1;
        int eol = findLineFeed(in, pos);
        if (eol == -1) return unterminatedHeader(in, pos, "too big multibulk count line");

        int count = parseLength(in, pos, lineEnd(in, pos, eol));
        if (count == INVALID || count > MAX_MULTIBULK_LENGTH) {
            return Frame.fatal("invalid multibulk length");
        }
        pos = eol + 1;

        List<byte[]> args = new ArrayList<>(Math.min(count, 1024));
        for (int n = 0; n < count; n++) {
            if (pos >= in.writerIndex()) return Frame.incomplete();

            byte type = in.getByte(pos);
            if (type != Resp.BULK_STRING) {
                return Frame.fatal("expected '$', got '" + printable(type) + "'");
            }
            pos++;

            eol = findLineFeed(in, pos);
            if (eol == -1) return unterminatedHeader(in, pos, "too big bulk length line");

            int length = parseLength(in, pos, lineEnd(in, pos, eol));
            if (length == INVALID || length > MAX_BULK_LENGTH) {
                return Frame.fatal("invalid bulk length");
            }
            pos = eol + 1;

            if ((long) in.writerIndex() - pos < (long) length + 2) return Frame.incomplete();
            if (in.getByte(pos + length) != Resp.CR || in.getByte(pos + length + 1) != Resp.LF) {
                return Frame.fatal("bulk string not terminated by CRLF");
            }

            byte[] arg = new byte[length];
            in.getBytes(pos, arg);
            args.add(arg);
            pos += length + 2;
        }

        in.readerIndex(pos);
        return Frame.array(args);
    }

    private Frame unterminatedHeader(ByteBuf in, int from, String error) {
        if (in.writerIndex() - from > MAX_INLINE_LENGTH) {
            return Frame.fatal(error);
        }
        return Frame.incomplete();
    }

    private int findLineFeed(ByteBuf in, int from) {
        if (from >= in.writerIndex()) return -1;
        return in.indexOf(from, in.writerIndex(), Resp.LF);
    }

    // Index one past the last content byte of a line, dropping an optional CR.
    private int lineEnd(ByteBuf in, int lineStart, int eol) {
        if (eol > lineStart && in.getByte(eol - 1) == Resp.CR) {
            return eol - 1;
        }
        return eol;
    }

    /**
     * Parses a non-negative decimal length; anything else, including a sign,
     * is {@link #INVALID}.
     */
    private int parseLength(ByteBuf in, int from, int to) {
        if (from >= to || to - from > 10) return INVALID;
        long value = 0;
        for (int i = from; i < to; i++) {
            byte b = in.getByte(i);
            if (b < '0' || b > '9') return INVALID;
            value = value * 10 + (b - '0');
        }
        return value > Integer.MAX_VALUE ? INVALID : (int) value;
    }

    private static boolean isSpace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == 0x0b || b == '\f';
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }
}
