package slate.protocol;

import java.util.Collections;
import java.util.List;

/**
 * Result of one attempt to extract a command frame from a connection buffer.
 */
public final class Frame {

    public enum Kind {
        INLINE,
        ARRAY,
        INCOMPLETE,
        FATAL
    }

    private static final Frame INCOMPLETE = new Frame(Kind.INCOMPLETE, Collections.emptyList(), null);

    private final Kind kind;
    private final List<byte[]> args;
    private final String error;

    private Frame(Kind kind, List<byte[]> args, String error) {
        this.kind = kind;
        this.args = args;
        this.error = error;
    }

    public static Frame inline(List<byte[]> args) {
        return new Frame(Kind.INLINE, Collections.unmodifiableList(args), null);
    }

    public static Frame array(List<byte[]> args) {
        return new Frame(Kind.ARRAY, Collections.unmodifiableList(args), null);
    }

    public static Frame incomplete() {
        return INCOMPLETE;
    }

    public static Frame fatal(String error) {
        return new Frame(Kind.FATAL, Collections.emptyList(), error);
    }

    public Kind getKind() {
        return kind;
    }

    /** The argument vector; empty unless the frame is INLINE or ARRAY. */
    public List<byte[]> getArgs() {
        return args;
    }

    /** Protocol error detail for FATAL frames. */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return kind == Kind.FATAL ? "FATAL(" + error + ")" : kind + "[" + args.size() + " args]";
    }
}
