package slate.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Slate");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new LineFormatter());
        logger.addHandler(handler);
        setLevel(Level.INFO);
    }

    // [LEVEL] message, followed by the stack trace when there is one
    static class LineFormatter extends SimpleFormatter {
        @Override
        public synchronized String format(LogRecord record) {
            String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                              record.getLevel() == Level.WARNING ? "WARN" :
                              record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
            String line = String.format("[%s] %s%n", levelStr, record.getMessage());
            if (record.getThrown() == null) {
                return line;
            }
            StringWriter trace = new StringWriter();
            try (PrintWriter pw = new PrintWriter(trace)) {
                record.getThrown().printStackTrace(pw);
            }
            return line + trace;
        }
    }

    /**
     * Applies a redis.conf style level name: debug, verbose, notice or warning.
     */
    public static void setLevel(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "debug":
            case "verbose":
                setLevel(Level.FINE);
                break;
            case "notice":
                setLevel(Level.INFO);
                break;
            case "warning":
                setLevel(Level.WARNING);
                break;
            default:
                throw new IllegalArgumentException("unknown log level: " + name);
        }
    }

    private static void setLevel(Level level) {
        logger.setLevel(level);
        handler.setLevel(level);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
