package slate.utils;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.*;

public class LogTest {

    private final Log.LineFormatter formatter = new Log.LineFormatter();

    @Test
    public void testPlainMessage() {
        LogRecord record = new LogRecord(Level.WARNING, "Protocol error from /127.0.0.1:5000");
        assertEquals(String.format("[WARN] Protocol error from /127.0.0.1:5000%n"), formatter.format(record));
    }

    @Test
    public void testThrowableIncludesStackTrace() {
        LogRecord record = new LogRecord(Level.SEVERE, "Closing connection after internal error");
        record.setThrown(new IllegalStateException("boom", new RuntimeException("root cause")));

        String out = formatter.format(record);
        assertTrue(out.startsWith("[ERROR] Closing connection after internal error"), out);
        assertTrue(out.contains("java.lang.IllegalStateException: boom"), out);
        assertTrue(out.contains("\tat slate.utils.LogTest.testThrowableIncludesStackTrace"), out);
        assertTrue(out.contains("Caused by: java.lang.RuntimeException: root cause"), out);
    }

    @Test
    public void testLevelNames() {
        assertEquals(String.format("[DEBUG] x%n"), formatter.format(new LogRecord(Level.FINE, "x")));
        assertEquals(String.format("[INFO] x%n"), formatter.format(new LogRecord(Level.INFO, "x")));
        assertThrows(IllegalArgumentException.class, () -> Log.setLevel("loud"));
    }
}
