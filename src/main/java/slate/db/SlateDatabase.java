package slate.db;

import slate.utils.Numbers;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The keyspace shared by every connection.
 * <p>
 * Each operation is atomic for its key: reads see either the previous or the
 * new value of a concurrent write, and read-modify-write operations such as
 * {@link #incrementBy(Key, long)} run inside {@link ConcurrentHashMap#compute},
 * so concurrent increments never lose updates. Operations on different keys do
 * not block each other beyond the map's own bin locking.
 * <p>
 * Values are copied on the way in and out; callers can never observe or cause
 * a partially written value.
 */
public class SlateDatabase {

    private final ConcurrentHashMap<Key, byte[]> store = new ConcurrentHashMap<>();

    private final AtomicLong keyspaceHits = new AtomicLong(0);
    private final AtomicLong keyspaceMisses = new AtomicLong(0);

    /**
     * @return a copy of the stored value, or {@code null} if the key is absent
     */
    public byte[] get(Key key) {
        byte[] v = store.get(key);
        if (v == null) {
            keyspaceMisses.incrementAndGet();
            return null;
        }
        keyspaceHits.incrementAndGet();
        return v.clone();
    }

    public void set(Key key, byte[] value) {
        store.put(key, value.clone());
    }

    /**
     * @return true if an entry existed and was removed
     */
    public boolean delete(Key key) {
        return store.remove(key) != null;
    }

    public long increment(Key key) {
        return incrementBy(key, 1);
    }

    /**
     * Adds {@code delta} to the decimal integer stored at {@code key}, treating
     * an absent key as 0, and stores the result as decimal text.
     *
     * @throws ValueNotIntegerException if the current value is not a decimal integer
     * @throws IncrementOverflowException if the result does not fit in a long;
     *         the stored value is left unchanged
     */
    public long incrementBy(Key key, long delta) {
        final long[] ret = {0};
        store.compute(key, (k, v) -> {
            long current = 0;
            if (v != null) {
                try {
                    current = Numbers.parseStrictLong(v);
                } catch (NumberFormatException e) {
                    throw new ValueNotIntegerException();
                }
            }
            long next;
            try {
                next = Math.addExact(current, delta);
            } catch (ArithmeticException e) {
                throw new IncrementOverflowException();
            }
            ret[0] = next;
            return Long.toString(next).getBytes(StandardCharsets.US_ASCII);
        });
        return ret[0];
    }

    public boolean exists(Key key) {
        return store.containsKey(key);
    }

    public int size() {
        return store.size();
    }

    public long getKeyspaceHits() {
        return keyspaceHits.get();
    }

    public long getKeyspaceMisses() {
        return keyspaceMisses.get();
    }
}
