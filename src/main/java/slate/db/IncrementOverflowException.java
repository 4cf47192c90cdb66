package slate.db;

public class IncrementOverflowException extends RuntimeException {
    public IncrementOverflowException() {
        super("ERR increment or decrement would overflow");
    }
}
