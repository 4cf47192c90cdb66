package slate.db;

public class ValueNotIntegerException extends RuntimeException {
    public ValueNotIntegerException() {
        super("ERR value is not an integer or out of range");
    }
}
