package slate.commands;

public class CommandMetadata {
    private final String name;
    private final int arity;

    /**
     * @param arity argument count including the command name; a negative
     *              value means "at least -arity"
     */
    public CommandMetadata(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    public String getName() {
        return name;
    }

    public boolean acceptsArgCount(int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }
}
