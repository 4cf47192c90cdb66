package slate.commands;

import slate.commands.connection.EchoCommand;
import slate.commands.connection.PingCommand;
import slate.commands.generic.DelCommand;
import slate.commands.string.GetCommand;
import slate.commands.string.IncrCommand;
import slate.commands.string.SetCommand;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class CommandRegistry {
    private final Map<String, Entry> commands = new HashMap<>();

    /**
     * A registered command with its name and arity.
     */
    public static final class Entry {
        private final Command command;
        private final CommandMetadata metadata;

        private Entry(Command command, CommandMetadata metadata) {
            this.command = command;
            this.metadata = metadata;
        }

        public String getName() {
            return metadata.getName();
        }

        public boolean acceptsArgCount(int argc) {
            return metadata.acceptsArgCount(argc);
        }

        public Reply execute(SlateDatabase db, List<byte[]> args) {
            return command.execute(db, args);
        }
    }

    public static CommandRegistry withDefaults() {
        CommandRegistry registry = new CommandRegistry();

        // Connection
        registry.register("PING", 1, new PingCommand());
        registry.register("ECHO", 2, new EchoCommand());

        // String
        registry.register("GET", 2, new GetCommand());
        registry.register("SET", 3, new SetCommand());
        registry.register("INCR", 2, new IncrCommand());

        // Generic
        registry.register("DEL", 2, new DelCommand());
        return registry;
    }

    public void register(String name, int arity, Command command) {
        String upper = name.toUpperCase(Locale.ROOT);
        commands.put(upper, new Entry(command, new CommandMetadata(upper, arity)));
    }

    /**
     * Case-insensitive lookup.
     *
     * @return the command, or {@code null} if none is registered under that name
     */
    public Entry get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return commands.size();
    }
}
