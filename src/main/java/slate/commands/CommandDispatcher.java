package slate.commands;

import slate.db.IncrementOverflowException;
import slate.db.SlateDatabase;
import slate.db.ValueNotIntegerException;
import slate.protocol.Reply;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Maps an argument vector to a command and turns its outcome into exactly one
 * reply. Command-level failures (unknown name, wrong arity, bad integer value)
 * become error replies; anything else propagates to the connection.
 */
public class CommandDispatcher {

    private static final int MAX_NAME_IN_ERROR = 128;

    private final SlateDatabase db;
    private final CommandRegistry registry;

    public CommandDispatcher(SlateDatabase db, CommandRegistry registry) {
        this.db = db;
        this.registry = registry;
    }

    public CommandDispatcher(SlateDatabase db) {
        this(db, CommandRegistry.withDefaults());
    }

    public Reply dispatch(List<byte[]> args) {
        if (args.isEmpty()) {
            return Reply.error("ERR unknown command ''");
        }

        String name = new String(args.get(0), StandardCharsets.UTF_8);
        CommandRegistry.Entry command = registry.get(name);
        if (command == null) {
            return Reply.error("ERR unknown command '" + sanitize(name) + "'");
        }
        if (!command.acceptsArgCount(args.size())) {
            return Reply.error("ERR wrong number of arguments for '"
                    + command.getName().toLowerCase(Locale.ROOT) + "' command");
        }

        try {
            return command.execute(db, args);
        } catch (ValueNotIntegerException | IncrementOverflowException e) {
            return Reply.error(e.getMessage());
        }
    }

    // Error replies are single lines.
    private static String sanitize(String name) {
        String s = name.length() > MAX_NAME_IN_ERROR ? name.substring(0, MAX_NAME_IN_ERROR) : name;
        return s.replace('\r', ' ').replace('\n', ' ');
    }
}
