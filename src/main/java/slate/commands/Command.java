package slate.commands;

import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public interface Command {
    // Runs the command and returns its single reply.
    // args.get(0) is the command name; the dispatcher has already checked arity.
    Reply execute(SlateDatabase db, List<byte[]> args);
}
