package slate.commands.string;

import slate.commands.Command;
import slate.db.Key;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public class IncrCommand implements Command {
    @Override
    public Reply execute(SlateDatabase db, List<byte[]> args) {
        // Non-integer values and overflow surface as exceptions the dispatcher maps to errors
        return Reply.integer(db.increment(Key.of(args.get(1))));
    }
}
