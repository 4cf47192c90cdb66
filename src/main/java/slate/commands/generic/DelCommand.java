package slate.commands.generic;

import slate.commands.Command;
import slate.db.Key;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public class DelCommand implements Command {
    @Override
    public Reply execute(SlateDatabase db, List<byte[]> args) {
        boolean removed = db.delete(Key.of(args.get(1)));
        return Reply.integer(removed ? 1 : 0);
    }
}
