package slate.commands.string;

import slate.commands.Command;
import slate.db.Key;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public class SetCommand implements Command {
    @Override
    public Reply execute(SlateDatabase db, List<byte[]> args) {
        db.set(Key.of(args.get(1)), args.get(2));
        return Reply.OK;
    }
}
