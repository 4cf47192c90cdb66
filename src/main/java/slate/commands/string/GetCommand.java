package slate.commands.string;

import slate.commands.Command;
import slate.db.Key;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public Reply execute(SlateDatabase db, List<byte[]> args) {
        byte[] value = db.get(Key.of(args.get(1)));
        return value == null ? Reply.NIL : Reply.bulkString(value);
    }
}
