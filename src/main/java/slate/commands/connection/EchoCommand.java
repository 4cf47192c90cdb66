package slate.commands.connection;

import slate.commands.Command;
import slate.db.SlateDatabase;
import slate.protocol.Reply;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public Reply execute(SlateDatabase db, List<byte[]> args) {
        return Reply.bulkString(args.get(1));
    }
}
