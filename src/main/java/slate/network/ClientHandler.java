package slate.network;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import slate.commands.CommandDispatcher;
import slate.protocol.Reply;
import slate.utils.Log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Last inbound handler of a connection's pipeline. Runs each decoded argument
 * vector through the dispatcher and writes its reply before the next one is
 * read, so replies leave in request order.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final CommandDispatcher dispatcher;
    private final ServerStats stats;

    public ClientHandler(CommandDispatcher dispatcher, ServerStats stats) {
        this.dispatcher = dispatcher;
        this.stats = stats;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionOpened();
        Log.debug("Accepted " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionClosed();
        Log.debug("Client closed connection " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof List) {
            List<byte[]> parts = (List<byte[]>) msg;
            stats.commandProcessed();
            if (Log.isDebugEnabled()) {
                Log.debug("Command from " + ctx.channel().remoteAddress() + ": " + describe(parts));
            }
            Reply reply = dispatcher.dispatch(parts);
            ctx.writeAndFlush(reply);
        } else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            // Transport failure, e.g. connection reset by peer
            Log.debug("Connection " + ctx.channel().remoteAddress() + " failed: " + cause.getMessage());
            ctx.close();
            return;
        }
        Log.error("Closing connection " + ctx.channel().remoteAddress() + " after internal error", cause);
        ctx.close();
    }

    private static String describe(List<byte[]> parts) {
        StringBuilder sb = new StringBuilder();
        for (byte[] part : parts) {
            if (sb.length() > 0) sb.append(' ');
            sb.append('"').append(new String(part, StandardCharsets.UTF_8)).append('"');
        }
        return sb.toString();
    }
}
