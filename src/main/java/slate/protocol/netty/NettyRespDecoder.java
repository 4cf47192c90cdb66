package slate.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import slate.protocol.Frame;
import slate.protocol.FrameReader;
import slate.protocol.Reply;
import slate.utils.Log;

import java.util.List;

/**
 * Netty decoder turning inline and RESP array frames into argument vectors
 * ({@code List<byte[]>}), one message per command.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final FrameReader reader = new FrameReader();
    private boolean failed = false;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }

        Frame frame = reader.read(in);
        switch (frame.getKind()) {
            case INLINE:
            case ARRAY:
                out.add(frame.getArgs());
                break;
            case INCOMPLETE:
                // Wait for more data
                break;
            case FATAL:
                failed = true;
                in.skipBytes(in.readableBytes());
                Log.warn("Protocol error from " + ctx.channel().remoteAddress() + ": " + frame.getError());
                // Written from the tail so the reply passes through the encoder.
                ctx.channel().writeAndFlush(Reply.error("ERR Protocol error: " + frame.getError()))
                        .addListener(ChannelFutureListener.CLOSE);
                break;
            default:
                throw new IllegalStateException("unhandled frame kind " + frame.getKind());
        }
    }
}
