package slate.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import slate.protocol.Reply;
import slate.protocol.Resp;

/**
 * Encodes {@link Reply} values into their RESP wire form.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply msg, ByteBuf out) throws Exception {
        Resp.write(msg, out);
    }
}
