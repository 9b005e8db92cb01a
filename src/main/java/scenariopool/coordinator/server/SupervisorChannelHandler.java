package scenariopool.coordinator.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.util.Text;
import scenariopool.protocol.MessageCodec;
import scenariopool.protocol.ReadyMessage;
import scenariopool.protocol.WorkerMessage;

/**
 * Decodes one line per worker message and forwards it.
 */
class SupervisorChannelHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(SupervisorChannelHandler.class);

    /** Worker id announced by the ready message */
    static final AttributeKey<Integer> WORKER_ID = AttributeKey.valueOf("scenariopool.workerId");

    private final SupervisorEvents events;

    SupervisorChannelHandler(SupervisorEvents events) {
        this.events = events;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }
        WorkerMessage message;
        try {
            message = MessageCodec.decode(line);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed message from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            events.onMalformed(ctx.channel(), Text.truncate(line, 200), e);
            return;
        }
        if (message instanceof ReadyMessage ready) {
            ctx.channel().attr(WORKER_ID).set(ready.workerId());
        }
        events.onMessage(ctx.channel(), message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Worker {} channel closed", ctx.channel().attr(WORKER_ID).get());
        events.onDisconnected(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Worker {} channel error: {}", ctx.channel().attr(WORKER_ID).get(), cause.getMessage());
        ctx.close();
    }
}
