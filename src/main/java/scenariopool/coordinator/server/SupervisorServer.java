package scenariopool.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.protocol.MessageCodec;
import scenariopool.protocol.WorkerMessage;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loopback TCP endpoint workers connect back to. Frames are single lines of
 * JSON; every decoded message is handed to a {@link SupervisorEvents} sink.
 */
public final class SupervisorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SupervisorServer.class);

    /** Large enough for a feature with long doc strings */
    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private final SupervisorEvents events;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public SupervisorServer(SupervisorEvents events) {
        this.events = Objects.requireNonNull(events, "events is required");
    }

    /**
     * Bind to an ephemeral port on the loopback interface.
     *
     * @return the bound port
     * @throws IllegalStateException if binding fails
     */
    public synchronized int start() {
        if (running) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            clients.add(ch);
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new LineBasedFrameDecoder(MAX_FRAME_LENGTH));
                            p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                            p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                            p.addLast(new SupervisorChannelHandler(events));
                        }
                    });

            serverChannel = b.bind("127.0.0.1", 0).syncUninterruptibly().channel();
            running = true;
            log.info("Supervisor listening on 127.0.0.1:{}", port());
            return port();
        } catch (Exception e) {
            stop();
            throw new IllegalStateException("Cannot bind supervisor socket", e);
        }
    }

    public int port() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Supervisor server not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public String host() {
        return "127.0.0.1";
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Write one message followed by a newline.
     *
     * @return the write future; failures are reported through it
     */
    public static ChannelFuture send(Channel channel, WorkerMessage message) {
        return channel.writeAndFlush(MessageCodec.encode(message) + "\n");
    }

    /** Worker id announced on this channel, or null before the ready message */
    public static Integer workerIdOf(Channel channel) {
        return channel.attr(SupervisorChannelHandler.WORKER_ID).get();
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            clients.close().awaitUninterruptibly();
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Supervisor server stopped");
            }
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
