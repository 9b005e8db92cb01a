package scenariopool.worker;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.server.SupervisorServer;
import scenariopool.protocol.ExecuteMessage;
import scenariopool.protocol.MessageCodec;
import scenariopool.protocol.ReadyMessage;
import scenariopool.protocol.ResultMessage;
import scenariopool.protocol.TerminateMessage;
import scenariopool.protocol.WorkerMessage;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Worker end of the supervisor connection. Items run one at a time on a
 * dedicated execution thread; the Netty IO thread only decodes and hands off.
 */
public final class WorkerClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerClient.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_CONNECT_FAILED = 2;
    public static final int EXIT_SUPERVISOR_LOST = 3;
    public static final int EXIT_KILLED = 137;

    private final int workerId;
    private final String host;
    private final int port;
    private final WorkerRuntime runtime;
    private final ExecutorService exec;
    private final CompletableFuture<Integer> exitCode = new CompletableFuture<>();

    private EventLoopGroup group;
    private volatile Channel channel;
    private volatile boolean terminating = false;

    public WorkerClient(int workerId, String host, int port,
                        Function<Consumer<WorkerMessage>, WorkerRuntime> runtimeFactory) {
        this.workerId = workerId;
        this.host = host;
        this.port = port;
        this.runtime = runtimeFactory.apply(this::send);
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "worker-" + workerId + "-exec");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connect, announce readiness and optionally start engine initialisation
     * in the background.
     *
     * @param initialConfig config to initialise the engine with, or null to
     *                      initialise lazily on the first item
     * @return future completing with the exit code
     */
    public CompletableFuture<Integer> start(long pid, Map<String, String> initialConfig) {
        group = new NioEventLoopGroup(1);
        try {
            Bootstrap b = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new LineBasedFrameDecoder(SupervisorServer.MAX_FRAME_LENGTH));
                            p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                            p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                            p.addLast(new Handler());
                        }
                    });
            channel = b.connect(host, port).syncUninterruptibly().channel();
        } catch (Exception e) {
            // connect failures arrive as checked exceptions rethrown by Netty
            log.error("Worker {} cannot connect to supervisor {}:{}: {}", workerId, host, port, e.getMessage());
            finish(EXIT_CONNECT_FAILED);
            return exitCode;
        }

        send(new ReadyMessage(workerId, pid));
        log.info("Worker {} connected to {}:{}", workerId, host, port);

        if (initialConfig != null) {
            submit(() -> runtime.initialize(initialConfig));
        }
        return exitCode;
    }

    public CompletableFuture<Integer> exitCode() {
        return exitCode;
    }

    /** Block until the worker has finished. */
    public int awaitExit() throws InterruptedException {
        try {
            return exitCode.get();
        } catch (ExecutionException e) {
            return EXIT_FATAL;
        }
    }

    public void send(WorkerMessage message) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.debug("Worker {} dropping {}: not connected", workerId, message.getClass().getSimpleName());
            return;
        }
        ch.writeAndFlush(MessageCodec.encode(message) + "\n");
    }

    private void runItem(ExecuteMessage message) {
        try {
            ResultMessage result = runtime.execute(message);
            Channel ch = channel;
            if (ch == null || !ch.isActive()) {
                log.warn("Worker {} lost result for {}: not connected", workerId, message.scenarioId());
                return;
            }
            ChannelFuture write = ch.writeAndFlush(MessageCodec.encode(result) + "\n").awaitUninterruptibly();
            if (!write.isSuccess()) {
                log.warn("Worker {} could not send result for {}: {}", workerId, message.scenarioId(),
                        write.cause() == null ? "unknown" : write.cause().getMessage());
            }
        } catch (VirtualMachineError e) {
            fatal(e);
        }
    }

    private void terminate(String reason) {
        log.info("Worker {} terminating ({})", workerId, reason);
        terminating = true;
        try {
            runtime.close();
        } finally {
            Channel ch = channel;
            if (ch != null) {
                ch.close().syncUninterruptibly();
            }
            finish(EXIT_OK);
        }
    }

    private void fatal(Throwable error) {
        log.error("Worker {} hit a fatal error, exiting", workerId, error);
        terminating = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        }
        finish(EXIT_FATAL);
    }

    /**
     * Stop immediately: drop the connection and interrupt any running item.
     */
    public void kill() {
        terminating = true;
        exec.shutdownNow();
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        finish(EXIT_KILLED);
    }

    private void submit(Runnable task) {
        try {
            exec.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Worker {} is shutting down, ignoring task", workerId);
        }
    }

    private void finish(int code) {
        if (exitCode.complete(code)) {
            exec.shutdown();
            if (group != null) {
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            }
        }
    }

    @Override
    public void close() {
        if (!exitCode.isDone()) {
            kill();
        }
    }

    private final class Handler extends SimpleChannelInboundHandler<String> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            if (line.isBlank()) {
                return;
            }
            WorkerMessage message;
            try {
                message = MessageCodec.decode(line);
            } catch (IllegalArgumentException e) {
                log.warn("Worker {} ignoring malformed message: {}", workerId, e.getMessage());
                return;
            }
            if (message instanceof ExecuteMessage execute) {
                submit(() -> runItem(execute));
            } else if (message instanceof TerminateMessage terminate) {
                submit(() -> terminate(terminate.reason()));
            } else {
                log.debug("Worker {} ignoring {}", workerId, message.getClass().getSimpleName());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            if (!terminating) {
                log.warn("Worker {} lost connection to supervisor", workerId);
                terminating = true;
                submit(runtime::close);
                finish(EXIT_SUPERVISOR_LOST);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Worker {} channel error: {}", workerId, cause.getMessage());
            ctx.close();
        }
    }
}
