package flatkv;

import flatkv.command.CommandInterpreter;
import flatkv.datastore.FileBackedStore;
import flatkv.datastore.KeyValueStore;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accepts client connections on a single boss thread and hands each one to a
 * {@link SessionHandler}. Sessions run on daemon threads: {@link #stop()} closes the
 * listening socket but leaves open sessions running until the process exits.
 */
public class FlatKvServer {

    private static final Logger logger = LoggerFactory.getLogger(FlatKvServer.class);

    private final ServerConfig config;
    private final CommandInterpreter interpreter;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup sessionGroup;
    private Channel serverChannel;

    public FlatKvServer(ServerConfig config) {
        this(config, new FileBackedStore(Paths.get(config.storePath())));
    }

    public FlatKvServer(ServerConfig config, KeyValueStore store) {
        this.config = config;
        this.interpreter = new CommandInterpreter(store);
    }

    /**
     * Binds the listening socket and returns once it is accepting.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public synchronized void start() {
        if (running.get()) {
            throw new IllegalStateException("server already started");
        }

        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("flatkv-accept"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("flatkv-io", true));
        // handlers on an executor group stay pinned to one thread per channel
        sessionGroup = new DefaultEventExecutorGroup(config.sessionThreads(),
                new DefaultThreadFactory("flatkv-session", true));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.readBufferSize()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(sessionGroup, "session", new SessionHandler(interpreter));
                    }
                });

        ChannelFuture future = bootstrap.bind(config.host(), config.port()).awaitUninterruptibly();
        if (!future.isSuccess()) {
            logger.error("Failed to bind to {}:{}", config.host(), config.port(), future.cause());
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            sessionGroup.shutdownGracefully();
            throw new IllegalStateException("Failed to setup server on port " + config.port(), future.cause());
        }

        serverChannel = future.channel();
        running.set(true);
        logger.info("Server listening on {}:{}", config.host(), port());
    }

    /** Blocks until the listening socket is closed by {@link #stop()}. */
    public void awaitStop() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        serverChannel.close().syncUninterruptibly();
        bossGroup.shutdownGracefully();
        logger.info("Server socket closed.");
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
