package slate;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import slate.commands.CommandDispatcher;
import slate.db.SlateDatabase;
import slate.network.ClientHandler;
import slate.network.ServerStats;
import slate.protocol.netty.NettyRespDecoder;
import slate.protocol.netty.NettyRespEncoder;
import slate.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the listening socket, the event loops and the keyspace for the life of
 * the process. Every accepted connection gets its own decoder, encoder and
 * handler; all of them share the one {@link SlateDatabase} given here.
 */
public class SlateServer {

    private final Config config;
    private final SlateDatabase db;
    private final CommandDispatcher dispatcher;
    private final ServerStats stats = new ServerStats();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private ScheduledExecutorService monitor;

    public SlateServer(Config config, SlateDatabase db) {
        this.config = config;
        this.db = db;
        this.dispatcher = new CommandDispatcher(db);
    }

    /**
     * Binds the configured address and starts accepting connections.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
         .channel(NioServerSocketChannel.class)
         .childOption(ChannelOption.TCP_NODELAY, true)
         .childHandler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) throws Exception {
                 ch.pipeline().addLast(new NettyRespDecoder());
                 ch.pipeline().addLast(new NettyRespEncoder());
                 ch.pipeline().addLast(new ClientHandler(dispatcher, stats));
             }
         });

        try {
            serverChannel = b.bind(config.bind, config.port).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        Log.info("Server initialized");
        Log.info("Ready to accept connections on " + config.bind + ":" + getPort());

        startMonitor();
    }

    private void startMonitor() {
        if (config.statsInterval <= 0) return;

        monitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Monitor");
            t.setDaemon(true);
            return t;
        });
        final long interval = config.statsInterval;
        final long[] lastCount = {0};
        monitor.scheduleAtFixedRate(() -> {
            long currentCount = stats.getTotalCommands();
            long ops = (currentCount - lastCount[0]) / interval;
            lastCount[0] = currentCount;

            if (ops > 0 || stats.getActiveConnections() > 0) {
                Log.info(statsLine(ops));
            }
        }, interval, interval, TimeUnit.SECONDS);
    }

    String statsLine(long ops) {
        return String.format("[STATS] Clients: %d | Keys: %d | Hits: %d | Misses: %d | OPS: %d cmd/s",
                stats.getActiveConnections(), db.size(), db.getKeyspaceHits(), db.getKeyspaceMisses(), ops);
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ServerStats getStats() {
        return stats;
    }

    public SlateDatabase getDatabase() {
        return db;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void stop() {
        if (monitor != null) monitor.shutdownNow();
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
