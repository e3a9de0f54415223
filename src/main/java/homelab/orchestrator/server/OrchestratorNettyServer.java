package homelab.orchestrator.server;

import homelab.orchestrator.config.OrchestratorConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP server for the orchestrator API.
 *
 * Controllers may block on SSH, agent calls or wake polling, so the router
 * runs on its own executor group instead of the I/O event loop.
 */
public final class OrchestratorNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int HANDLER_THREADS = 16;

    private final OrchestratorConfig config;
    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;

    public OrchestratorNettyServer(OrchestratorConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
    }

    private ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(handlerGroup, "router", router);
            }
        };
    }

    /**
     * Bind the configured host and port.
     *
     * @return false if binding failed; the server is left stopped
     */
    public synchronized boolean start() {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Orchestrator API listening on {}:{}", config.serverHost(), config.serverPort());
            return true;
        } catch (Exception e) {
            // bind failures surface as undeclared checked exceptions
            log.error("Failed to start server on port {}: {}", config.serverPort(), e.getMessage(), e);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully();
                handlerGroup = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Orchestrator API stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
