package io.trading.advstream.netty;

import io.netty.channel.EventLoopGroup;
import io.trading.advstream.transport.FrameListener;
import io.trading.advstream.transport.TransportSession;
import io.trading.advstream.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * {@link WebSocketTransport} backed by Netty. All sessions share one event loop group.
 */
public class NettyTransport implements WebSocketTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransport.class);

    private final EventLoopGroup eventLoopGroup;

    public NettyTransport() {
        this(1);
    }

    /**
     * @param ioThreads Number of Netty I/O threads shared by all sessions
     */
    public NettyTransport(int ioThreads) {
        this.eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(ioThreads, "stream-io");
    }

    @Override
    public TransportSession open(URI uri, FrameListener listener) throws IOException, InterruptedException {
        if (eventLoopGroup.isShuttingDown()) {
            throw new IOException("Transport is closed");
        }
        WebSocketClient client = new WebSocketClient(uri, uri.getHost(), eventLoopGroup, listener);
        client.connect();
        return client;
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully();
        LOGGER.info("Netty transport closed");
    }
}
