package io.trading.advstream.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the native epoll transport where Netty can load it and NIO everywhere else.
 * Event loop groups and client channels always come from the same flavour.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean NATIVE = Epoll.isAvailable();

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an event loop group of daemon I/O threads named {@code threadName-N}.
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String threadName) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(threadName, true);
        LOGGER.info("Starting {} {} I/O thread(s) for {}", threads, NATIVE ? "epoll" : "NIO", threadName);
        return NATIVE
            ? new EpollEventLoopGroup(threads, threadFactory)
            : new NioEventLoopGroup(threads, threadFactory);
    }

    /**
     * Client socket channel class matching {@link #createEventLoopGroup(int, String)}.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        return NATIVE ? EpollSocketChannel.class : NioSocketChannel.class;
    }
}
