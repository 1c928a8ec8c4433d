package io.trading.advstream.netty;

import io.trading.advstream.transport.FrameListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class NettyTransportTest {

    private final NettyTransport transport = new NettyTransport();

    private final FrameListener listener = new FrameListener() {
        @Override
        public void onText(String text) {
        }

        @Override
        public void onPing() {
        }

        @Override
        public void onPong() {
        }

        @Override
        public void onClose(int statusCode, String reason) {
        }

        @Override
        public void onError(Throwable cause) {
        }
    };

    @AfterEach
    void tearDown() {
        transport.close();
    }

    @Test
    void testRejectsUnsupportedScheme() {
        assertThrows(IOException.class, () -> transport.open(URI.create("http://localhost:80"), listener));
    }

    @Test
    void testConnectionRefusedIsIOException() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        assertThrows(IOException.class, () -> transport.open(URI.create("ws://127.0.0.1:" + port), listener));
    }

    @Test
    void testOpenAfterCloseFails() {
        transport.close();

        assertThrows(IOException.class, () -> transport.open(URI.create("ws://127.0.0.1:1"), listener));
    }
}
