package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class EndpointStreamTest {

    @Test
    void testFramesBeforeAttachAreKeptInOrder() throws InterruptedException {
        EndpointStream stream = new EndpointStream(EnumSet.of(EndpointKind.PUBLIC));
        InboundStream inbound = new InboundStream(EndpointKind.PUBLIC, 1);

        inbound.onText("first");
        inbound.onPing();
        stream.attach(inbound);
        inbound.onText("second");

        assertEquals("first", stream.next().text());
        assertEquals(InboundFrame.FrameType.PING, stream.next().type());
        InboundFrame last = stream.next();
        assertEquals("second", last.text());
        assertEquals(1, last.generation());
        assertEquals(EndpointKind.PUBLIC, last.endpoint());
    }

    @Test
    void testMergesEndpoints() throws InterruptedException {
        EndpointStream stream = new EndpointStream(EnumSet.allOf(EndpointKind.class));
        InboundStream publicInbound = new InboundStream(EndpointKind.PUBLIC, 1);
        InboundStream userInbound = new InboundStream(EndpointKind.USER, 1);
        stream.attach(publicInbound);
        stream.attach(userInbound);

        userInbound.onClose(1000, "bye");
        publicInbound.onError(new IllegalStateException("boom"));

        InboundFrame close = stream.next();
        assertEquals(EndpointKind.USER, close.endpoint());
        assertTrue(close.isTerminal());
        assertEquals(1000, close.statusCode());

        InboundFrame error = stream.next();
        assertEquals(EndpointKind.PUBLIC, error.endpoint());
        assertEquals(InboundFrame.FrameType.ERROR, error.type());
        assertInstanceOf(IllegalStateException.class, error.cause());
    }

    @Test
    void testCloseEndsStream() throws InterruptedException {
        EndpointStream stream = new EndpointStream(EnumSet.of(EndpointKind.PUBLIC));
        InboundStream inbound = new InboundStream(EndpointKind.PUBLIC, 1);
        stream.attach(inbound);
        inbound.onText("dropped");

        stream.close();
        inbound.onText("ignored");

        assertTrue(stream.isClosed());
        assertNull(stream.next());
        assertNull(stream.next());
        assertNull(stream.poll(Duration.ofMillis(10)));
    }

    @Test
    void testPollTimesOut() throws InterruptedException {
        EndpointStream stream = new EndpointStream(EnumSet.of(EndpointKind.USER));

        assertNull(stream.poll(Duration.ofMillis(10)));
        assertFalse(stream.isClosed());
    }
}
