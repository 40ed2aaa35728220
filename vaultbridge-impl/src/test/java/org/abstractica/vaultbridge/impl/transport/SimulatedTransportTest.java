package org.abstractica.vaultbridge.impl.transport;

import org.abstractica.vaultbridge.TransportException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimulatedTransport.
 */
class SimulatedTransportTest
{
    private static final URI URI_UNDER_TEST = URI.create("ws://localhost:19455");

    private static class RecordingListener implements TransportListener
    {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final List<String> closes = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onMessage(String message)
        {
            messages.add(message);
        }

        @Override
        public void onClose(int statusCode, String reason)
        {
            closes.add(statusCode + ":" + reason);
        }

        @Override
        public void onError(Throwable error)
        {
            errors.add(error);
        }
    }

    @Test
    void connect_opensTransport()
    {
        SimulatedTransport transport = new SimulatedTransport();

        transport.connect(URI_UNDER_TEST, new RecordingListener()).join();

        assertTrue(transport.isOpen());
        assertEquals(1, transport.getConnectCount());
        assertEquals(URI_UNDER_TEST, transport.getLastUri());
    }

    @Test
    void connect_failureIsReportedAsTransportException()
    {
        SimulatedTransport transport = new SimulatedTransport();
        transport.setConnectFailure(new IOException("refused"), 1);

        CompletableFuture<Void> first = transport.connect(URI_UNDER_TEST, new RecordingListener());
        ExecutionException e = assertThrows(ExecutionException.class, first::get);
        assertInstanceOf(TransportException.class, e.getCause());
        assertFalse(transport.isOpen());

        // Only one failure was injected
        transport.connect(URI_UNDER_TEST, new RecordingListener()).join();
        assertTrue(transport.isOpen());
        assertEquals(2, transport.getConnectCount());
    }

    @Test
    void send_recordsOutboundAndCallsPeer() throws Exception
    {
        SimulatedTransport transport = new SimulatedTransport();
        List<String> seenByPeer = new CopyOnWriteArrayList<>();
        transport.setPeer(seenByPeer::add);
        transport.connect(URI_UNDER_TEST, new RecordingListener()).join();

        transport.send("hello").join();

        assertEquals(List.of("hello"), seenByPeer);
        assertEquals("hello", transport.takeSent(Duration.ofSeconds(1)));
        assertTrue(transport.drainSent().isEmpty());
    }

    @Test
    void send_failsWhenClosed()
    {
        SimulatedTransport transport = new SimulatedTransport();

        ExecutionException e = assertThrows(ExecutionException.class, () -> transport.send("x").get());
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void send_failureInjection()
    {
        SimulatedTransport transport = new SimulatedTransport();
        transport.connect(URI_UNDER_TEST, new RecordingListener()).join();
        transport.setSendFailure(new IOException("broken pipe"));

        assertThrows(ExecutionException.class, () -> transport.send("x").get());

        transport.setSendFailure(null);
        transport.send("y").join();
        assertEquals(List.of("y"), transport.drainSent());
    }

    @Test
    void deliver_reachesListener()
    {
        SimulatedTransport transport = new SimulatedTransport();
        RecordingListener listener = new RecordingListener();
        transport.connect(URI_UNDER_TEST, listener).join();

        transport.deliver("{\"type\":\"pong\"}");

        assertEquals(List.of("{\"type\":\"pong\"}"), listener.messages);
    }

    @Test
    void deliver_failsWhenNotConnected()
    {
        SimulatedTransport transport = new SimulatedTransport();

        assertThrows(IllegalStateException.class, () -> transport.deliver("x"));
    }

    @Test
    void close_notifiesListenerOnce()
    {
        SimulatedTransport transport = new SimulatedTransport();
        RecordingListener listener = new RecordingListener();
        transport.connect(URI_UNDER_TEST, listener).join();

        transport.close();
        transport.close();

        assertFalse(transport.isOpen());
        assertEquals(1, listener.closes.size());
    }

    @Test
    void closeFromPeer_reportsCodeAndReason()
    {
        SimulatedTransport transport = new SimulatedTransport();
        RecordingListener listener = new RecordingListener();
        transport.connect(URI_UNDER_TEST, listener).join();

        transport.closeFromPeer(1001, "Going away");

        assertEquals(List.of("1001:Going away"), listener.closes);
        assertFalse(transport.isOpen());
    }

    @Test
    void fail_reportsError()
    {
        SimulatedTransport transport = new SimulatedTransport();
        RecordingListener listener = new RecordingListener();
        transport.connect(URI_UNDER_TEST, listener).join();

        transport.fail(new IOException("reset"));

        assertEquals(1, listener.errors.size());
        assertTrue(listener.closes.isEmpty());
        assertFalse(transport.isOpen());
    }
}
