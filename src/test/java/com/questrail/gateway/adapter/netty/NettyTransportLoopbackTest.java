package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.adapter.ProtocolListener;
import com.questrail.gateway.adapter.ReceiveTimeoutException;
import com.questrail.gateway.adapter.SendFailedException;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayResult;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.GatewayConfig;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.runtime.ProtocolGateway;
import com.questrail.gateway.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTransportLoopbackTest
 * -----------------------------------------------------------------------------
 * Each Netty adapter against its own protocol's Netty listener over loopback.
 *
 * Payloads must cross the wire whole in both directions, failed replies must
 * use the protocol's error form, and deadlines must hold.
 */
class NettyTransportLoopbackTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final NettyProtocolTransportFactory factory =
            new NettyProtocolTransportFactory(TransportSettings.defaults());
    private final List<ProtocolListener> listeners = new ArrayList<>();
    private final List<Runnable> cleanup = new ArrayList<>();

    @AfterEach
    void tearDown() {
        cleanup.forEach(Runnable::run);
        listeners.forEach(ProtocolListener::stop);
        factory.close();
    }

    private InetSocketAddress listen(ProtocolKind kind, Function<Message, InboundReply> handler)
            throws TransportUnavailableException {
        ProtocolListener listener = factory.newListener(kind);
        listeners.add(listener);
        return listener.start(new InetSocketAddress("127.0.0.1", 0), handler::apply);
    }

    private Connection connect(ProtocolKind kind, InetSocketAddress address) throws TransportUnavailableException {
        ProtocolAdapter adapter = factory.adapter(kind);
        Connection connection = adapter.connect(
                Endpoint.of(kind, "127.0.0.1", address.getPort(), 1), TIMEOUT);
        cleanup.add(() -> adapter.disconnect(connection));
        return connection;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    /**
     * Backend that answers {@code slow*} requests only once {@code release}
     * opens.
     */
    private static Function<Message, InboundReply> slowBackend(CountDownLatch release) {
        return m -> {
            String request = text(m.payload());
            if (request.startsWith("slow")) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return InboundReply.ok(bytes("reply-to-" + request));
        };
    }

    @ParameterizedTest
    @EnumSource(ProtocolKind.class)
    void payloadIsEchoedOverLoopback(ProtocolKind kind) throws Exception {
        List<Message> received = new CopyOnWriteArrayList<>();
        InetSocketAddress address = listen(kind, m -> {
            received.add(m);
            return InboundReply.ok(bytes("echo:" + text(m.payload())));
        });
        ProtocolAdapter adapter = factory.adapter(kind);
        Connection connection = connect(kind, address);

        adapter.send(connection, bytes("hello"));
        assertEquals("echo:hello", text(adapter.receive(connection, TIMEOUT)));

        adapter.send(connection, bytes("again"));
        assertEquals("echo:again", text(adapter.receive(connection, TIMEOUT)));

        assertEquals(2, received.size());
        assertEquals(kind, received.get(0).sourceProtocol());
        assertTrue(adapter.isConnected(connection) || kind.isConnectionless());
    }

    @Test
    void tcpFramingKeepsBackToBackPayloadsApart() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.TCP, m -> InboundReply.ok(m.payload()));
        ProtocolAdapter tcp = factory.adapter(ProtocolKind.TCP);
        Connection connection = connect(ProtocolKind.TCP, address);

        tcp.send(connection, bytes("one"));
        tcp.send(connection, bytes("two"));

        assertEquals("one", text(tcp.receive(connection, TIMEOUT)));
        assertEquals("two", text(tcp.receive(connection, TIMEOUT)));
    }

    @Test
    void failedReplyCarriesTheErrorMarkerOnFramedProtocols() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.TCP, m -> InboundReply.failed("backend down"));
        ProtocolAdapter tcp = factory.adapter(ProtocolKind.TCP);
        Connection connection = connect(ProtocolKind.TCP, address);

        tcp.send(connection, bytes("x"));

        assertEquals(InboundReply.ERROR_PREFIX + "backend down", text(tcp.receive(connection, TIMEOUT)));
    }

    @Test
    void failedReplyIsABadGatewayBodyOverHttp() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.HTTP, m -> InboundReply.failed("backend down"));
        ProtocolAdapter http = factory.adapter(ProtocolKind.HTTP);
        Connection connection = connect(ProtocolKind.HTTP, address);

        http.send(connection, bytes("x"));

        assertEquals("backend down", text(http.receive(connection, TIMEOUT)));
        assertEquals(502, NettyHttpListener.toResponse(InboundReply.failed("backend down")).status().code());
        assertEquals(204, NettyHttpListener.toResponse(InboundReply.none()).status().code());
    }

    @Test
    void silentListenerMeansReceiveTimesOut() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.TCP, m -> InboundReply.none());
        ProtocolAdapter tcp = factory.adapter(ProtocolKind.TCP);
        Connection connection = connect(ProtocolKind.TCP, address);

        tcp.send(connection, bytes("anyone?"));

        assertThrows(ReceiveTimeoutException.class, () -> tcp.receive(connection, Duration.ofMillis(200)));
        assertTrue(tcp.isConnected(connection));
    }

    @Test
    void lateReplyCanBeDiscardedBeforeTheNextRequest() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        InetSocketAddress address = listen(ProtocolKind.TCP, slowBackend(release));
        ProtocolAdapter tcp = factory.adapter(ProtocolKind.TCP);
        Connection connection = connect(ProtocolKind.TCP, address);

        tcp.send(connection, bytes("slow-1"));
        assertThrows(ReceiveTimeoutException.class, () -> tcp.receive(connection, Duration.ofMillis(100)));
        release.countDown();
        TimeUnit.MILLISECONDS.sleep(300);

        assertEquals(1, tcp.discardPending(connection));
        tcp.send(connection, bytes("second"));
        assertEquals("reply-to-second", text(tcp.receive(connection, TIMEOUT)));
        assertEquals(0, tcp.discardPending(connection));
    }

    @Test
    void connectToAClosedPortIsRefused() throws Exception {
        ProtocolListener listener = factory.newListener(ProtocolKind.TCP);
        int port = listener.start(new InetSocketAddress("127.0.0.1", 0), m -> InboundReply.none()).getPort();
        listener.stop();

        assertThrows(TransportUnavailableException.class, () -> factory.adapter(ProtocolKind.TCP)
                .connect(Endpoint.of(ProtocolKind.TCP, "127.0.0.1", port, 1), Duration.ofSeconds(2)));
    }

    @Test
    void sendAfterDisconnectFails() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.WEBSOCKET, m -> InboundReply.ok(m.payload()));
        ProtocolAdapter ws = factory.adapter(ProtocolKind.WEBSOCKET);
        Connection connection = connect(ProtocolKind.WEBSOCKET, address);

        ws.disconnect(connection);
        ws.disconnect(connection);

        assertFalse(ws.isConnected(connection));
        assertThrows(SendFailedException.class, () -> ws.send(connection, bytes("late")));
    }

    @Test
    void oversizedPayloadIsRejectedBeforeWriting() throws Exception {
        TransportSettings small = new TransportSettings(Duration.ofSeconds(5), Duration.ofSeconds(5), 16, "/", "/ws", 1);
        NettyProtocolTransportFactory smallFactory = new NettyProtocolTransportFactory(small);
        cleanup.add(smallFactory::close);
        ProtocolListener listener = smallFactory.newListener(ProtocolKind.TCP);
        listeners.add(listener);
        InetSocketAddress address = listener.start(new InetSocketAddress("127.0.0.1", 0), m -> InboundReply.ok(m.payload()));
        ProtocolAdapter tcp = smallFactory.adapter(ProtocolKind.TCP);
        Connection connection = tcp.connect(Endpoint.of(ProtocolKind.TCP, "127.0.0.1", address.getPort(), 1), TIMEOUT);

        assertThrows(SendFailedException.class, () -> tcp.send(connection, new byte[17]));
        tcp.send(connection, new byte[16]);
        assertEquals(16, tcp.receive(connection, TIMEOUT).length);
        tcp.disconnect(connection);
    }

    @Test
    void foreignConnectionIsRefusedByAnotherAdapter() throws Exception {
        InetSocketAddress address = listen(ProtocolKind.TCP, m -> InboundReply.ok(m.payload()));
        Connection tcpConnection = connect(ProtocolKind.TCP, address);

        assertThrows(IllegalArgumentException.class,
                () -> factory.adapter(ProtocolKind.WEBSOCKET).send(tcpConnection, bytes("x")));
        assertFalse(factory.adapter(ProtocolKind.WEBSOCKET).isConnected(tcpConnection));
    }

    @Test
    void gatewayForwardsHttpRequestsToAnHttpBackend() throws Exception {
        InetSocketAddress backend = listen(ProtocolKind.HTTP, m -> InboundReply.ok(bytes("backend:" + text(m.payload()))));

        ProtocolGateway gateway = ProtocolGateway.builder()
                .withConfig(GatewayConfig.builder()
                        .withDefaultProtocol(ProtocolKind.HTTP)
                        .withListener(ProtocolKind.HTTP, "127.0.0.1", 0)
                        .build())
                .build();
        cleanup.add(() -> gateway.shutdown(Duration.ofSeconds(2)));
        assertTrue(gateway.registerEndpoint(Endpoint.of(ProtocolKind.HTTP, "127.0.0.1", backend.getPort(), 1)).value());
        InetSocketAddress front = gateway.listenAll().value().get(ProtocolKind.HTTP);

        ProtocolAdapter http = factory.adapter(ProtocolKind.HTTP);
        Connection client = connect(ProtocolKind.HTTP, front);
        http.send(client, bytes("hi"));

        assertEquals("backend:hi", text(http.receive(client, TIMEOUT)));
        assertEquals(1, gateway.sessions().size());
    }

    @Test
    void gatewayExchangeAfterATimeoutGetsItsOwnReply() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        InetSocketAddress backend = listen(ProtocolKind.TCP, slowBackend(release));

        ProtocolGateway gateway = ProtocolGateway.builder()
                .withConfig(GatewayConfig.builder().withDefaultProtocol(ProtocolKind.TCP).build())
                .build();
        cleanup.add(() -> gateway.shutdown(Duration.ofSeconds(2)));
        assertTrue(gateway.registerEndpoint(Endpoint.of(ProtocolKind.TCP, "127.0.0.1", backend.getPort(), 1)).value());
        GatewayResult<Session> opened = gateway.openSession("slow-backend", ProtocolKind.TCP, Map.of());
        assertTrue(opened.isSuccess(), () -> String.valueOf(opened.error()));
        Session session = opened.value();

        assertTrue(gateway.exchange(session, bytes("slow-1"), Duration.ofMillis(100))
                .hasError(ErrorKind.RECEIVE_TIMEOUT));
        release.countDown();
        TimeUnit.MILLISECONDS.sleep(300);

        GatewayResult<byte[]> second = gateway.exchange(session, bytes("second"), TIMEOUT);

        assertTrue(second.isSuccess(), () -> String.valueOf(second.error()));
        assertEquals("reply-to-second", text(second.value()));
    }
}
