package com.github.anirbanmu.tether.gateway;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.tether.ClientClosedException;
import com.github.anirbanmu.tether.config.GatewayConfig;
import com.github.anirbanmu.tether.gateway.FakeGatewayTransport.FakeConnection;
import com.github.anirbanmu.tether.gateway.json.GatewayDispatch;
import com.github.anirbanmu.tether.gateway.json.GatewayFrame;
import com.github.anirbanmu.tether.gateway.json.RequestGuildMembers;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class GatewaySessionTest {
    private static final String TOKEN = "test-token";
    private static final String GATEWAY = "wss://gateway.example";
    private static final String RESUME = "wss://resume.example";

    private final FakeGatewayTransport transport = new FakeGatewayTransport();
    private GatewaySession session;

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.close();
        }
    }

    private static GatewayConfig config(boolean compression, int maxReconnectAttempts) {
        return new GatewayConfig(
            513,
            50,
            compression,
            false,
            null,
            null,
            10,
            120,
            Duration.ofSeconds(60),
            CloseCodes.DEFAULT_NON_RESUMABLE,
            Duration.ofMillis(10),
            Duration.ofMillis(20),
            Duration.ofMillis(5),
            Duration.ofMillis(20),
            maxReconnectAttempts,
            Duration.ofSeconds(1));
    }

    private GatewaySession session(double jitter) {
        session = new GatewaySession(TOKEN, GATEWAY, config(false, 0), transport, () -> jitter);
        return session;
    }

    private static int intField(GatewayFrame frame, String key) {
        return ((Number) frame.dataObject().get(key)).intValue();
    }

    @Test
    void identifiesAndDeliversDispatchesInOrder() {
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
                c.ack();
                c.dispatch("MESSAGE_CREATE", 2, "{\"id\":\"a\"}");
                c.serverText("{\"op\":1,\"d\":null}");
                c.dispatch("MESSAGE_CREATE", 3, "{\"id\":\"b\"}");
            }
        };
        GatewaySession s = session(0.5);

        GatewayDispatch ready = s.next();
        assertEquals("READY", ready.type());
        assertEquals(1, ready.sequence());
        assertEquals(GatewayState.READY, s.state());
        assertEquals("sess-1", s.sessionId());

        GatewayDispatch first = s.next();
        GatewayDispatch second = s.next();
        assertEquals(2, first.sequence());
        assertEquals("a", first.data().get("id"));
        assertEquals(3, second.sequence());
        assertEquals("b", second.data().get("id"));
        assertEquals(3, s.sequence());

        FakeConnection c = transport.connection(0);
        assertEquals(GATEWAY + "/?v=10&encoding=json", c.uri.toString());
        GatewayFrame identify = c.firstSent(Opcode.IDENTIFY);
        assertEquals(TOKEN, identify.dataObject().get("token"));
        assertEquals(513, intField(identify, "intents"));
        assertEquals(50, intField(identify, "large_threshold"));
        assertFalse(identify.dataObject().containsKey("shard"));
        // the server's op 1 was answered straight away
        assertNotNull(c.firstSent(Opcode.HEARTBEAT));
        assertTrue(s.isHealthy());
    }

    @Test
    void reconnectRequestResumesWithSessionAndSequence() {
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
                c.dispatch("GUILD_CREATE", 5, "{}");
                c.serverText("{\"op\":7,\"d\":null}");
            } else if (f.op() == Opcode.RESUME) {
                c.dispatch("RESUMED", 6, "{}");
            }
        };
        GatewaySession s = session(0.5);

        assertEquals("READY", s.next().type());
        assertEquals(5, s.next().sequence());
        GatewayDispatch resumed = s.next();
        assertEquals("RESUMED", resumed.type());

        assertEquals(2, transport.connections.size());
        FakeConnection first = transport.connection(0);
        FakeConnection second = transport.connection(1);
        assertEquals(CloseCodes.RESUMABLE, first.closeCode);
        assertTrue(second.uri.toString().startsWith(RESUME));

        GatewayFrame resume = second.firstSent(Opcode.RESUME);
        assertNotNull(resume);
        assertEquals("sess-1", resume.dataObject().get("session_id"));
        assertEquals(5, intField(resume, "seq"));
        assertEquals(TOKEN, resume.dataObject().get("token"));
        assertNull(second.firstSent(Opcode.IDENTIFY));
        assertEquals(GatewayState.READY, s.state());
    }

    @Test
    void nonResumableCloseIsFatal() {
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.serverClose(CloseCodes.AUTHENTICATION_FAILED, "Authentication failed.");
            }
        };
        GatewaySession s = session(0.5);

        GatewayClosedException e = assertThrows(GatewayClosedException.class, s::next);
        assertEquals(4004, e.closeCode());
        assertEquals(GatewayState.CLOSED, s.state());
        assertEquals(1, transport.connectUris.size());
        assertTrue(transport.connection(0).aborted);

        // stays closed
        assertThrows(GatewayClosedException.class, s::next);
        assertEquals(1, transport.connectUris.size());
    }

    @Test
    void resumableCloseReconnectsAndResumes() {
        AtomicInteger identifies = new AtomicInteger();
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                identifies.incrementAndGet();
                c.ready(1, "sess-1", RESUME);
                c.serverClose(CloseCodes.UNKNOWN_ERROR, "oops");
            } else if (f.op() == Opcode.RESUME) {
                c.dispatch("RESUMED", 2, "{}");
            }
        };
        GatewaySession s = session(0.5);

        assertEquals("READY", s.next().type());
        assertEquals("RESUMED", s.next().type());
        assertEquals(1, identifies.get());
        assertEquals(2, transport.connections.size());
    }

    @Test
    void unackedHeartbeatAbortsAndResumes() {
        transport.onConnect = c -> c.hello(50);
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            } else if (f.op() == Opcode.RESUME) {
                c.dispatch("RESUMED", 2, "{}");
            }
            // heartbeats are never acked
        };
        GatewaySession s = session(0.0);

        assertEquals("READY", s.next().type());
        long start = System.nanoTime();
        assertEquals("RESUMED", s.next().type());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        FakeConnection dead = transport.connection(0);
        assertTrue(dead.aborted);
        assertTrue(dead.sentOps().contains(Opcode.HEARTBEAT));
        assertNotNull(transport.connection(1).firstSent(Opcode.RESUME));
        assertTrue(elapsedMs < 2_000, "zombie detection took " + elapsedMs + "ms");
    }

    @Test
    void ackedHeartbeatsKeepConnection() throws Exception {
        transport.onConnect = c -> c.hello(100);
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            } else if (f.op() == Opcode.HEARTBEAT) {
                c.ack();
            }
        };
        GatewaySession s = session(0.0);
        assertEquals("READY", s.next().type());

        CompletableFuture<GatewayDispatch> pending = CompletableFuture.supplyAsync(s::next);
        Thread.sleep(450);
        assertEquals(1, transport.connections.size());
        assertTrue(transport.connection(0).sentOps().stream().filter(op -> op == Opcode.HEARTBEAT).count() >= 3);

        transport.connection(0).dispatch("TYPING_START", 2, "{}");
        assertEquals("TYPING_START", pending.get(5, TimeUnit.SECONDS).type());
    }

    @Test
    void invalidSessionWithoutResumeIdentifiesAgain() {
        AtomicInteger identifies = new AtomicInteger();
        transport.onSend = (c, f) -> {
            if (f.op() != Opcode.IDENTIFY) {
                return;
            }
            if (identifies.incrementAndGet() == 1) {
                c.ready(1, "sess-1", RESUME);
                c.serverText("{\"op\":9,\"d\":false}");
            } else {
                c.ready(1, "sess-2", RESUME);
            }
        };
        GatewaySession s = session(0.5);

        assertEquals("READY", s.next().type());
        assertEquals("sess-1", s.sessionId());
        assertEquals("READY", s.next().type());
        assertEquals("sess-2", s.sessionId());

        assertEquals(2, identifies.get());
        assertEquals(1, transport.connections.size());
        assertNull(transport.connection(0).firstSent(Opcode.RESUME));
    }

    @Test
    void invalidSessionResumableReconnects() {
        AtomicInteger invalidated = new AtomicInteger();
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(3, "sess-1", RESUME);
                if (invalidated.getAndIncrement() == 0) {
                    c.serverText("{\"op\":9,\"d\":true}");
                }
            } else if (f.op() == Opcode.RESUME) {
                c.dispatch("RESUMED", 4, "{}");
            }
        };
        GatewaySession s = session(0.5);

        assertEquals("READY", s.next().type());
        assertEquals("RESUMED", s.next().type());
        assertEquals(2, transport.connections.size());
        assertEquals(3, intField(transport.connection(1).firstSent(Opcode.RESUME), "seq"));
    }

    @Test
    void compressedTransportDecodesChunkedFrames() {
        ZlibStream server = new ZlibStream();
        transport.onConnect = c -> {
            byte[] hello = server.compress("{\"op\":10,\"d\":{\"heartbeat_interval\":45000}}");
            int mid = hello.length / 2;
            c.listener.onBinary(Arrays.copyOfRange(hello, 0, mid));
            c.listener.onBinary(Arrays.copyOfRange(hello, mid, hello.length));
        };
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.listener.onBinary(server.compress(
                    "{\"op\":0,\"s\":1,\"t\":\"READY\",\"d\":{\"session_id\":\"z\",\"resume_gateway_url\":\"" + RESUME + "\"}}"));
            }
        };
        session = new GatewaySession(TOKEN, GATEWAY, config(true, 0), transport, () -> 0.5);

        assertEquals("READY", session.next().type());
        assertTrue(transport.connection(0).uri.toString().endsWith("&compress=zlib-stream"));
    }

    @Test
    void closeWakesBlockedPull() throws Exception {
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            }
        };
        GatewaySession s = session(0.5);
        assertEquals("READY", s.next().type());

        CompletableFuture<GatewayDispatch> pending = CompletableFuture.supplyAsync(s::next);
        Thread.sleep(100);
        s.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ClientClosedException.class, e.getCause());
        assertEquals(CloseCodes.NORMAL, transport.connection(0).closeCode);
        assertEquals(GatewayState.CLOSED, s.state());
        assertNull(s.sessionId());
        assertFalse(s.isHealthy());
    }

    @Test
    void givesUpAfterMaxConnectAttempts() {
        transport.failuresLeft = 10;
        session = new GatewaySession(TOKEN, GATEWAY, config(false, 3), transport, () -> 0.5);

        GatewayException e = assertThrows(GatewayException.class, session::next);
        assertFalse(e instanceof GatewayClosedException);
        assertEquals(3, transport.connectUris.size());
        assertEquals(GatewayState.CLOSED, session.state());
    }

    @Test
    void connectFailuresAreRetried() {
        transport.failuresLeft = 2;
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            }
        };
        GatewaySession s = session(0.5);

        assertEquals("READY", s.next().type());
        assertEquals(3, transport.connectUris.size());
        assertEquals(1, transport.connections.size());
    }

    @Test
    void heartbeatsFromReplacedSocketsNeverReachTheNewOne() throws Exception {
        transport.onConnect = c -> c.hello(20);
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.HEARTBEAT) {
                c.ack();
            } else if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            } else if (f.op() == Opcode.RESUME) {
                c.dispatch("RESUMED", 2, "{}");
            }
        };
        GatewaySession s = session(0.9);

        assertEquals("READY", s.next().type());
        for (int i = 0; i < 20; i++) {
            Thread.sleep(15);
            transport.connection(transport.connections.size() - 1).serverText("{\"op\":7,\"d\":null}");
            assertEquals("RESUMED", s.next().type());
        }

        // every socket starts with identify or resume, never a beat left over from the last one
        for (FakeConnection c : transport.connections) {
            assertFalse(c.sent.isEmpty());
            int first = c.sent.get(0).op();
            assertTrue(first == Opcode.IDENTIFY || first == Opcode.RESUME, "first op was " + first);
        }
    }

    @Test
    void requestGuildMembersSendsOpcode8() {
        transport.onSend = (c, f) -> {
            if (f.op() == Opcode.IDENTIFY) {
                c.ready(1, "sess-1", RESUME);
            }
        };
        GatewaySession s = session(0.5);
        assertEquals("READY", s.next().type());

        s.requestGuildMembers(RequestGuildMembers.byUserIds("42", List.of("7", "8")).withNonce("n1"));

        GatewayFrame frame = transport.connection(0).firstSent(Opcode.REQUEST_GUILD_MEMBERS);
        assertNotNull(frame);
        Map<String, Object> d = frame.dataObject();
        assertEquals("42", d.get("guild_id"));
        assertEquals(List.of("7", "8"), d.get("user_ids"));
        assertEquals("n1", d.get("nonce"));
        assertFalse(d.containsKey("query"));
    }

    @Test
    void sendBeforeConnectFails() {
        GatewaySession s = session(0.5);
        assertThrows(GatewayException.class, () -> s.send(Opcode.PRESENCE_UPDATE, Map.of("status", "online")));
    }
}
