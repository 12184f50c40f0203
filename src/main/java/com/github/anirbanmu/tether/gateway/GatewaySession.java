package com.github.anirbanmu.tether.gateway;

import com.github.anirbanmu.tether.ClientClosedException;
import com.github.anirbanmu.tether.config.GatewayConfig;
import com.github.anirbanmu.tether.gateway.json.GatewayDispatch;
import com.github.anirbanmu.tether.gateway.json.GatewayFrame;
import com.github.anirbanmu.tether.gateway.json.Identify;
import com.github.anirbanmu.tether.gateway.json.RequestGuildMembers;
import com.github.anirbanmu.tether.gateway.json.Resume;
import com.github.anirbanmu.tether.log.Log;
import com.github.anirbanmu.tether.util.Json;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

// one logical gateway session. next() yields dispatches; hello, heartbeats, acks and
// reconnects are handled inside the pull. the thread calling next() owns the socket:
// transport callbacks only queue generation-tagged events and the heartbeat timer only
// beats or reports a dead socket. a closed session stays closed
public class GatewaySession implements AutoCloseable {
    private final String token;
    private final String gatewayUrl;
    private final GatewayConfig config;
    private final GatewayTransport transport;
    private final DoubleSupplier jitter;

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService heartbeatScheduler;
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final Object sendLock = new Object();

    private volatile GatewayState state = GatewayState.CONNECTING;
    private volatile Integer sequence;
    private volatile String sessionId;
    private volatile String resumeGatewayUrl;
    private volatile boolean heartbeatAcked = true;
    private volatile long heartbeatIntervalMs;

    private volatile GatewayTransport.Connection connection;
    private volatile ConnectionRateLimiter limiter;
    private volatile ScheduledFuture<?> heartbeatTask;

    // consumer thread only
    private FrameCodec codec;
    private boolean resuming;
    private int failedConnects;
    private GatewayException fatal;

    public GatewaySession(String token, String gatewayUrl, GatewayConfig config, GatewayTransport transport) {
        this(token, gatewayUrl, config, transport, () -> ThreadLocalRandom.current().nextDouble());
    }

    // jitter yields values in [0, 1); it spreads the first heartbeat and invalid-session waits
    public GatewaySession(String token, String gatewayUrl, GatewayConfig config, GatewayTransport transport, DoubleSupplier jitter) {
        this.token = token;
        this.gatewayUrl = gatewayUrl;
        this.config = config;
        this.transport = transport;
        this.jitter = jitter;
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    // opens the first socket. next() calls this itself if needed
    public synchronized void connect() {
        ensureOpen();
        if (connection == null) {
            open(false);
        }
    }

    // blocks for the next dispatch. GatewayClosedException on a non-resumable close,
    // FrameDecodeException on a bad payload, ClientClosedException once closed
    public synchronized GatewayDispatch next() {
        connect();
        while (true) {
            ensureOpen();
            Event event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClientClosedException("Interrupted while waiting for gateway events", e);
            }

            if (event instanceof Shutdown) {
                continue;
            }
            if (event.generation() != generation.get()) {
                continue; // left over from a socket we already replaced
            }

            GatewayDispatch dispatch = handle(event);
            if (dispatch != null) {
                return dispatch;
            }
        }
    }

    public void requestGuildMembers(RequestGuildMembers request) {
        send(Opcode.REQUEST_GUILD_MEMBERS, request.toJson());
    }

    // raw outbound frame through the connection's send budget
    public void send(int op, Object data) {
        if (!sendFrame("{\"op\":" + op + ",\"d\":" + Json.toText(data) + "}")) {
            throw new GatewayException("Gateway is not connected, op " + op + " not sent");
        }
    }

    public GatewayState state() {
        return state;
    }

    public String sessionId() {
        return sessionId;
    }

    public Integer sequence() {
        return sequence;
    }

    public boolean isHealthy() {
        return state == GatewayState.READY && connection != null;
    }

    // sends 1000, which also invalidates the session on discord's side
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        state = GatewayState.CLOSED;
        sessionId = null;
        stopHeartbeat();
        GatewayTransport.Connection c = connection;
        if (c != null) {
            c.close(CloseCodes.NORMAL, "closing");
        }
        heartbeatScheduler.shutdownNow();
        closedLatch.countDown();
        events.offer(new Shutdown());
        Log.info("gateway.session_closed");
    }

    private void ensureOpen() {
        if (fatal != null) {
            throw fatal;
        }
        if (closed.get()) {
            throw new ClientClosedException("Gateway session is closed");
        }
    }

    private GatewayDispatch handle(Event event) {
        try {
            if (event instanceof Text text) {
                return handleFrame(codec.feed(text.text()));
            }
            if (event instanceof Binary binary) {
                return handleFrame(codec.feed(binary.data()));
            }
            if (event instanceof Closed c) {
                handleClosure(c.code(), c.reason());
                return null;
            }
            if (event instanceof Failed f) {
                Log.warn("gateway.transport_error", f.error());
                handleClosure(CloseCodes.TRANSPORT_ERROR, String.valueOf(f.error().getMessage()));
                return null;
            }
            return null;
        } catch (FrameDecodeException e) {
            Log.error("gateway.decode_failed", e);
            throw fail(e);
        }
    }

    private GatewayDispatch handleFrame(Optional<GatewayFrame> decoded) {
        if (decoded.isEmpty()) {
            return null; // partial compressed message
        }
        GatewayFrame frame = decoded.get();
        if (frame.sequence() != null) {
            sequence = frame.sequence();
        }

        switch (frame.op()) {
            case Opcode.DISPATCH -> {
                return onDispatch(frame);
            }
            case Opcode.HEARTBEAT -> sendHeartbeat(generation.get());
            case Opcode.HEARTBEAT_ACK -> heartbeatAcked = true;
            case Opcode.HELLO -> onHello(frame);
            case Opcode.RECONNECT -> {
                Log.info("gateway.reconnect_requested");
                reconnect();
            }
            case Opcode.INVALID_SESSION -> onInvalidSession(frame.dataFlag());
            default -> Log.debug("gateway.unknown_opcode", "op", frame.op());
        }
        return null;
    }

    private GatewayDispatch onDispatch(GatewayFrame frame) {
        Map<String, Object> data = frame.dataObject();
        String type = frame.type();

        if ("READY".equals(type)) {
            sessionId = stringOrNull(data.get("session_id"));
            resumeGatewayUrl = stringOrNull(data.get("resume_gateway_url"));
            markReady();
            Log.info("gateway.ready", "session", Log.redact(sessionId));
        } else if ("RESUMED".equals(type)) {
            markReady();
            Log.info("gateway.resumed", "seq", sequence);
        }

        Integer seq = frame.sequence() != null ? frame.sequence() : sequence;
        return new GatewayDispatch(type, data, seq != null ? seq : 0);
    }

    private void onHello(GatewayFrame frame) {
        Object interval = frame.dataObject().get("heartbeat_interval");
        if (!(interval instanceof Number n) || n.longValue() <= 0) {
            throw new FrameDecodeException("Hello without a usable heartbeat_interval: " + interval);
        }
        heartbeatIntervalMs = n.longValue();
        Log.info("gateway.hello", "interval_ms", heartbeatIntervalMs);
        startHeartbeat(generation.get());

        if (resuming && canResume()) {
            sendResume();
        } else {
            sendIdentify();
        }
    }

    private void onInvalidSession(boolean resumable) {
        Log.info("gateway.invalid_session", "resumable", resumable);
        if (resumable && canResume()) {
            reconnect();
            return;
        }

        sessionId = null;
        sequence = null;
        resumeGatewayUrl = null;

        // discord wants a random 1-5s pause before identifying again
        long min = config.invalidSessionDelayMin().toMillis();
        long max = config.invalidSessionDelayMax().toMillis();
        long delay = min + (long) ((max - min) * jitter.getAsDouble());
        Log.info("gateway.reidentify_scheduled", "delay_ms", delay);
        pause(delay);
        sendIdentify();
    }

    private void handleClosure(int code, String reason) {
        Log.info("gateway.closed", "code", code, "reason", reason);
        if (!config.isResumable(code)) {
            throw fail(new GatewayClosedException(code, reason));
        }
        reconnect();
    }

    private void reconnect() {
        stopHeartbeat();
        GatewayTransport.Connection old = connection;
        connection = null;
        if (old != null) {
            old.close(CloseCodes.RESUMABLE, "reconnecting");
        }
        open(canResume());
    }

    private void open(boolean resume) {
        while (true) {
            ensureOpen();
            state = GatewayState.CONNECTING;
            int gen;
            synchronized (sendLock) {
                gen = generation.incrementAndGet();
                heartbeatAcked = true;
            }
            if (codec != null) {
                codec.close();
            }
            codec = new FrameCodec();
            limiter = new ConnectionRateLimiter(config.sendLimit(), config.sendWindow());
            resuming = resume;

            String base = resume && resumeGatewayUrl != null ? resumeGatewayUrl : gatewayUrl;
            URI uri = URI.create(config.connectUrl(base));
            Log.info("gateway.connecting", "url", uri, "resume", resume, "generation", gen);
            try {
                GatewayTransport.Connection opened = transport.connect(uri, new Listener(gen), config.connectTimeout());
                if (closed.get()) {
                    opened.abort();
                    throw new ClientClosedException("Gateway session closed while connecting");
                }
                connection = opened;
                state = GatewayState.AWAITING_HELLO;
                Log.info("gateway.connected", "generation", gen);
                return;
            } catch (IOException e) {
                failedConnects++;
                Log.warn("gateway.connect_failed", e, "attempt", failedConnects);
                int max = config.maxReconnectAttempts();
                if (max > 0 && failedConnects >= max) {
                    throw fail(new GatewayException("Gave up connecting after " + failedConnects + " attempts", e));
                }
                pause(backoffMillis(failedConnects));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClientClosedException("Interrupted while connecting", e);
            }
        }
    }

    private long backoffMillis(int attempt) {
        long base = config.reconnectBaseDelay().toMillis();
        long max = config.reconnectMaxDelay().toMillis();
        return Math.min(base * (1L << Math.min(attempt - 1, 8)), max);
    }

    private void startHeartbeat(int gen) {
        stopHeartbeat();
        long interval = heartbeatIntervalMs;
        long initialDelay = (long) (interval * jitter.getAsDouble());
        heartbeatTask = heartbeatScheduler.scheduleAtFixedRate(
            () -> heartbeatTick(gen), initialDelay, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        heartbeatTask = null;
        if (task != null) {
            task.cancel(false);
        }
    }

    private void heartbeatTick(int gen) {
        try {
            if (gen != generation.get() || closed.get()) {
                return;
            }
            if (!heartbeatAcked) {
                // zombied connection: no ack since the last beat
                Log.warn("gateway.heartbeat_timeout", "interval_ms", heartbeatIntervalMs);
                ScheduledFuture<?> task = heartbeatTask;
                if (task != null) {
                    task.cancel(false);
                }
                GatewayTransport.Connection c = connection;
                if (c != null) {
                    c.abort();
                }
                events.offer(new Closed(gen, CloseCodes.ZOMBIED, "heartbeat not acknowledged"));
                return;
            }
            sendHeartbeat(gen);
        } catch (RuntimeException e) {
            // an escaping exception would silently cancel the fixed-rate task
            Log.error("gateway.heartbeat_error", e);
        }
    }

    // a beat from a replaced socket's timer neither sends nor touches the new socket's ack flag
    private void sendHeartbeat(int gen) {
        synchronized (sendLock) {
            if (gen != generation.get()) {
                return;
            }
            Integer seq = sequence;
            heartbeatAcked = false;
            sendFrame(gen, "{\"op\":" + Opcode.HEARTBEAT + ",\"d\":" + (seq == null ? "null" : seq) + "}");
        }
    }

    private void sendIdentify() {
        state = GatewayState.IDENTIFYING;
        if (sendFrame("{\"op\":" + Opcode.IDENTIFY + ",\"d\":" + Json.toText(Identify.create(token, config).toJson()) + "}")) {
            Log.info("gateway.identify_sent", "shard", config.isSharded() ? config.shardId() + "/" + config.shardCount() : "none");
        }
    }

    private void sendResume() {
        state = GatewayState.RESUMING;
        Resume resume = new Resume(token, sessionId, sequence);
        if (sendFrame("{\"op\":" + Opcode.RESUME + ",\"d\":" + Json.toText(resume) + "}")) {
            Log.info("gateway.resume_sent", "session", Log.redact(sessionId), "seq", resume.seq());
        }
    }

    private boolean sendFrame(String payload) {
        return sendFrame(generation.get(), payload);
    }

    // false when there is no socket, the socket is no longer generation gen, or the write
    // failed; a failed write is reported as a transport error so the consumer thread reconnects
    private boolean sendFrame(int gen, String payload) {
        synchronized (sendLock) {
            GatewayTransport.Connection c = connection;
            ConnectionRateLimiter l = limiter;
            if (c == null || gen != generation.get() || closed.get()) {
                return false;
            }
            try {
                l.acquire();
                c.sendText(payload);
                return true;
            } catch (IOException e) {
                Log.warn("gateway.send_failed", e);
                events.offer(new Failed(gen, e));
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private void markReady() {
        state = GatewayState.READY;
        failedConnects = 0;
    }

    private boolean canResume() {
        return sessionId != null && sequence != null;
    }

    private void pause(long millis) {
        try {
            if (closedLatch.await(millis, TimeUnit.MILLISECONDS)) {
                throw new ClientClosedException("Gateway session is closed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientClosedException("Interrupted while waiting to reconnect", e);
        }
    }

    private GatewayException fail(GatewayException e) {
        fatal = e;
        state = GatewayState.CLOSED;
        closed.set(true);
        stopHeartbeat();
        GatewayTransport.Connection c = connection;
        if (c != null) {
            c.abort();
        }
        heartbeatScheduler.shutdownNow();
        closedLatch.countDown();
        return e;
    }

    private static String stringOrNull(Object value) {
        return value instanceof String s ? s : null;
    }

    private final class Listener implements GatewayTransport.Listener {
        private final int gen;

        Listener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            events.offer(new Text(gen, text));
        }

        @Override
        public void onBinary(byte[] data) {
            events.offer(new Binary(gen, data));
        }

        @Override
        public void onClose(int code, String reason) {
            events.offer(new Closed(gen, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            events.offer(new Failed(gen, error));
        }
    }

    private sealed interface Event permits Text, Binary, Closed, Failed, Shutdown {
        int generation();
    }

    private record Text(int generation, String text) implements Event {
    }

    private record Binary(int generation, byte[] data) implements Event {
    }

    private record Closed(int generation, int code, String reason) implements Event {
    }

    private record Failed(int generation, Throwable error) implements Event {
    }

    private record Shutdown() implements Event {
        @Override
        public int generation() {
            return -1;
        }
    }
}
