package com.github.anirbanmu.tether.log;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

// structured key=value logging. lines are queued and written in batches by a daemon
// thread so gateway and rest threads never block on stdout.
public final class Log {
    private static final Logger logger = System.getLogger("tether");
    private static final BlockingQueue<String> QUEUE = new ArrayBlockingQueue<>(4096);
    private static final OutputStream OUT = new FileOutputStream(FileDescriptor.out);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ISO_INSTANT;

    static {
        Thread drainThread = new Thread(Log::drainLoop, "tether-log-drain");
        drainThread.setDaemon(true);
        drainThread.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            drainThread.interrupt();
            try {
                drainThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "tether-log-flush"));
    }

    private Log() {
    }

    public static void info(String evt, Object... kv) {
        log(Level.INFO, evt, kv, null);
    }

    public static void warn(String evt, Object... kv) {
        log(Level.WARNING, evt, kv, null);
    }

    public static void warn(String evt, Throwable t, Object... kv) {
        log(Level.WARNING, evt, kv, t);
    }

    public static void error(String evt, Throwable t, Object... kv) {
        log(Level.ERROR, evt, kv, t);
    }

    public static void error(String evt, Object... kv) {
        log(Level.ERROR, evt, kv, null);
    }

    public static void debug(String evt, Object... kv) {
        log(Level.DEBUG, evt, kv, null);
    }

    // keeps the last 4 chars of an identifier, enough to correlate log lines
    public static String redact(String secret) {
        if (secret == null) {
            return "null";
        }
        return secret.length() > 4 ? "..." + secret.substring(secret.length() - 4) : "REDACTED";
    }

    private static void drainLoop() {
        List<String> batch = new ArrayList<>(128);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    batch.add(QUEUE.take());
                    QUEUE.drainTo(batch, 127);
                    write(batch);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (IOException e) {
                    System.err.println("PANIC: LOGGING FAILED");
                    e.printStackTrace();
                    batch.clear();
                }
            }
        } finally {
            flushRemaining(batch);
        }
    }

    private static void flushRemaining(List<String> batch) {
        try {
            if (!batch.isEmpty()) {
                write(batch);
            }
            while (!QUEUE.isEmpty()) {
                QUEUE.drainTo(batch, 128);
                write(batch);
            }
        } catch (IOException e) {
            System.err.println("PANIC: FLUSH FAILED");
        }
    }

    private static void write(List<String> batch) throws IOException {
        StringBuilder chunk = new StringBuilder(batch.size() * 128);
        for (String msg : batch) {
            chunk.append(msg).append('\n');
        }
        OUT.write(chunk.toString().getBytes(StandardCharsets.UTF_8));
        batch.clear();
    }

    private static void log(Level level, String evt, Object[] kv, Throwable t) {
        if (!logger.isLoggable(level)) {
            return;
        }

        StringBuilder sb = new StringBuilder(128);
        TIME_FMT.formatTo(Instant.now().truncatedTo(ChronoUnit.MILLIS), sb);
        sb.append(' ').append(level.name())
          .append(" thread=").append(escape(Thread.currentThread().getName()));

        if (evt != null) {
            sb.append(" evt=").append(escape(evt));
        }

        if (kv != null) {
            for (int i = 0; i < kv.length; i += 2) {
                Object value = i + 1 < kv.length ? kv[i + 1] : null;
                sb.append(' ').append(kv[i]).append('=').append(escape(String.valueOf(value)));
            }
        }

        if (t != null) {
            sb.append(" err=").append(escape(t.getClass().getSimpleName()))
              .append(" msg=").append(escape(t.getMessage()));
            StackTraceElement[] trace = t.getStackTrace();
            if (trace.length > 0) {
                sb.append(" loc=").append(escape(trace[0].toString()));
            }
        }

        if (!QUEUE.offer(sb.toString())) {
            // queue full, never block the caller
            System.err.println(sb);
        }
    }

    private static String escape(String s) {
        if (s == null) {
            return "null";
        }
        if (s.isEmpty()) {
            return "\"\"";
        }

        boolean safe = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c == '=' || c == '"') {
                safe = false;
                break;
            }
        }
        if (safe) {
            return s;
        }

        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c == '\n' ? ' ' : c);
        }
        sb.append('"');
        return sb.toString();
    }
}
