package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.ClientClosedException;
import com.github.anirbanmu.tether.config.RestConfig;
import com.github.anirbanmu.tether.log.Log;
import com.github.anirbanmu.tether.util.Json;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

// sends REST requests under discord's per-bucket and global rate limits. a request holds its
// bucket's lock from the first attempt to the last; an emptied bucket stays locked until it
// resets and is released from the timer thread. callers block on their own threads.
public class RequestExecutor implements AutoCloseable {
    private final String token;
    private final RestConfig config;
    private final RestTransport transport;
    private final GlobalRateLimit globalRateLimit = new GlobalRateLimit();
    private final ScheduledExecutorService scheduler;
    private final BucketRegistry buckets;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    public RequestExecutor(String token, RestConfig config) {
        this(token, config, new JdkRestTransport());
    }

    public RequestExecutor(String token, RestConfig config, RestTransport transport) {
        this.token = token;
        this.config = config;
        this.transport = transport;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rest-buckets");
            t.setDaemon(true);
            return t;
        });
        this.buckets = new BucketRegistry(scheduler);
    }

    // decoded body of a successful call: Map/List for json, text otherwise, null when empty
    public Object request(String method, String template, Map<String, ?> params, Object body) {
        RestResponse response = execute(new Route(method, template, params), body);
        try {
            return response.decoded();
        } catch (IOException e) {
            throw new RestTransportException("Malformed JSON in response to " + method + " " + template, e);
        }
    }

    // body is anything Json can serialize, or null. throws HttpException for a final non-2xx,
    // RestTransportException when nothing came back, ClientClosedException once closed
    public RestResponse execute(Route route, Object body) {
        ensureOpen();
        byte[] payload = body == null ? null : Json.toBytes(body);
        RestRequest request = new RestRequest(
            route.method(),
            URI.create(config.baseUrl() + route.path()),
            headers(payload != null),
            payload);

        Bucket bucket = acquire(route);
        try {
            return attempt(route, bucket, request);
        } finally {
            release(bucket);
        }
    }

    public boolean isGloballyRateLimited() {
        return globalRateLimit.isBlocked();
    }

    // the bucket a route currently resolves to, null if none is tracked
    public Bucket bucketFor(Route route) {
        return buckets.lookup(route);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closedLatch.countDown();
        scheduler.shutdownNow();
        globalRateLimit.close();
        buckets.closeAll();
        Log.info("rest.closed");
    }

    private Bucket acquire(Route route) {
        while (true) {
            ensureOpen();
            Bucket bucket = buckets.resolve(route);
            try {
                bucket.acquire();
            } catch (InterruptedException e) {
                buckets.released(bucket);
                Thread.currentThread().interrupt();
                throw new ClientClosedException("Interrupted waiting for bucket " + bucket.key(), e);
            }
            if (!bucket.retired()) {
                return bucket;
            }
            // merged into another route's bucket while we queued; line up there instead
            releaseNow(bucket);
        }
    }

    private RestResponse attempt(Route route, Bucket bucket, RestRequest request) {
        RestResponse last = null;
        int rateLimited = 0;
        int attempt = 0;
        while (attempt < config.maxAttempts()) {
            ensureOpen();
            RestResponse response;
            try {
                globalRateLimit.awaitOpen();
                response = transport.send(request, config.requestTimeout());
            } catch (IOException e) {
                throw new RestTransportException(route.method() + " " + route.template() + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClientClosedException("Interrupted during " + route.method() + " " + route.template(), e);
            }
            last = response;

            String disclosed = bucket.update(response);
            if (disclosed != null) {
                buckets.learn(bucket, disclosed);
            }

            int status = response.status();
            if (status >= 200 && status < 300) {
                return response;
            }
            switch (status) {
                case 400 -> throw new BadRequestException(response);
                case 401 -> throw new UnauthorizedException(response);
                case 403 -> throw new ForbiddenException(response);
                case 404 -> throw new NotFoundException(response);
                case 405 -> throw new MethodNotAllowedException(response);
                default -> {
                }
            }

            if (status == 429) {
                rateLimited++;
                if (rateLimited > config.maxRateLimitRetries()) {
                    throw new HttpException(response, "rate limited " + rateLimited + " times");
                }
                waitOutRateLimit(route, bucket, response);
                continue;
            }
            if (status == 500 || status == 502 || status == 504) {
                attempt++;
                Log.warn("rest.transient_error", "route", route.routeKey(), "status", status, "attempt", attempt);
                if (attempt < config.maxAttempts()) {
                    sleep(config.transientBackoffUnit().multipliedBy(attempt));
                }
                continue;
            }
            if (status >= 500) {
                throw new ServerErrorException(response);
            }
            throw new HttpException(response);
        }
        throw last.status() >= 500 ? new ServerErrorException(last) : new HttpException(last);
    }

    private void waitOutRateLimit(Route route, Bucket bucket, RestResponse response) {
        Map<String, Object> body = rateLimitBody(response);
        Duration retryAfter = retryAfter(response, body);
        boolean global = "true".equalsIgnoreCase(response.header("X-RateLimit-Global"))
            || Boolean.TRUE.equals(body.get("global"));

        if (global) {
            Log.warn("rest.global_rate_limited", "route", route.routeKey(), "retry_after_ms", retryAfter.toMillis());
            globalRateLimit.block(retryAfter);
            try {
                sleep(retryAfter);
            } finally {
                globalRateLimit.clear();
            }
        } else {
            Log.warn("rest.rate_limited", "bucket", bucket.key(), "retry_after_ms", retryAfter.toMillis());
            sleep(retryAfter);
        }
    }

    private static Map<String, Object> rateLimitBody(RestResponse response) {
        if (!response.isJson()) {
            return Map.of();
        }
        try {
            return Json.asObject(response.decoded());
        } catch (IOException e) {
            throw new HttpException(response, "unreadable rate limit body");
        }
    }

    private static Duration retryAfter(RestResponse response, Map<String, Object> body) {
        Object seconds = body.get("retry_after");
        if (seconds instanceof Number n) {
            return Duration.ofNanos((long) (n.doubleValue() * 1_000_000_000L));
        }
        String header = response.header("Retry-After");
        if (header != null) {
            try {
                return Duration.ofNanos((long) (Double.parseDouble(header.trim()) * 1_000_000_000L));
            } catch (NumberFormatException e) {
                throw new HttpException(response, "bad Retry-After header");
            }
        }
        throw new HttpException(response, "429 without retry_after");
    }

    private void release(Bucket bucket) {
        long delay = bucket.exhausted() ? bucket.delayNanos() : 0;
        if (delay > 0 && scheduleRelease(bucket, delay)) {
            Log.debug("rest.release_deferred", "bucket", bucket.key(), "delay_ms", TimeUnit.NANOSECONDS.toMillis(delay));
            return;
        }
        releaseNow(bucket);
    }

    private boolean scheduleRelease(Bucket bucket, long delayNanos) {
        if (closed.get()) {
            return false;
        }
        try {
            scheduler.schedule(() -> releaseNow(bucket), delayNanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void releaseNow(Bucket bucket) {
        bucket.unlock();
        buckets.released(bucket);
    }

    private Map<String, String> headers(boolean hasBody) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bot " + token);
        headers.put("User-Agent", config.userAgent());
        if (hasBody) {
            headers.put("Content-Type", "application/json");
        }
        return headers;
    }

    // returns early with ClientClosedException when close() runs
    private void sleep(Duration duration) {
        try {
            if (closedLatch.await(Math.max(0, duration.toNanos()), TimeUnit.NANOSECONDS)) {
                throw new ClientClosedException("REST client closed while backing off");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientClosedException("Interrupted while backing off", e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ClientClosedException("REST client is closed");
        }
    }
}
