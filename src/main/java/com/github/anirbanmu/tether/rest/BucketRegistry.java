package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.log.Log;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

// maps routes to buckets. a route starts under a provisional key from its route key and the
// same Bucket moves to the real key once discord discloses it. buckets nobody holds or waits
// on are dropped after their reset
final class BucketRegistry {
    private final ScheduledExecutorService scheduler;

    // guarded by this
    private final Map<String, Bucket> buckets = new HashMap<>();
    private final Map<String, String> routeBuckets = new HashMap<>();
    private final List<Bucket> retired = new ArrayList<>();

    BucketRegistry(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    // the caller must eventually call released() for the returned bucket
    synchronized Bucket resolve(Route route) {
        String id = routeBuckets.getOrDefault(route.routeKey(), route.routeKey());
        String key = Bucket.key(id, route.majorKey());
        Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(route.routeKey(), route.majorKey(), k));
        bucket.pending++;
        return bucket;
    }

    synchronized void learn(Bucket bucket, String bucketId) {
        routeBuckets.put(bucket.routeKey(), bucketId);
        String oldKey = bucket.key();
        String newKey = Bucket.key(bucketId, bucket.majorKey());
        if (newKey.equals(oldKey)) {
            return;
        }
        if (buckets.get(oldKey) == bucket) {
            buckets.remove(oldKey);
        }
        bucket.rekey(newKey);
        // another route with the same bucket may have been migrated already; it keeps the slot
        Bucket owner = buckets.putIfAbsent(newKey, bucket);
        if (owner != null && owner != bucket) {
            bucket.retire();
            retired.add(bucket);
            Log.warn("rest.bucket_shared", "route", bucket.routeKey(), "bucket", newKey, "owner", owner.routeKey());
            return;
        }
        Log.debug("rest.bucket_learned", "route", bucket.routeKey(), "bucket", newKey);
    }

    synchronized void released(Bucket bucket) {
        bucket.pending--;
        if (bucket.pending > 0) {
            return;
        }
        long delay = bucket.delayNanos();
        if (delay <= 0) {
            expire(bucket);
            return;
        }
        try {
            scheduler.schedule(() -> {
                synchronized (this) {
                    expire(bucket);
                }
            }, delay, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            expire(bucket);
        }
    }

    synchronized Bucket lookup(Route route) {
        String id = routeBuckets.getOrDefault(route.routeKey(), route.routeKey());
        return buckets.get(Bucket.key(id, route.majorKey()));
    }

    // wakes anything still waiting on a bucket lock and forgets every bucket
    synchronized void closeAll() {
        List<Bucket> all = new ArrayList<>(buckets.values());
        all.addAll(retired);
        buckets.clear();
        retired.clear();
        for (Bucket bucket : all) {
            bucket.abandon();
        }
    }

    // caller holds this
    private void expire(Bucket bucket) {
        if (bucket.retired()) {
            if (bucket.pending <= 0) {
                retired.remove(bucket);
            }
            return;
        }
        if (bucket.pending > 0 || bucket.delayNanos() > 0) {
            return;
        }
        String key = bucket.key();
        if (buckets.get(key) == bucket) {
            buckets.remove(key);
        }
    }
}
