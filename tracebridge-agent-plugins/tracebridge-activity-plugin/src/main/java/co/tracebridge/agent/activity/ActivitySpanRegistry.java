/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.activity;

import co.tracebridge.agent.impl.transaction.AbstractSpan;
import co.tracebridge.agent.impl.transaction.Id;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Maps the ids of in-flight activities to the spans which have been created for them.
 * <p>
 * Activities which have been dropped by the instrumentation after they have been started never end.
 * {@link #pruneIfNeeded()} removes their entries, at most once per pruning interval.
 * </p>
 */
public class ActivitySpanRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ActivitySpanRegistry.class);

    private final ConcurrentMap<Id, Entry> entries = new ConcurrentHashMap<>();
    private final long pruningIntervalNanos;
    private final LongSupplier nanoClock;
    private final AtomicLong lastPruned;

    public ActivitySpanRegistry(long pruningIntervalMillis) {
        this(TimeUnit.MILLISECONDS.toNanos(pruningIntervalMillis), new LongSupplier() {
            @Override
            public long getAsLong() {
                return System.nanoTime();
            }
        });
    }

    ActivitySpanRegistry(long pruningIntervalNanos, LongSupplier nanoClock) {
        this.pruningIntervalNanos = pruningIntervalNanos;
        this.nanoClock = nanoClock;
        this.lastPruned = new AtomicLong(nanoClock.getAsLong());
    }

    /**
     * @return {@code false} if there already is an entry for the activity
     */
    public boolean register(Activity activity, AbstractSpan<?> span) {
        return entries.putIfAbsent(activity.getSpanId(), new Entry(activity, span)) == null;
    }

    @Nullable
    public AbstractSpan<?> get(Id spanId) {
        Entry entry = entries.get(spanId);
        return entry != null ? entry.getSpan() : null;
    }

    @Nullable
    public Entry remove(Id spanId) {
        return entries.remove(spanId);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Sweeps the registry if the pruning interval has elapsed since the last sweep.
     * Only one of several concurrent callers performs the sweep.
     *
     * @return the number of removed entries
     */
    public int pruneIfNeeded() {
        long last = lastPruned.get();
        long now = nanoClock.getAsLong();
        if (now - last < pruningIntervalNanos || !lastPruned.compareAndSet(last, now)) {
            return 0;
        }
        return prune();
    }

    /**
     * Sweeps the registry regardless of when the last sweep happened.
     *
     * @return the number of removed entries
     */
    public int pruneNow() {
        lastPruned.set(nanoClock.getAsLong());
        return prune();
    }

    private int prune() {
        int pruned = 0;
        for (Map.Entry<Id, Entry> mapEntry : entries.entrySet()) {
            Activity activity = mapEntry.getValue().getActivity();
            if (!activity.isRecorded() && !activity.isAllDataRequested() && entries.remove(mapEntry.getKey(), mapEntry.getValue())) {
                pruned++;
            }
        }
        if (pruned > 0) {
            logger.debug("Pruned {} dropped activities, {} remain in flight", pruned, entries.size());
        }
        return pruned;
    }

    public static class Entry {
        private final Activity activity;
        private final AbstractSpan<?> span;

        Entry(Activity activity, AbstractSpan<?> span) {
            this.activity = activity;
            this.span = span;
        }

        public Activity getActivity() {
            return activity;
        }

        public AbstractSpan<?> getSpan() {
            return span;
        }
    }
}
