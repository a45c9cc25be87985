package me.golemcore.budget.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.budget.domain.model.BudgetSnapshot;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-project budget tracking over a rolling time window.
 *
 * <p>
 * Spend is accumulated into buckets whose timestamps are truncated to the
 * configured bucket width, so the memory used is bounded by
 * {@link BudgetingConfig#getNumBuckets()} regardless of call frequency. The
 * buckets are kept newest-first; once the capacity is reached the oldest bucket
 * is dropped.
 *
 * <p>
 * The over/under budget state has hysteresis: whenever it flips, a backoff
 * deadline of {@link BudgetingConfig#getBackoffDuration()} is armed, and until
 * that deadline passes the previous state is reported without recomputation.
 * The deadline is checked lazily on each call; there is no timer.
 *
 * <p>
 * Not thread-safe. Callers must serialize access per tracker (see
 * {@code ProjectBudgetService}). Spend amounts are trusted to be non-negative.
 *
 * @since 1.0
 * @see BudgetingConfig
 */
public class BudgetTracker {

    private final BudgetingConfig config;
    private final Deque<Bucket> buckets;

    private boolean exceedsBudget;
    private Instant backoffDeadline;

    public BudgetTracker(BudgetingConfig config) {
        this.config = config;
        this.buckets = new ArrayDeque<>(Math.min(config.getNumBuckets(), 64));
    }

    /**
     * Records spent budget in the current bucket and returns whether the budget
     * is now exceeded.
     */
    public boolean recordSpend(double amount) {
        Instant nowBucket = config.truncatedNow();

        Bucket latest = buckets.peekFirst();
        if (latest != null && !latest.timestamp.isBefore(nowBucket)) {
            latest.spent += amount;
        } else {
            buckets.addFirst(new Bucket(nowBucket, amount));
            if (buckets.size() > config.getNumBuckets()) {
                buckets.removeLast();
            }
        }

        return updateAggregatedState(config.now());
    }

    /**
     * Checks whether the budget is exceeded, updating the internal state.
     */
    public boolean check() {
        return updateAggregatedState(config.now());
    }

    /**
     * Checks whether this tracker holds nothing that matters for future
     * decisions, i.e. no pending backoff and every bucket outside the budgeting
     * window ending at {@code now}. Stale trackers can be discarded.
     */
    public boolean isStale(Instant now) {
        if (backoffDeadline != null && backoffDeadline.isAfter(now)) {
            return false;
        }

        Instant lowestTime = now.minus(config.getBudgetingWindow());
        for (Bucket bucket : buckets) {
            if (!bucket.timestamp.isBefore(lowestTime)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies the current state. The hysteresis state is not recomputed; the
     * window spend is summed against the current time.
     */
    public BudgetSnapshot snapshot() {
        BudgetSnapshot.BudgetSnapshotBuilder builder = BudgetSnapshot.builder()
                .exceedsBudget(exceedsBudget)
                .backoffDeadline(backoffDeadline)
                .windowSpent(windowSpent(config.now()));
        for (Bucket bucket : buckets) {
            builder.bucket(new BudgetSnapshot.Bucket(bucket.timestamp, bucket.spent));
        }
        return builder.build();
    }

    /**
     * Last computed state, without recomputing it against the current time.
     */
    public boolean isExceedsBudget() {
        return exceedsBudget;
    }

    public BudgetingConfig getConfig() {
        return config;
    }

    private boolean updateAggregatedState(Instant now) {
        if (backoffDeadline != null) {
            if (backoffDeadline.isAfter(now)) {
                return exceedsBudget;
            }
            backoffDeadline = null;
        }

        boolean exceeds = windowSpent(now) > config.getAllowedBudget();
        if (exceeds != exceedsBudget) {
            exceedsBudget = exceeds;
            backoffDeadline = now.plus(config.getBackoffDuration());
        }
        return exceedsBudget;
    }

    private double windowSpent(Instant now) {
        Instant lowestTime = now.minus(config.getBudgetingWindow());
        double spent = 0;
        for (Bucket bucket : buckets) {
            if (!bucket.timestamp.isBefore(lowestTime)) {
                spent += bucket.spent;
            }
        }
        return spent;
    }

    private static final class Bucket {
        private final Instant timestamp;
        private double spent;

        private Bucket(Instant timestamp, double spent) {
            this.timestamp = timestamp;
            this.spent = spent;
        }
    }
}
