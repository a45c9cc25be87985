package me.golemcore.budget.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.budget.domain.model.BudgetKey;
import me.golemcore.budget.domain.model.BudgetSnapshot;
import me.golemcore.budget.port.inbound.ProjectBudgetPort;
import me.golemcore.budget.ratelimit.BudgetTracker;
import me.golemcore.budget.ratelimit.BudgetingConfig;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Registry of per-project {@link BudgetTracker} instances.
 *
 * <p>
 * Trackers are created on first use for a {@code (configName, projectId)} pair
 * and share the named {@link BudgetingConfig}. Every operation on a tracker,
 * including the eviction decision in {@link #sweepStale()}, runs inside
 * {@link ConcurrentHashMap#compute} for its key, so each tracker has a single
 * writer at a time and a tracker is never evicted while spend is being recorded
 * on it.
 *
 * @since 1.0
 * @see me.golemcore.budget.ratelimit.StaleBudgetSweeper
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectBudgetService implements ProjectBudgetPort {

    private final BudgetingConfigService configService;

    private final Map<BudgetKey, BudgetTracker> trackers = new ConcurrentHashMap<>();

    @Override
    public boolean exceedsBudget(String configName, long projectId) {
        BudgetingConfig config = configService.requireConfig(configName);
        return withTracker(new BudgetKey(configName, projectId), config, BudgetTracker::check);
    }

    @Override
    public boolean recordBudgetSpend(String configName, long projectId, double spentBudget) {
        if (!Double.isFinite(spentBudget) || spentBudget < 0) {
            throw new IllegalArgumentException("Spent budget must be a finite non-negative number: " + spentBudget);
        }
        BudgetingConfig config = configService.requireConfig(configName);
        return withTracker(new BudgetKey(configName, projectId), config,
                tracker -> tracker.recordSpend(spentBudget));
    }

    @Override
    public Optional<BudgetSnapshot> getSnapshot(String configName, long projectId) {
        BudgetKey key = new BudgetKey(configName, projectId);
        AtomicReference<BudgetSnapshot> snapshot = new AtomicReference<>();
        trackers.computeIfPresent(key, (k, tracker) -> {
            snapshot.set(tracker.snapshot());
            return tracker;
        });
        return Optional.ofNullable(snapshot.get());
    }

    @Override
    public int getTrackedCount() {
        return trackers.size();
    }

    /**
     * Evict every tracker that holds no information relevant to future
     * decisions.
     *
     * @return number of evicted trackers
     */
    public int sweepStale() {
        List<BudgetKey> keys = new ArrayList<>(trackers.keySet());
        int evicted = 0;
        for (BudgetKey key : keys) {
            AtomicBoolean removed = new AtomicBoolean(false);
            trackers.computeIfPresent(key, (k, tracker) -> {
                if (tracker.isStale(tracker.getConfig().now())) {
                    removed.set(true);
                    return null;
                }
                return tracker;
            });
            if (removed.get()) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[Budget] Evicted {} stale trackers, {} remaining", evicted, trackers.size());
        }
        return evicted;
    }

    private boolean withTracker(BudgetKey key, BudgetingConfig config, Predicate<BudgetTracker> operation) {
        AtomicBoolean result = new AtomicBoolean();
        trackers.compute(key, (k, existing) -> {
            BudgetTracker tracker = existing != null ? existing : new BudgetTracker(config);
            boolean before = tracker.isExceedsBudget();
            boolean exceeds = operation.test(tracker);
            if (before != exceeds) {
                log.debug("[Budget] {} {} its budget", key, exceeds ? "exceeds" : "no longer exceeds");
            }
            result.set(exceeds);
            return tracker;
        });
        return result.get();
    }
}
