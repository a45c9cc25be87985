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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.budget.domain.service.ProjectBudgetService;
import me.golemcore.budget.infrastructure.config.BudgetProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts stale project trackers.
 *
 * <p>
 * Runs {@link ProjectBudgetService#sweepStale()} on a single daemon thread every
 * {@code budget.sweep-interval}. Can be disabled via
 * {@code budget.sweep-enabled=false}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleBudgetSweeper {

    private final ProjectBudgetService projectBudgetService;
    private final BudgetProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    @PostConstruct
    public void init() {
        if (!properties.isSweepEnabled()) {
            log.info("[BudgetSweeper] Stale tracker sweeping disabled");
            return;
        }

        long intervalMillis = properties.getSweepInterval().toMillis();
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("budget.sweep-interval must be positive: "
                    + properties.getSweepInterval());
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "budget-stale-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[BudgetSweeper] Started with interval: {}", properties.getSweepInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[BudgetSweeper] Shut down");
    }

    void sweep() {
        try {
            projectBudgetService.sweepStale();
        } catch (RuntimeException e) {
            log.warn("[BudgetSweeper] Sweep failed: {}", e.getMessage(), e);
        }
    }

    boolean isRunning() {
        return sweepTask != null && !sweepTask.isDone();
    }
}
