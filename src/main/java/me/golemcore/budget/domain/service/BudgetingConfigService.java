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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.budget.infrastructure.config.BudgetProperties;
import me.golemcore.budget.ratelimit.BudgetingConfig;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the named {@link BudgetingConfig} instances from
 * {@link BudgetProperties}.
 *
 * <p>
 * Configs are built once on startup and shared by every tracker using them. An
 * invalid entry fails startup with an {@link IllegalArgumentException} naming
 * the offending config.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class BudgetingConfigService {

    private final Map<String, BudgetingConfig> configs;

    public BudgetingConfigService(BudgetProperties properties, Clock clock) {
        Map<String, BudgetingConfig> built = new LinkedHashMap<>();
        for (Map.Entry<String, BudgetProperties.BudgetingProperties> entry : properties.getConfigs().entrySet()) {
            BudgetingConfig config = buildConfig(entry.getKey(), entry.getValue(), clock);
            built.put(entry.getKey(), config);
            log.info("[Budget] Loaded config '{}': window={}, bucketWidth={}, buckets={}, backoff={}, allowed={}",
                    entry.getKey(), config.getBudgetingWindow(), config.getBucketWidth(), config.getNumBuckets(),
                    config.getBackoffDuration(), config.getAllowedBudget());
        }
        this.configs = Collections.unmodifiableMap(built);
        if (configs.isEmpty()) {
            log.warn("[Budget] No budgeting configs defined under budget.configs");
        }
    }

    public Optional<BudgetingConfig> findConfig(String name) {
        return Optional.ofNullable(configs.get(name));
    }

    public BudgetingConfig requireConfig(String name) {
        return findConfig(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown budgeting config: " + name));
    }

    public Set<String> getConfigNames() {
        return configs.keySet();
    }

    private BudgetingConfig buildConfig(String name, BudgetProperties.BudgetingProperties props, Clock clock) {
        if (props.getBudgetingWindow() == null || props.getBucketWidth() == null) {
            throw new IllegalArgumentException(
                    "Invalid budgeting config '" + name + "': budgeting-window and bucket-width are required");
        }
        if (props.getAllowedBudget() == null) {
            throw new IllegalArgumentException(
                    "Invalid budgeting config '" + name + "': allowed-budget is required");
        }
        try {
            BudgetingConfig config = new BudgetingConfig(props.getBudgetingWindow(), props.getBucketWidth(),
                    props.getBackoffDuration(), props.getAllowedBudget()).withClock(clock);
            if (props.getNumBuckets() != null) {
                config = config.withNumBuckets(props.getNumBuckets());
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid budgeting config '" + name + "': " + e.getMessage(), e);
        }
    }
}
