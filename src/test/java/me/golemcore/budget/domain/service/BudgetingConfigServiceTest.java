package me.golemcore.budget.domain.service;

import me.golemcore.budget.infrastructure.config.BudgetProperties;
import me.golemcore.budget.ratelimit.BudgetingConfig;
import me.golemcore.budget.ratelimit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetingConfigServiceTest {

    private BudgetProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new BudgetProperties();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    }

    private static BudgetProperties.BudgetingProperties budgeting(long windowSeconds, long widthSeconds,
            double allowed) {
        BudgetProperties.BudgetingProperties props = new BudgetProperties.BudgetingProperties();
        props.setBudgetingWindow(Duration.ofSeconds(windowSeconds));
        props.setBucketWidth(Duration.ofSeconds(widthSeconds));
        props.setBackoffDuration(Duration.ofSeconds(10));
        props.setAllowedBudget(allowed);
        return props;
    }

    @Test
    void shouldBuildNamedConfigsSharingClock() {
        properties.getConfigs().put("api", budgeting(60, 5, 1000));
        properties.getConfigs().put("batch", budgeting(600, 60, 50_000));

        BudgetingConfigService service = new BudgetingConfigService(properties, clock);

        assertEquals(Set.of("api", "batch"), service.getConfigNames());
        BudgetingConfig api = service.requireConfig("api");
        assertEquals(Duration.ofSeconds(60), api.getBudgetingWindow());
        assertEquals(12, api.getNumBuckets());
        assertEquals(1000, api.getAllowedBudget());
        assertSame(clock, api.getClock());
        assertSame(clock, service.requireConfig("batch").getClock());
    }

    @Test
    void shouldApplyNumBucketsOverride() {
        BudgetProperties.BudgetingProperties props = budgeting(60, 5, 1000);
        props.setNumBuckets(3);
        properties.getConfigs().put("api", props);

        BudgetingConfigService service = new BudgetingConfigService(properties, clock);

        assertEquals(3, service.requireConfig("api").getNumBuckets());
    }

    @Test
    void shouldRejectUnknownConfig() {
        BudgetingConfigService service = new BudgetingConfigService(properties, clock);

        assertTrue(service.findConfig("missing").isEmpty());
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.requireConfig("missing"));
        assertEquals("Unknown budgeting config: missing", ex.getMessage());
    }

    @Test
    void shouldFailOnZeroBucketWidth() {
        properties.getConfigs().put("broken", budgeting(60, 0, 1000));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new BudgetingConfigService(properties, clock));
        assertTrue(ex.getMessage().startsWith("Invalid budgeting config 'broken'"));
    }

    @Test
    void shouldFailOnMissingWindow() {
        BudgetProperties.BudgetingProperties props = budgeting(60, 5, 1000);
        props.setBudgetingWindow(null);
        properties.getConfigs().put("broken", props);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new BudgetingConfigService(properties, clock));
        assertTrue(ex.getMessage().contains("budgeting-window and bucket-width are required"));
    }

    @Test
    void shouldFailOnMissingAllowedBudget() {
        BudgetProperties.BudgetingProperties props = new BudgetProperties.BudgetingProperties();
        props.setBudgetingWindow(Duration.ofSeconds(60));
        props.setBucketWidth(Duration.ofSeconds(5));
        properties.getConfigs().put("unbounded", props);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new BudgetingConfigService(properties, clock));
        assertEquals("Invalid budgeting config 'unbounded': allowed-budget is required", ex.getMessage());
    }

    @Test
    void shouldAcceptExplicitZeroAllowedBudget() {
        properties.getConfigs().put("blocked", budgeting(60, 5, 0));

        BudgetingConfigService service = new BudgetingConfigService(properties, clock);

        assertEquals(0.0, service.requireConfig("blocked").getAllowedBudget());
    }
}
