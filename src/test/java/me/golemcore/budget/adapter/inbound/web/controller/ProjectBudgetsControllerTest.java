package me.golemcore.budget.adapter.inbound.web.controller;

import me.golemcore.budget.adapter.inbound.web.dto.BudgetStateResponse;
import me.golemcore.budget.adapter.inbound.web.dto.RecordBudgetSpendRequest;
import me.golemcore.budget.domain.model.BudgetSnapshot;
import me.golemcore.budget.domain.service.BudgetingConfigService;
import me.golemcore.budget.port.inbound.ProjectBudgetPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProjectBudgetsControllerTest {

    private ProjectBudgetPort projectBudgetPort;
    private BudgetingConfigService budgetingConfigService;
    private ProjectBudgetsController controller;

    @BeforeEach
    void setUp() {
        projectBudgetPort = mock(ProjectBudgetPort.class);
        budgetingConfigService = mock(BudgetingConfigService.class);
        controller = new ProjectBudgetsController(projectBudgetPort, budgetingConfigService);
    }

    @Test
    void shouldReturnOverview() {
        when(budgetingConfigService.getConfigNames()).thenReturn(new LinkedHashSet<>(List.of("api", "batch")));
        when(projectBudgetPort.getTrackedCount()).thenReturn(3);

        StepVerifier.create(controller.getOverview())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertNotNull(response.getBody());
                    assertEquals(List.of("api", "batch"), response.getBody().getConfigs());
                    assertEquals(3, response.getBody().getTrackedProjects());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportExceedsBudget() {
        when(projectBudgetPort.exceedsBudget("api", 5L)).thenReturn(true);

        StepVerifier.create(controller.exceedsBudget("api", "5"))
                .assertNext(response -> {
                    assertNotNull(response.getBody());
                    assertTrue(response.getBody().isExceedsBudget());
                })
                .verifyComplete();
    }

    @Test
    void shouldRecordSpend() {
        when(projectBudgetPort.recordBudgetSpend("api", 5L, 12.5)).thenReturn(false);

        StepVerifier.create(controller.recordBudgetSpend("api", "5", new RecordBudgetSpendRequest(12.5)))
                .assertNext(response -> {
                    assertNotNull(response.getBody());
                    assertFalse(response.getBody().isExceedsBudget());
                })
                .verifyComplete();
        verify(projectBudgetPort).recordBudgetSpend("api", 5L, 12.5);
    }

    @Test
    void shouldRequireSpentBudget() {
        RecordBudgetSpendRequest request = new RecordBudgetSpendRequest(null);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> controller.recordBudgetSpend("api", "5", request));

        assertEquals("spentBudget is required", ex.getMessage());
        verify(projectBudgetPort, never()).recordBudgetSpend(anyString(), anyLong(), anyDouble());
    }

    @Test
    void shouldMapSnapshotToState() {
        BudgetSnapshot snapshot = BudgetSnapshot.builder()
                .exceedsBudget(true)
                .backoffDeadline(Instant.ofEpochSecond(110))
                .windowSpent(30)
                .bucket(new BudgetSnapshot.Bucket(Instant.ofEpochSecond(105), 30))
                .bucket(new BudgetSnapshot.Bucket(Instant.ofEpochSecond(100), 80))
                .build();
        when(projectBudgetPort.getSnapshot("api", 5L)).thenReturn(Optional.of(snapshot));

        StepVerifier.create(controller.getState("api", "5"))
                .assertNext(response -> {
                    BudgetStateResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("api", body.getConfigName());
                    assertEquals("5", body.getProjectId());
                    assertTrue(body.isExceedsBudget());
                    assertEquals(Instant.ofEpochSecond(110), body.getBackoffDeadline());
                    assertEquals(30.0, body.getWindowSpent());
                    assertEquals(110.0, body.getRetainedSpent());
                    assertEquals(2, body.getBuckets().size());
                    assertEquals(Instant.ofEpochSecond(105), body.getBuckets().get(0).getTimestamp());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUntrackedProject() {
        when(projectBudgetPort.getSnapshot("api", 9L)).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getState("api", "9"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldAcceptProjectIdsAboveSignedRange() {
        when(projectBudgetPort.exceedsBudget("api", -1L)).thenReturn(true);

        StepVerifier.create(controller.exceedsBudget("api", "18446744073709551615"))
                .assertNext(response -> {
                    assertNotNull(response.getBody());
                    assertTrue(response.getBody().isExceedsBudget());
                })
                .verifyComplete();
        verify(projectBudgetPort).exceedsBudget("api", -1L);
    }

    @Test
    void shouldRenderLargeProjectIdUnsigned() {
        BudgetSnapshot snapshot = BudgetSnapshot.builder().build();
        when(projectBudgetPort.getSnapshot("api", Long.MIN_VALUE)).thenReturn(Optional.of(snapshot));

        StepVerifier.create(controller.getState("api", "9223372036854775808"))
                .assertNext(response -> {
                    assertNotNull(response.getBody());
                    assertEquals("9223372036854775808", response.getBody().getProjectId());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectMalformedProjectId() {
        IllegalArgumentException negative = assertThrows(IllegalArgumentException.class,
                () -> controller.exceedsBudget("api", "-5"));
        IllegalArgumentException overflow = assertThrows(IllegalArgumentException.class,
                () -> controller.exceedsBudget("api", "18446744073709551616"));

        assertEquals("Invalid project id: -5", negative.getMessage());
        assertEquals("Invalid project id: 18446744073709551616", overflow.getMessage());
        verify(projectBudgetPort, never()).exceedsBudget(anyString(), anyLong());
    }
}
