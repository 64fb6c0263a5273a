package me.golemcore.pacing.adapter.inbound.web.controller;

import me.golemcore.pacing.adapter.inbound.web.dto.QuotaSettingsDto;
import me.golemcore.pacing.adapter.inbound.web.dto.QuotaStatusResponse;
import me.golemcore.pacing.domain.model.DiagnosticsReport;
import me.golemcore.pacing.domain.model.LatestQuotaStatus;
import me.golemcore.pacing.domain.model.PacingResult;
import me.golemcore.pacing.domain.model.PlanMode;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.UsageReport;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.domain.model.UsageStatus;
import me.golemcore.pacing.domain.service.PacingCalculator;
import me.golemcore.pacing.domain.service.QuotaDiagnosticsService;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import me.golemcore.pacing.domain.service.QuotaState;
import me.golemcore.pacing.refresh.QuotaRefreshScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuotaControllerTest {

    private static final Instant NOW = Instant.parse("2026-04-15T12:00:00Z");

    private QuotaState quotaState;
    private QuotaRefreshScheduler refreshScheduler;
    private QuotaSettingsService settingsService;
    private QuotaDiagnosticsService diagnosticsService;
    private QuotaController controller;

    @BeforeEach
    void setUp() {
        quotaState = new QuotaState(Clock.fixed(NOW, ZoneOffset.UTC));
        refreshScheduler = mock(QuotaRefreshScheduler.class);
        settingsService = mock(QuotaSettingsService.class);
        diagnosticsService = mock(QuotaDiagnosticsService.class);
        when(settingsService.getSettings()).thenReturn(QuotaSettings.builder().orgName("acme").build());
        controller = new QuotaController(quotaState, refreshScheduler, settingsService, diagnosticsService);
    }

    @Test
    void shouldReportPendingBeforeFirstCycle() {
        StepVerifier.create(controller.getStatus())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    QuotaStatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("pending", body.getState());
                    assertNull(body.getStatus());
                    assertNull(body.getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldExposeLatestReport() {
        quotaState.recordReport(report());

        StepVerifier.create(controller.getStatus())
                .assertNext(response -> {
                    QuotaStatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("ok", body.getState());
                    assertEquals("over-budget", body.getStatus());
                    assertEquals("personal", body.getSource());
                    assertEquals(150, body.getUsedRequests());
                    assertEquals(300, body.getMonthlyLimit());
                    assertEquals(9.375, body.getDailyAllowance(), 1e-9);
                    assertEquals(-5.0, body.getBanked(), 1e-9);
                    assertEquals(NOW, body.getUpdatedAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldExposeFailureNextToLastReport() {
        quotaState.recordReport(report());
        quotaState.recordFailure(LatestQuotaStatus.State.FAILED, ResolutionError.rateLimited(30));

        StepVerifier.create(controller.getStatus())
                .assertNext(response -> {
                    QuotaStatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("failed", body.getState());
                    assertEquals(150, body.getUsedRequests());
                    assertEquals("RATE_LIMITED", body.getError().getKind());
                    assertEquals(30, body.getError().getRetryAfterSeconds());
                })
                .verifyComplete();
    }

    @Test
    void shouldOmitRetryAfterForOtherErrors() {
        quotaState.recordFailure(LatestQuotaStatus.State.FAILED,
                ResolutionError.forbidden("/orgs/acme/settings/billing/usage/summary", "read:org"));

        StepVerifier.create(controller.getStatus())
                .assertNext(response -> {
                    QuotaStatusResponse.ErrorDto error = response.getBody().getError();
                    assertEquals("FORBIDDEN", error.getKind());
                    assertEquals("read:org", error.getScopeHint());
                    assertNull(error.getRetryAfterSeconds());
                })
                .verifyComplete();
    }

    @Test
    void shouldRunForcedRefresh() {
        when(refreshScheduler.refreshNow()).thenAnswer(invocation -> {
            quotaState.recordReport(report());
            return true;
        });

        StepVerifier.create(controller.refresh())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("ok", response.getBody().getState());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectRefreshWhileOneIsRunning() {
        when(refreshScheduler.refreshNow()).thenReturn(false);

        StepVerifier.create(controller.refresh())
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ResponseStatusException);
                    assertEquals(HttpStatus.CONFLICT, ((ResponseStatusException) error).getStatusCode());
                })
                .verify();
    }

    @Test
    void shouldReturnSettings() {
        StepVerifier.create(controller.getSettings())
                .assertNext(response -> {
                    QuotaSettingsDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("auto", body.getPlanMode());
                    assertEquals(300, body.getMonthlyLimit());
                    assertEquals("acme", body.getOrgName());
                    assertEquals(30, body.getRefreshIntervalMinutes());
                })
                .verifyComplete();
    }

    @Test
    void shouldMergePartialSettingsUpdate() {
        when(settingsService.updateSettings(any())).thenAnswer(invocation -> invocation.getArgument(0));
        QuotaSettingsDto request = new QuotaSettingsDto();
        request.setPlanMode("Business");
        request.setMonthlyLimit(1500);

        StepVerifier.create(controller.updateSettings(request))
                .assertNext(response -> assertEquals("business", response.getBody().getPlanMode()))
                .verifyComplete();

        ArgumentCaptor<QuotaSettings> captor = ArgumentCaptor.forClass(QuotaSettings.class);
        verify(settingsService).updateSettings(captor.capture());
        QuotaSettings submitted = captor.getValue();
        assertEquals(PlanMode.BUSINESS, submitted.getPlanMode());
        assertEquals(1500, submitted.getMonthlyLimit());
        assertEquals("acme", submitted.getOrgName());
        assertEquals(30, submitted.getRefreshIntervalMinutes());
    }

    @Test
    void shouldRejectUnknownPlanMode() {
        QuotaSettingsDto request = new QuotaSettingsDto();
        request.setPlanMode("enterprise");

        assertThrows(IllegalArgumentException.class, () -> controller.updateSettings(request));
        verify(settingsService, never()).updateSettings(any());
    }

    @Test
    void shouldReturnDiagnostics() {
        DiagnosticsReport report = new DiagnosticsReport(NOW,
                List.of(new DiagnosticsReport.Check("token", false, "No long-lived token configured")));
        when(diagnosticsService.runDiagnostics()).thenReturn(report);

        StepVerifier.create(controller.diagnostics())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertFalse(response.getBody().checks().get(0).ok());
                })
                .verifyComplete();
    }

    private static UsageReport report() {
        PacingResult pacing = PacingCalculator.calculatePacing(150, 300, ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC));
        return UsageReport.builder()
                .pacing(pacing)
                .status(UsageStatus.OVER_BUDGET)
                .source(UsageSource.PERSONAL_BILLING)
                .fetchedAt(NOW)
                .build();
    }
}
