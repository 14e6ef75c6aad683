package com.recalc.core.service.dispatch;

import com.recalc.core.service.config.MetricsConfig;
import com.recalc.core.service.model.CalculationState;
import com.recalc.core.service.model.EditType;
import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.ExecutionIdentity;
import com.recalc.core.service.support.MutableClock;
import com.recalc.core.service.support.RecordingSessionFactory;
import com.recalc.core.service.support.TestTransactions;
import com.recalc.core.service.topic.BroadcastTopic;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObscalcHandlerTest {

    private static final Instant AFTERNOON = Instant.parse("2024-05-10T17:45:12Z");
    private static final Instant MIDNIGHT = Instant.parse("2024-05-10T00:00:00Z");

    @Mock
    private RecalculationService recalculationService;

    private final RecordingSessionFactory sessions = new RecordingSessionFactory();
    private final MutableClock clock = new MutableClock(AFTERNOON);
    private ObscalcHandler handler;
    private SubscriptionDispatcher<ObscalcElement> dispatcher;

    @BeforeEach
    void setUp() {
        handler = new ObscalcHandler(recalculationService, TestTransactions.runner(sessions), clock);
        MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
        dispatcher = new SubscriptionDispatcher<>("obscalc", new BroadcastTopic<ObscalcElement>("obscalc").subscribe(10),
                handler, metrics.dispatcherMeters("obscalc"), 10);
    }

    @Test
    @DisplayName("an observation becoming ready recalculates its program once, anchored at UTC midnight")
    void readyTransitionTriggersOneRecalculation() {
        when(recalculationService.isCalibration("O1")).thenReturn(false);

        dispatcher.process(ObscalcElement.of("O1", "P1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));

        verify(recalculationService, times(1)).recalculateCalibrations("P1", MIDNIGHT);
        verify(recalculationService, never()).recalculateCalibrationTarget(anyString(), anyString());
    }

    @Test
    @DisplayName("calibration observations never trigger recalculation")
    void calibrationObservationIsSkipped() {
        when(recalculationService.isCalibration("C1")).thenReturn(true);

        dispatcher.process(ObscalcElement.of("C1", "P1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));

        verify(recalculationService, never()).recalculateCalibrations(anyString(), any());
    }

    @Test
    @DisplayName("elements that are not a transition into READY skip the calibration lookup")
    void nonTransitionSkipsLookup() {
        dispatcher.process(ObscalcElement.of("O1", "P1", EditType.UPDATED,
                CalculationState.READY, CalculationState.READY));
        dispatcher.process(ObscalcElement.of("O1", "P1", EditType.DELETED,
                CalculationState.CALCULATING, CalculationState.READY));

        verify(recalculationService, never()).isCalibration(anyString());
        verify(recalculationService, never()).recalculateCalibrations(anyString(), any());
        assertThat(sessions.opened()).isZero();
    }

    @Test
    @DisplayName("triggers on the same UTC day share one reference instant")
    void sameDayTriggersShareReferenceInstant() {
        when(recalculationService.isCalibration(anyString())).thenReturn(false);

        clock.set(Instant.parse("2024-05-10T00:00:01Z"));
        dispatcher.process(ObscalcElement.of("O1", "P1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));
        clock.set(Instant.parse("2024-05-10T23:59:59Z"));
        dispatcher.process(ObscalcElement.of("O2", "P2", EditType.CREATED,
                null, CalculationState.READY));
        clock.set(Instant.parse("2024-05-11T00:00:00Z"));
        dispatcher.process(ObscalcElement.of("O3", "P3", EditType.UPDATED,
                CalculationState.PENDING, CalculationState.READY));

        ArgumentCaptor<Instant> asOf = ArgumentCaptor.forClass(Instant.class);
        verify(recalculationService, times(3)).recalculateCalibrations(anyString(), asOf.capture());
        assertThat(asOf.getAllValues()).containsExactly(
                MIDNIGHT, MIDNIGHT, Instant.parse("2024-05-11T00:00:00Z"));
    }

    @Test
    @DisplayName("recalculation runs as the service user inside its own committed transaction")
    void runsPrivilegedAndTransactional() {
        when(recalculationService.isCalibration("O1")).thenReturn(false);
        AtomicBoolean privileged = new AtomicBoolean();
        AtomicBoolean inTransaction = new AtomicBoolean();
        doAnswer(invocation -> {
            privileged.set(ExecutionIdentity.current().filter(u -> u.equals(TestTransactions.SERVICE_USER)).isPresent());
            inTransaction.set(sessions.openTransactions() == 1);
            return null;
        }).when(recalculationService).recalculateCalibrations("P1", MIDNIGHT);

        handler.handle(ObscalcElement.of("O1", "P1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));

        assertThat(privileged).isTrue();
        assertThat(inTransaction).isTrue();
        assertThat(sessions.commits()).isEqualTo(1);
        assertThat(sessions.currentlyOpen()).isZero();
    }

    @Test
    @DisplayName("a failing recalculation is rolled back and reported with the observation id")
    void failureIsWrappedAndRolledBack() {
        doThrow(new IllegalStateException("constraint violated"))
                .when(recalculationService).recalculateCalibrations("P1", MIDNIGHT);

        assertThatThrownBy(() -> handler.handle(ObscalcElement.of("O1", "P1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY)))
                .isInstanceOf(RecalculationFailedException.class)
                .hasMessageContaining("P1")
                .extracting("entityId").isEqualTo("O1");

        assertThat(sessions.rollbacks()).isEqualTo(1);
        assertThat(sessions.currentlyOpen()).isZero();
    }

    @Test
    @DisplayName("midnight is computed in UTC whatever the clock's zone")
    void midnightIsUtc() {
        Clock tokyo = Clock.fixed(Instant.parse("2024-05-10T20:00:00Z"), ZoneId.of("Asia/Tokyo"));

        assertThat(ObscalcHandler.midnightUtc(tokyo)).isEqualTo(MIDNIGHT);
    }
}
