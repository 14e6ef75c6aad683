package com.recalc.core.service.dispatch;

import com.recalc.core.service.model.CalibrationTimeElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.support.RecordingSessionFactory;
import com.recalc.core.service.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CalibrationTimeHandlerTest {

    @Mock
    private RecalculationService recalculationService;

    private final RecordingSessionFactory sessions = new RecordingSessionFactory();
    private CalibrationTimeHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CalibrationTimeHandler(recalculationService, TestTransactions.runner(sessions));
    }

    @Test
    @DisplayName("every calibration time change is accepted")
    void acceptsEverything() {
        assertThat(handler.accepts(new CalibrationTimeElement("P1", "O1"))).isTrue();
    }

    @Test
    @DisplayName("recalculates the calibration target in its own transaction")
    void recalculatesTarget() {
        handler.handle(new CalibrationTimeElement("P1", "O1"));

        verify(recalculationService).recalculateCalibrationTarget("P1", "O1");
        assertThat(sessions.commits()).isEqualTo(1);
        assertThat(sessions.currentlyOpen()).isZero();
    }

    @Test
    @DisplayName("a failing recalculation is rolled back and reported against the observation")
    void failureIsWrapped() {
        doThrow(new IllegalStateException("target missing"))
                .when(recalculationService).recalculateCalibrationTarget("P1", "O1");

        assertThatThrownBy(() -> handler.handle(new CalibrationTimeElement("P1", "O1")))
                .isInstanceOf(RecalculationFailedException.class)
                .hasMessageContaining("target missing")
                .extracting("entityId").isEqualTo("O1");
        assertThat(sessions.rollbacks()).isEqualTo(1);
        assertThat(sessions.currentlyOpen()).isZero();
    }
}
