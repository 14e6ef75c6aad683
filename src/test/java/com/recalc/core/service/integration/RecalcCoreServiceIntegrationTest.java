package com.recalc.core.service.integration;

import com.recalc.core.service.api.health.RecalcDaemonHealthIndicator;
import com.recalc.core.service.daemon.RecalcDaemon;
import com.recalc.core.service.model.CalculationState;
import com.recalc.core.service.model.CalibrationTimeElement;
import com.recalc.core.service.model.EditType;
import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.model.TelluricBatchItem;
import com.recalc.core.service.model.TelluricTargetElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.ExecutionIdentity;
import com.recalc.core.service.session.ServiceIdentityResolver;
import com.recalc.core.service.session.ServiceUser;
import com.recalc.core.service.support.ManualChangeFeed;
import com.recalc.core.service.support.RecordingSessionFactory;
import com.recalc.core.service.support.TestTransactions;
import com.recalc.core.service.telluric.TelluricRecalculator;
import com.recalc.core.service.telluric.TelluricWorkSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Runs the whole daemon against in-memory collaborators: change feeds driven
 * by the test, a recording session factory and fake recalculation stores.
 */
@SpringBootTest
@ActiveProfiles("test")
class RecalcCoreServiceIntegrationTest {

    @Autowired
    private ManualChangeFeed<ObscalcElement> obscalcFeed;

    @Autowired
    private ManualChangeFeed<CalibrationTimeElement> calibrationTimeFeed;

    @Autowired
    private ManualChangeFeed<TelluricTargetElement> telluricTargetFeed;

    @Autowired
    private RecordingRecalculationService recalculationService;

    @Autowired
    private InMemoryTelluricStore telluricStore;

    @Autowired
    private RecordingSessionFactory sessionFactory;

    @Autowired
    private RecalcDaemon daemon;

    @Autowired
    private RecalcDaemonHealthIndicator healthIndicator;

    // ==================== Startup ====================

    @Test
    @DisplayName("startup resets interrupted telluric entries once and drains the backlog")
    void startupResetsAndDrains() {
        await().atMost(10, TimeUnit.SECONDS).until(() -> telluricStore.processed.contains("boot-1"));
        assertThat(telluricStore.resets.get()).isEqualTo(1);
        assertThat(daemon.getDispatchers()).extracting("name").containsExactlyInAnyOrder(
                RecalcDaemon.OBSCALC, RecalcDaemon.CALIBRATION_TIME, RecalcDaemon.TELLURIC_EVENTS,
                RecalcDaemon.TELLURIC_RECHECK);
        assertThat(daemon.getBridges()).hasSize(3);
    }

    // ==================== Dispatchers ====================

    @Test
    @DisplayName("an observation becoming ready recalculates its program as the service user")
    void obscalcReadyTriggersRecalculation() {
        obscalcFeed.emit(ObscalcElement.of("it-o1", "it-p1", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));

        await().atMost(10, TimeUnit.SECONDS).until(() -> recalculationService.calibrations.containsKey("it-p1"));
        assertThat(recalculationService.calibrations.get("it-p1"))
                .isEqualTo(recalculationService.calibrations.get("it-p1").truncatedTo(ChronoUnit.DAYS));
        assertThat(recalculationService.identities).allMatch(ServiceUser::isService);
    }

    @Test
    @DisplayName("a science observation becoming ready rechecks its telluric targets")
    void scienceReadyTriggersTelluricRecheck() {
        obscalcFeed.emit(ObscalcElement.of("it-o6", "it-p6", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));
        obscalcFeed.emit(ObscalcElement.of("cal-o7", "it-p6", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));
        obscalcFeed.emit(ObscalcElement.of("it-o8", "it-p6", EditType.UPDATED,
                CalculationState.CALCULATING, CalculationState.READY));

        await().atMost(10, TimeUnit.SECONDS).until(() -> telluricStore.rechecked.contains("it-o8"));
        assertThat(telluricStore.rechecked).contains("it-o6").doesNotContain("cal-o7");
    }

    @Test
    @DisplayName("an edit that does not reach ready is ignored")
    void nonReadyEditIsIgnored() throws InterruptedException {
        obscalcFeed.emit(ObscalcElement.of("it-o2", "it-p2", EditType.UPDATED,
                CalculationState.PENDING, CalculationState.CALCULATING));
        calibrationTimeFeed.emit(new CalibrationTimeElement("it-p2", "it-marker"));

        await().atMost(10, TimeUnit.SECONDS).until(() -> recalculationService.targets.contains("it-marker"));
        Thread.sleep(100);
        assertThat(recalculationService.calibrations).doesNotContainKey("it-p2");
    }

    @Test
    @DisplayName("a calibration time change recalculates the calibration target")
    void calibrationTimeTriggersTargetRecalculation() {
        calibrationTimeFeed.emit(new CalibrationTimeElement("it-p3", "it-c3"));

        await().atMost(10, TimeUnit.SECONDS).until(() -> recalculationService.targets.contains("it-c3"));
    }

    @Test
    @DisplayName("a telluric entry becoming pending is resolved")
    void telluricPendingIsResolved() {
        telluricStore.add(new TelluricBatchItem("it-t1", "it-p4"));
        telluricTargetFeed.emit(new TelluricTargetElement("it-t1", EditType.UPDATED,
                Optional.of(CalculationState.READY), Optional.of(CalculationState.PENDING)));

        await().atMost(10, TimeUnit.SECONDS).until(() -> telluricStore.processed.contains("it-t1"));
    }

    // ==================== Health ====================

    @Test
    @DisplayName("health is UP and every session is returned once work settles")
    void healthyAndSessionsReleased() {
        obscalcFeed.emit(ObscalcElement.of("it-o5", "it-p5", EditType.CREATED, null, CalculationState.READY));
        await().atMost(10, TimeUnit.SECONDS).until(() -> recalculationService.calibrations.containsKey("it-p5"));

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        await().atMost(10, TimeUnit.SECONDS).until(() -> sessionFactory.currentlyOpen() == 0);
        assertThat(sessionFactory.maxOpen()).isLessThanOrEqualTo(4);
    }

    // ==================== Test Collaborators ====================

    @TestConfiguration
    static class Collaborators {

        @Bean
        RecordingSessionFactory sessionFactory() {
            return new RecordingSessionFactory();
        }

        @Bean
        ServiceIdentityResolver serviceIdentityResolver() {
            return () -> Optional.of(TestTransactions.SERVICE_USER);
        }

        @Bean
        RecordingRecalculationService recalculationService() {
            return new RecordingRecalculationService();
        }

        @Bean
        InMemoryTelluricStore telluricStore() {
            InMemoryTelluricStore store = new InMemoryTelluricStore();
            store.add(new TelluricBatchItem("boot-1", "boot-p"));
            return store;
        }

        @Bean
        ManualChangeFeed<ObscalcElement> obscalcFeed() {
            return new ManualChangeFeed<>();
        }

        @Bean
        ManualChangeFeed<CalibrationTimeElement> calibrationTimeFeed() {
            return new ManualChangeFeed<>();
        }

        @Bean
        ManualChangeFeed<TelluricTargetElement> telluricTargetFeed() {
            return new ManualChangeFeed<>();
        }
    }

    static class RecordingRecalculationService implements RecalculationService {

        final Map<String, Instant> calibrations = new ConcurrentHashMap<>();
        final List<String> targets = new CopyOnWriteArrayList<>();
        final List<ServiceUser> identities = new CopyOnWriteArrayList<>();

        @Override
        public boolean isCalibration(String observationId) {
            return observationId.startsWith("cal-");
        }

        @Override
        public void recalculateCalibrations(String programId, Instant asOf) {
            ExecutionIdentity.current().ifPresent(identities::add);
            calibrations.put(programId, asOf);
        }

        @Override
        public void recalculateCalibrationTarget(String programId, String observationId) {
            targets.add(observationId);
        }
    }

    static class InMemoryTelluricStore implements TelluricWorkSource, TelluricRecalculator {

        private final Map<String, TelluricBatchItem> pending = new LinkedHashMap<>();
        final List<String> processed = new CopyOnWriteArrayList<>();
        final AtomicInteger resets = new AtomicInteger();
        final List<String> rechecked = new CopyOnWriteArrayList<>();

        synchronized void add(TelluricBatchItem item) {
            pending.put(item.observationId(), item);
        }

        @Override
        public synchronized List<TelluricBatchItem> fetchBatch(int limit) {
            List<TelluricBatchItem> batch = new ArrayList<>();
            var it = pending.values().iterator();
            while (it.hasNext() && batch.size() < limit) {
                batch.add(it.next());
                it.remove();
            }
            return batch;
        }

        @Override
        public synchronized Optional<TelluricBatchItem> loadForObservation(String observationId) {
            return Optional.ofNullable(pending.remove(observationId));
        }

        @Override
        public int resetInterrupted() {
            resets.incrementAndGet();
            return 0;
        }

        @Override
        public void recheckForScienceObservation(String observationId) {
            rechecked.add(observationId);
        }

        @Override
        public void process(TelluricBatchItem item) {
            processed.add(item.observationId());
        }
    }
}
