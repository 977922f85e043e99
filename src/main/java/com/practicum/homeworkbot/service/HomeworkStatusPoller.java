package com.practicum.homeworkbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.practicum.homeworkbot.client.HomeworkApiClient;
import com.practicum.homeworkbot.config.HomeworkBotConfig;
import com.practicum.homeworkbot.config.MetricsConfig;
import com.practicum.homeworkbot.engine.ChangeDetector;
import com.practicum.homeworkbot.engine.ResponseValidator;
import com.practicum.homeworkbot.model.CycleOutcome;
import com.practicum.homeworkbot.model.ErrorKind;
import com.practicum.homeworkbot.model.ErrorSignature;
import com.practicum.homeworkbot.model.MonitorState;
import com.practicum.homeworkbot.model.StatusChange;
import com.practicum.homeworkbot.model.ValidatedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Drives the fetch, validate, detect, notify cycle.
 *
 * <p>Once the application is ready the startup message is sent, then cycles are scheduled with a
 * fixed delay, so the configured interval is always slept after a cycle ends, whatever its outcome. No failure stops the loop. Each failure is reduced to an {@link ErrorSignature};
 * a signature different from the last alerted one is sent to the channel once, repeats are only logged.
 * Cursor and observed verdict are committed together, and only after a cycle fully succeeds.
 */
@Service
public class HomeworkStatusPoller {

    private static final Logger log = LoggerFactory.getLogger(HomeworkStatusPoller.class);

    private final HomeworkApiClient apiClient;
    private final ResponseValidator validator;
    private final ChangeDetector changeDetector;
    private final NotificationService notificationService;
    private final HomeworkBotConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    // Written only inside runCycle; read by the monitor endpoint.
    private volatile MonitorState state;

    public HomeworkStatusPoller(HomeworkApiClient apiClient,
                                ResponseValidator validator,
                                ChangeDetector changeDetector,
                                NotificationService notificationService,
                                HomeworkBotConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock,
                                TaskScheduler taskScheduler) {
        this.apiClient = apiClient;
        this.validator = validator;
        this.changeDetector = changeDetector;
        this.notificationService = notificationService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
        this.state = MonitorState.builder()
                .cursor(clock.instant().getEpochSecond())
                .observedVerdict(config.getStartupPolicy().initialVerdict())
                .lastOutcome(CycleOutcome.NOT_STARTED)
                .build();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!config.isPollingEnabled()) {
            log.info("Homework polling is DISABLED.");
            return;
        }
        log.info("Homework poller starting: endpoint={}, interval={}s, startupPolicy={}, cursor={}",
                config.getEndpoint(), config.getPollIntervalSeconds(), config.getStartupPolicy(), state.getCursor());
        notificationService.announceStartup(clock.instant());
        taskScheduler.scheduleWithFixedDelay(this::runCycle, Duration.ofSeconds(config.getPollIntervalSeconds()));
    }

    public synchronized void runCycle() {
        if (!config.isPollingEnabled()) {
            return;
        }

        MonitorState current = state;
        try {
            JsonNode payload = apiClient.fetch(current.getCursor());
            ValidatedResponse response = validator.validate(payload);
            Optional<StatusChange> change = changeDetector.detect(response, current.getObservedVerdict());
            long nextCursor = response.currentDate().isPresent()
                    ? Math.max(current.getCursor(), response.currentDate().getAsLong())
                    : current.getCursor();

            if (change.isEmpty()) {
                CycleOutcome outcome = response.isEmpty() ? CycleOutcome.NO_RECORDS : CycleOutcome.NO_CHANGE;
                commit(succeeded(current, outcome).cursor(nextCursor).build());
                log.info("No status change ({}), cursor={}, next check in {}s",
                        outcome, nextCursor, config.getPollIntervalSeconds());
                return;
            }

            StatusChange statusChange = change.get();
            if (notificationService.notifyStatusChange(statusChange)) {
                commit(succeeded(current, CycleOutcome.NOTIFIED)
                        .cursor(nextCursor)
                        .observedVerdict(statusChange.verdict())
                        .build());
                metricsConfig.recordStatusChange(statusChange.verdict().code());
                log.info("Homework \"{}\" moved {} -> {}, cursor={}",
                        statusChange.name(), statusChange.previous(), statusChange.verdict(), nextCursor);
            } else {
                // Nothing is committed, so the same change is detected and retried next cycle.
                commit(next(current, CycleOutcome.NOTIFY_FAILED).build());
                metricsConfig.recordFailure(ErrorKind.NOTIFICATION_FAILURE.name(), false);
                log.error("{}: change of \"{}\" to {} not delivered, retrying next cycle",
                        ErrorKind.NOTIFICATION_FAILURE, statusChange.name(), statusChange.verdict());
            }
        } catch (RuntimeException e) {
            handleFailure(current, e);
        }
    }

    public MonitorState getState() {
        return state;
    }

    private void handleFailure(MonitorState current, RuntimeException e) {
        ErrorSignature signature = ErrorSignature.of(e);
        ErrorSignature lastError = current.getLastError();
        boolean alerted = false;

        if (signature.equals(lastError)) {
            log.warn("Poll cycle failed again with {}: {} (already alerted)", signature.kind(), signature.message());
        } else {
            log.error("Poll cycle failed with {}: {}", signature.kind(), signature.message(), e);
            alerted = notificationService.alertFailure(signature);
            if (alerted) {
                lastError = signature;
            }
        }

        metricsConfig.recordFailure(signature.kind().name(), alerted);
        commit(next(current, CycleOutcome.FAILED).lastError(lastError).build());
    }

    private MonitorState.MonitorStateBuilder succeeded(MonitorState current, CycleOutcome outcome) {
        return next(current, outcome)
                .lastError(null)
                .lastSuccessAt(clock.millis());
    }

    private MonitorState.MonitorStateBuilder next(MonitorState current, CycleOutcome outcome) {
        return current.toBuilder()
                .lastOutcome(outcome)
                .cycles(current.getCycles() + 1);
    }

    private void commit(MonitorState next) {
        state = next;
        metricsConfig.updateCursor(next.getCursor());
        metricsConfig.recordCycle(next.getLastOutcome().name());
    }
}
