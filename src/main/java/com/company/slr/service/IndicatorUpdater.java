package com.company.slr.service;

import com.company.slr.domain.Indicator;
import com.company.slr.domain.enums.UpdaterState;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.source.SourceRegistry;
import com.company.slr.time.RelativeMinutesRange;
import com.company.slr.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans out one update task per live indicator onto the bounded updater pool.
 *
 * <p>Tasks are isolated: a failing indicator is logged and counted, its siblings carry on.
 * Only one cycle runs at a time. {@link #shutdown()} stops submitting further tasks; tasks
 * already running finish or time out on their own.
 */
@Service
@Slf4j
public class IndicatorUpdater {

    private final IndicatorRepository indicatorRepository;
    private final SourceRegistry sourceRegistry;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    private final AtomicReference<UpdaterState> state = new AtomicReference<>(UpdaterState.IDLE);
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private volatile boolean stopRequested = false;

    public IndicatorUpdater(IndicatorRepository indicatorRepository,
                            SourceRegistry sourceRegistry,
                            @Qualifier("indicatorUpdaterExecutor") ExecutorService executor,
                            MeterRegistry meterRegistry,
                            Tracer tracer,
                            Clock clock) {
        this.indicatorRepository = indicatorRepository;
        this.sourceRegistry = sourceRegistry;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
    }

    public UpdaterState getState() {
        return state.get();
    }

    public UpdateCycleResult runCycle() {
        if (stopRequested) {
            log.warn("Updater is stopped, not starting a cycle");
            return UpdateCycleResult.skippedCycle();
        }
        if (!cycleRunning.compareAndSet(false, true)) {
            log.warn("Update cycle already running, skipping");
            return UpdateCycleResult.skippedCycle();
        }

        state.set(UpdaterState.RUNNING);
        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            List<Indicator> indicators = indicatorRepository.findAllActive();
            log.info("Starting update cycle for {} indicators", indicators.size());

            // Set when the waiting thread is interrupted: queued tasks then skip their update
            AtomicBoolean aborted = new AtomicBoolean(false);

            List<Future<TaskOutcome>> futures = new ArrayList<>(indicators.size());
            for (Indicator indicator : indicators) {
                if (stopRequested) {
                    log.warn("Stop requested, {} indicators not submitted", indicators.size() - futures.size());
                    break;
                }
                try {
                    futures.add(executor.submit(
                            () -> aborted.get() ? TaskOutcome.NOT_UPDATED : updateIndicator(indicator)));
                } catch (RejectedExecutionException e) {
                    log.error("Failed to submit update of indicator {} for product {}",
                            indicator.getName(), indicator.getProductName(), e);
                }
            }

            int succeeded = 0;
            int failed = indicators.size() - futures.size();
            long values = 0;

            for (Future<TaskOutcome> future : futures) {
                TaskOutcome outcome = awaitOutcome(future, aborted);
                if (outcome.succeeded) {
                    succeeded++;
                    values += outcome.values;
                } else {
                    failed++;
                }
            }

            if (aborted.get()) {
                Thread.currentThread().interrupt();
            }

            Duration duration = Duration.between(startedAt, clock.instant());
            meterRegistry.counter("slr.updater.cycles").increment();

            log.info("Update cycle finished in {}: {} indicators, {} succeeded, {} failed, {} values",
                    TimeUtils.formatDuration(duration), indicators.size(), succeeded, failed, values);

            return UpdateCycleResult.builder()
                    .indicators(indicators.size())
                    .succeeded(succeeded)
                    .failed(failed)
                    .values(values)
                    .duration(duration)
                    .build();

        } finally {
            sample.stop(meterRegistry.timer("slr.updater.cycle.duration"));
            state.set(stopRequested ? UpdaterState.STOPPED : UpdaterState.SLEEPING);
            cycleRunning.set(false);
        }
    }

    /**
     * Waits for a task even when interrupted, so the cycle never ends while one of its tasks
     * still runs. An interrupt marks the cycle aborted and is restored by the caller.
     */
    private TaskOutcome awaitOutcome(Future<TaskOutcome> future, AtomicBoolean aborted) {
        while (true) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                log.error("Indicator update task failed", e.getCause());
                return TaskOutcome.NOT_UPDATED;
            } catch (InterruptedException e) {
                if (aborted.compareAndSet(false, true)) {
                    log.warn("Interrupted while waiting for indicator updates, "
                            + "skipping queued indicators and waiting for running ones");
                }
            }
        }
    }

    /**
     * Cooperative stop: the running cycle submits no further tasks.
     */
    @PreDestroy
    public void shutdown() {
        stopRequested = true;
        if (!cycleRunning.get()) {
            state.set(UpdaterState.STOPPED);
        }
        log.info("Indicator updater stop requested");
    }

    TaskOutcome updateIndicator(Indicator indicator) {
        Span span = tracer.spanBuilder("indicator.update")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        MDC.put("indicator", indicator.getName());
        MDC.put("product", indicator.getProductName());

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("indicator.id", indicator.getId());
            span.setAttribute("indicator.name", indicator.getName());
            span.setAttribute("product.name", String.valueOf(indicator.getProductName()));

            log.debug("Updating indicator {} values for product {}", indicator.getName(), indicator.getProductName());

            int count = sourceRegistry.fromIndicator(indicator).updateIndicatorValues(RelativeMinutesRange.open());

            span.setAttribute("indicator.values.count", count);
            meterRegistry.counter("slr.updater.indicator.updates", "outcome", "success").increment();

            log.info("Updated {} values of indicator \"{}\" for product \"{}\"",
                    count, indicator.getName(), indicator.getProductName());
            return new TaskOutcome(true, count);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Indicator update failed");
            meterRegistry.counter("slr.updater.indicator.updates", "outcome", "failure").increment();

            log.error("Failed to update indicator \"{}\" values for product \"{}\"",
                    indicator.getName(), indicator.getProductName(), e);
            return new TaskOutcome(false, 0);

        } finally {
            span.end();
            MDC.remove("indicator");
            MDC.remove("product");
        }
    }

    static final class TaskOutcome {
        static final TaskOutcome NOT_UPDATED = new TaskOutcome(false, 0);

        final boolean succeeded;
        final int values;

        TaskOutcome(boolean succeeded, int values) {
            this.succeeded = succeeded;
            this.values = values;
        }
    }
}
