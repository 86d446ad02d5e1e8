package io.herald.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SafeSchedulerTest {
    private static final Instant SETUP = Instant.parse("2025-03-01T08:00:00Z");
    private static final Instant NINE = Instant.parse("2025-03-01T09:00:00Z");
    private static final Instant TOMORROW_NINE = Instant.parse("2025-03-02T09:00:00Z");

    private final Clock clock = Clock.fixed(SETUP, ZoneOffset.UTC);
    private final List<String> alerts = new ArrayList<>();

    private Logger failureLogger;
    private ListAppender<ILoggingEvent> failureEvents;

    @BeforeEach
    void attachFailureAppender() {
        failureLogger = (Logger) LoggerFactory.getLogger(SafeScheduler.FAILURE_LOGGER);
        failureEvents = new ListAppender<>();
        failureEvents.start();
        failureLogger.addAppender(failureEvents);
    }

    @AfterEach
    void detachFailureAppender() {
        failureLogger.detachAppender(failureEvents);
    }

    @Test
    void shouldComputeFirstRunFromRecurrenceAtRegistration() {
        SafeScheduler scheduler = scheduler(true);

        JobHandle daily = scheduler.register(JobSpec.of("daily", args -> JobOutcome.ok(), Recurrence.dailyAt("09:00")));
        JobHandle interval = scheduler.register(JobSpec.of("interval", args -> JobOutcome.ok(), Recurrence.everyMinutes(30)));

        assertThat(daily.nextRun()).isEqualTo(NINE);
        assertThat(interval.nextRun()).isEqualTo(SETUP.plusSeconds(30 * 60));
        assertThat(daily.lastRun()).isEmpty();
        assertThat(scheduler.nextRunAt()).contains(SETUP.plusSeconds(30 * 60));
    }

    @Test
    void shouldReportDueJobsWithoutChangingState() {
        SafeScheduler scheduler = scheduler(true);
        scheduler.register(JobSpec.of("first", args -> JobOutcome.ok(), Recurrence.dailyAt("09:00")));
        scheduler.register(JobSpec.of("later", args -> JobOutcome.ok(), Recurrence.dailyAt("12:00")));
        scheduler.register(JobSpec.of("second", args -> JobOutcome.ok(), Recurrence.dailyAt("08:30")));

        List<JobHandle> due = scheduler.dueJobs(NINE);

        assertThat(due).extracting(JobHandle::name).containsExactly("first", "second");
        assertThat(scheduler.dueJobs(NINE)).extracting(JobHandle::name).containsExactly("first", "second");
        assertThat(due.get(0).nextRun()).isEqualTo(NINE);
        assertThat(due.get(0).runs()).isZero();
    }

    @Test
    void shouldRunDueJobsInRegistrationOrderAndPassBoundArgs() {
        SafeScheduler scheduler = scheduler(true);
        List<String> calls = new ArrayList<>();
        scheduler.register(new JobSpec("b", "echo", args -> record(calls, "b" + args), List.of("x"), Recurrence.dailyAt("09:00")));
        scheduler.register(new JobSpec("a", "echo", args -> record(calls, "a" + args), List.of("y", "z"), Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.executed()).isEqualTo(2);
        assertThat(report.failed()).isZero();
        assertThat(calls).containsExactly("b[x]", "a[y, z]");
    }

    @Test
    void shouldIsolateFailingJobFromOtherJobs() {
        SafeScheduler scheduler = scheduler(true);
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.register(JobSpec.of("alpha", args -> count(healthyRuns), Recurrence.dailyAt("09:00")));
        scheduler.register(JobSpec.of("broken", args -> {
            throw new IllegalStateException("boom");
        }, Recurrence.dailyAt("09:00")));
        scheduler.register(JobSpec.of("gamma", args -> count(healthyRuns), Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.executed()).isEqualTo(3);
        assertThat(report.failedJobs()).containsExactly("broken");
        assertThat(healthyRuns).hasValue(2);
        assertThat(scheduler.jobs()).allSatisfy(job -> {
            assertThat(job.nextRun()).isEqualTo(TOMORROW_NINE);
            assertThat(job.lastRun()).contains(NINE);
        });

        assertThat(alerts).containsExactly("[Job Error] broken: IllegalStateException: boom");
        assertThat(failureEvents.list).hasSize(1);
        ILoggingEvent event = failureEvents.list.get(0);
        assertThat(event.getFormattedMessage()).contains("job=broken", "kind=CALLBACK", "boom");
        assertThat(event.getThrowableProxy()).isNotNull();
    }

    @Test
    void shouldContainErrorsThrownByCallbacks() {
        SafeScheduler scheduler = scheduler(true);
        AtomicInteger healthyRuns = new AtomicInteger();
        JobHandle broken = scheduler.register(JobSpec.of("broken", args -> {
            throw new AssertionError("invariant");
        }, Recurrence.dailyAt("09:00")));
        scheduler.register(JobSpec.of("healthy", args -> count(healthyRuns), Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.executed()).isEqualTo(2);
        assertThat(report.failedJobs()).containsExactly("broken");
        assertThat(healthyRuns).hasValue(1);
        assertThat(broken.nextRun()).isEqualTo(TOMORROW_NINE);
        assertThat(broken.lastOutcome()).hasValueSatisfying(outcome -> {
            assertThat(outcome.kind()).isEqualTo(FailureKind.CALLBACK);
            assertThat(outcome.cause()).isInstanceOf(AssertionError.class);
        });
        assertThat(alerts).containsExactly("[Job Error] broken: AssertionError: invariant");
    }

    @Test
    void shouldKeepGoingWhenNotifierThrowsAnError() {
        SafeScheduler scheduler = new SafeScheduler(clock, ZoneOffset.UTC, true, text -> {
            throw new NoClassDefFoundError("okhttp3/Call");
        });
        JobHandle broken = scheduler.register(JobSpec.of("broken", args -> {
            throw new IOException("feed down");
        }, Recurrence.dailyAt("09:00")));
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.register(JobSpec.of("healthy", args -> count(healthyRuns), Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.failedJobs()).containsExactly("broken");
        assertThat(healthyRuns).hasValue(1);
        assertThat(broken.nextRun()).isEqualTo(TOMORROW_NINE);
    }

    @Test
    void shouldServeSnapshotWhileAJobIsRunning() throws Exception {
        SafeScheduler scheduler = scheduler(true);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler.register(JobSpec.of("slow", args -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return JobOutcome.ok();
        }, Recurrence.dailyAt("09:00")));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<RunReport> pass = executor.submit(() -> scheduler.runDue(NINE));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            List<JobSnapshot> snapshot = executor.submit(scheduler::snapshot).get(2, TimeUnit.SECONDS);

            assertThat(snapshot).extracting(JobSnapshot::name).containsExactly("slow");
            assertThat(snapshot.get(0).runs()).isZero();

            release.countDown();
            assertThat(pass.get(5, TimeUnit.SECONDS).failed()).isZero();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertThat(scheduler.snapshot().get(0).runs()).isEqualTo(1);
    }

    @Test
    void shouldAdvanceFailedJobExactlyLikeASuccess() {
        SafeScheduler scheduler = scheduler(true);
        JobHandle failing = scheduler.register(JobSpec.of("failing", args -> {
            throw new IOException("feed down");
        }, Recurrence.everyMinutes(30)));
        JobHandle healthy = scheduler.register(JobSpec.of("healthy", args -> JobOutcome.ok(), Recurrence.everyMinutes(30)));
        Instant attempt = failing.nextRun();

        scheduler.runDue(attempt);

        assertThat(failing.nextRun()).isAfter(attempt);
        assertThat(failing.nextRun()).isEqualTo(healthy.nextRun());
        assertThat(failing.nextRun()).isEqualTo(failing.recurrence().next(attempt, ZoneOffset.UTC));
        assertThat(failing.lastRun()).contains(attempt);
        assertThat(failing.failures()).isEqualTo(1);
        assertThat(failing.lastOutcome()).hasValueSatisfying(outcome -> assertThat(outcome.success()).isFalse());
    }

    @Test
    void shouldRetryOnNextPollWhenReschedulingIsDisabled() {
        SafeScheduler scheduler = scheduler(false);
        AtomicInteger attempts = new AtomicInteger();
        JobHandle job = scheduler.register(JobSpec.of("flaky", args -> {
            attempts.incrementAndGet();
            return JobOutcome.failure(FailureKind.PUBLISH, "rate limited");
        }, Recurrence.dailyAt("09:00")));

        scheduler.runDue(NINE);

        assertThat(job.nextRun()).isBeforeOrEqualTo(NINE);
        assertThat(job.lastRun()).contains(NINE);
        assertThat(scheduler.dueJobs(NINE.plusSeconds(1))).extracting(JobHandle::name).containsExactly("flaky");

        scheduler.runDue(NINE.plusSeconds(1));

        assertThat(attempts).hasValue(2);
        assertThat(job.lastRun()).contains(NINE.plusSeconds(1));
        assertThat(alerts).containsExactly("[Job Error] flaky: rate limited", "[Job Error] flaky: rate limited");
    }

    @Test
    void shouldRecoverOnceRetriedJobSucceeds() {
        SafeScheduler scheduler = scheduler(false);
        AtomicInteger attempts = new AtomicInteger();
        JobHandle job = scheduler.register(JobSpec.of("flaky", args -> attempts.incrementAndGet() == 1
            ? JobOutcome.failure(FailureKind.STORAGE, "disk full")
            : JobOutcome.ok(), Recurrence.dailyAt("09:00")));

        scheduler.runDue(NINE);
        scheduler.runDue(NINE.plusSeconds(1));

        assertThat(job.nextRun()).isEqualTo(TOMORROW_NINE);
        assertThat(job.runs()).isEqualTo(2);
        assertThat(job.failures()).isEqualTo(1);
    }

    @Test
    void shouldRollDailyJobOverToTomorrow() {
        SafeScheduler scheduler = scheduler(true);
        JobHandle job = scheduler.register(JobSpec.of("daily", args -> JobOutcome.ok(), Recurrence.dailyAt("09:00")));

        scheduler.runDue(NINE);

        assertThat(job.nextRun()).isEqualTo(TOMORROW_NINE);
        assertThat(job.lastRun()).contains(NINE);
    }

    @Test
    void shouldRunDailyCounterOncePerDay() {
        SafeScheduler scheduler = scheduler(true);
        AtomicInteger counter = new AtomicInteger();
        JobHandle job = scheduler.register(JobSpec.of("counter", args -> count(counter), Recurrence.dailyAt("10:00")));

        scheduler.runDue(Instant.parse("2025-03-01T09:59:59Z"));
        assertThat(counter).hasValue(0);

        scheduler.runDue(Instant.parse("2025-03-01T10:00:01Z"));
        scheduler.runDue(Instant.parse("2025-03-01T10:00:02Z"));
        assertThat(counter).hasValue(1);
        assertThat(job.nextRun()).isEqualTo(Instant.parse("2025-03-02T10:00:00Z"));

        scheduler.runDue(Instant.parse("2025-03-02T10:00:01Z"));
        assertThat(counter).hasValue(2);
        assertThat(job.nextRun()).isEqualTo(Instant.parse("2025-03-03T10:00:00Z"));
    }

    @Test
    void shouldKeepRunningWhenNotifierFails() {
        SafeScheduler scheduler = new SafeScheduler(clock, ZoneOffset.UTC, true, text -> {
            throw new IOException("telegram unreachable");
        });
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.register(JobSpec.of("broken", args -> {
            throw new RuntimeException("boom");
        }, Recurrence.dailyAt("09:00")));
        scheduler.register(JobSpec.of("healthy", args -> count(healthyRuns), Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.failedJobs()).containsExactly("broken");
        assertThat(healthyRuns).hasValue(1);
        assertThat(failureEvents.list).hasSize(1);
    }

    @Test
    void shouldTreatNullOutcomeAsSuccess() {
        SafeScheduler scheduler = scheduler(true);
        JobHandle job = scheduler.register(JobSpec.of("quiet", args -> null, Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(job.failures()).isZero();
        assertThat(alerts).isEmpty();
    }

    @Test
    void shouldRestoreInterruptFlagWhenCallbackIsInterrupted() {
        SafeScheduler scheduler = scheduler(true);
        scheduler.register(JobSpec.of("sleepy", args -> {
            throw new InterruptedException("stop");
        }, Recurrence.dailyAt("09:00")));

        RunReport report = scheduler.runDue(NINE);

        assertThat(report.failedJobs()).containsExactly("sleepy");
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void shouldExposeSnapshotOfJobState() {
        SafeScheduler scheduler = scheduler(true);
        scheduler.register(new JobSpec("publish@09:00", "publish-feeds", args -> JobOutcome.failure(FailureKind.PUBLISH, "403"),
            List.of("https://example.org/rss"), Recurrence.dailyAt("09:00")));

        scheduler.runDue(NINE);
        List<JobSnapshot> snapshot = scheduler.snapshot();

        assertThat(snapshot).hasSize(1);
        JobSnapshot job = snapshot.get(0);
        assertThat(job.name()).isEqualTo("publish@09:00");
        assertThat(job.callback()).isEqualTo("publish-feeds");
        assertThat(job.recurrence()).isEqualTo("daily at 09:00");
        assertThat(job.lastRun()).isEqualTo(NINE);
        assertThat(job.nextRun()).isEqualTo(TOMORROW_NINE);
        assertThat(job.lastOutcome()).isEqualTo("publish: 403");
        assertThat(job.failures()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidRegistrations() {
        SafeScheduler scheduler = scheduler(true);

        assertThatThrownBy(() -> scheduler.register(null)).isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> JobSpec.of(" ", args -> JobOutcome.ok(), Recurrence.everyMinutes(5)))
            .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> JobSpec.of("no-callback", null, Recurrence.everyMinutes(5)))
            .isInstanceOf(ScheduleConfigException.class);
        assertThat(scheduler.jobs()).isEmpty();
    }

    private SafeScheduler scheduler(boolean rescheduleOnFailure) {
        return new SafeScheduler(clock, ZoneOffset.UTC, rescheduleOnFailure, alerts::add);
    }

    private static JobOutcome count(AtomicInteger counter) {
        counter.incrementAndGet();
        return JobOutcome.ok();
    }

    private static JobOutcome record(List<String> calls, String call) {
        calls.add(call);
        return JobOutcome.ok();
    }
}
