package io.tick4j.internal;

import io.tick4j.JobExecution;
import io.tick4j.ShutdownHandler;
import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.ErrorKind;
import io.tick4j.core.JobRegistry;
import io.tick4j.core.JobSchedulerException;
import io.tick4j.core.JobState;
import io.tick4j.core.JobStoredData;
import io.tick4j.store.InMemoryMetadataStore;
import io.tick4j.store.MetadataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TickSchedulerTest {

    private InMemoryMetadataStore store;
    private TickScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        scheduler = new TickScheduler(props(Duration.ofMillis(50)), store);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        store.close();
    }

    @Test
    void emptyRegistryShouldReportDefaultWait() {
        assertThat(scheduler.timeTillNextJob()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void cronJobDueInTenMinutesShouldReportAboutSixHundredSeconds() {
        ZonedDateTime at = Instant.now().plusSeconds(600).atZone(ZoneOffset.UTC);
        String expression = at.getSecond() + " " + at.getMinute() + " " + at.getHour() + " "
                + at.getDayOfMonth() + " " + at.getMonthValue() + " ? " + at.getYear();

        scheduler.cron(expression, (id, s) -> { }).add();

        assertThat(scheduler.timeTillNextJob()).isBetween(Duration.ofSeconds(598), Duration.ofSeconds(600));
    }

    @Test
    void addedJobShouldBeListedUntilRemoved() {
        UUID id = scheduler.repeated(Duration.ofMinutes(1), (jobId, s) -> { }).add();

        assertThat(scheduler.jobIds()).contains(id);
        assertThat(scheduler.nextTickForJob(id)).isPresent();

        scheduler.remove(id);

        assertThat(scheduler.jobIds()).doesNotContain(id);
        assertThat(scheduler.nextTickForJob(id)).isEmpty();
    }

    @Test
    void duplicateIdShouldFailWithCantAdd() {
        UUID id = UUID.randomUUID();
        scheduler.repeated(Duration.ofMinutes(1), (jobId, s) -> { }).id(id).add();

        assertThatThrownBy(() -> scheduler.repeated(Duration.ofMinutes(1), (jobId, s) -> { }).id(id).add())
                .isInstanceOf(JobSchedulerException.class)
                .satisfies(e -> assertThat(((JobSchedulerException) e).kind()).isEqualTo(ErrorKind.CANT_ADD));
    }

    @Test
    void removingUnknownJobShouldFailWithCantRemove() {
        assertThatThrownBy(() -> scheduler.remove(UUID.randomUUID()))
                .isInstanceOf(JobSchedulerException.class)
                .satisfies(e -> assertThat(((JobSchedulerException) e).kind()).isEqualTo(ErrorKind.CANT_REMOVE));
    }

    @Test
    void singleRunJobShouldRunOnceThenBeRemoved() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        scheduler.start();

        UUID id = scheduler.repeated(Duration.ofSeconds(1), (jobId, s) -> runs.incrementAndGet())
                .repeatTimes(1)
                .add();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(runs).hasValue(1);
            assertThat(scheduler.jobIds()).doesNotContain(id);
        });
        Thread.sleep(1_500);
        assertThat(runs).hasValue(1);
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(store.get(id).join()).isEmpty());
    }

    @Test
    void slowJobShouldNeverRunConcurrently() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger runs = new AtomicInteger();
        scheduler.start();

        scheduler.repeated(Duration.ofMillis(100), (jobId, s) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(400);
            } finally {
                inFlight.decrementAndGet();
                runs.incrementAndGet();
            }
        }).startImmediately().add();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertThat(runs.get()).isGreaterThanOrEqualTo(3));
        assertThat(maxInFlight).hasValue(1);
    }

    @Test
    void everySecondCronShouldCountTwoOrThreeRunsInThreeSeconds() throws InterruptedException {
        TickScheduler defaultTicking = new TickScheduler(new SchedulerProperties(), new InMemoryMetadataStore());
        AtomicInteger counter = new AtomicInteger();
        List<Integer> observed = new ArrayList<>();
        try {
            defaultTicking.start();
            // start just past a second boundary so at most three boundaries fall in the window
            long millis = System.currentTimeMillis();
            Thread.sleep(1_000 - millis % 1_000 + 50);

            defaultTicking.cron("* * * * * *", (jobId, s) -> counter.incrementAndGet()).add();

            long deadline = System.currentTimeMillis() + 3_200;
            while (System.currentTimeMillis() < deadline) {
                observed.add(counter.get());
                Thread.sleep(100);
            }
            observed.add(counter.get());
        } finally {
            defaultTicking.stop();
        }

        assertThat(observed.get(observed.size() - 1)).isBetween(2, 3);
        assertThat(observed).isSorted();
    }

    @Test
    void listenersShouldSeeStartedAndDone() {
        Queue<JobState> events = new ConcurrentLinkedQueue<>();
        UUID listener = scheduler.addListener((jobId, listenerId, state) -> events.add(state));
        scheduler.start();

        scheduler.repeated(Duration.ofSeconds(1), (jobId, s) -> { })
                .repeatTimes(1)
                .startImmediately()
                .onStarted(listener)
                .onDone(listener)
                .on(JobState.REMOVED, listener)
                .add();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(events).contains(JobState.STARTED, JobState.DONE, JobState.REMOVED));
    }

    @Test
    void failingJobShouldNotStopTheLoop() {
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.start();

        scheduler.repeated(Duration.ofMillis(100), (jobId, s) -> {
            throw new IllegalStateException("simulated job failure");
        }).startImmediately().add();
        scheduler.repeated(Duration.ofMillis(100), (jobId, s) -> healthyRuns.incrementAndGet())
                .startImmediately()
                .add();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(healthyRuns.get()).isGreaterThanOrEqualTo(3));
    }

    @Test
    void failingStoreShouldNotStopExecution() {
        MetadataStore failing = mock(MetadataStore.class);
        when(failing.init()).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.addOrUpdate(any(JobStoredData.class))).thenReturn(CompletableFuture.failedFuture(
                new JobSchedulerException(ErrorKind.UPDATE_JOB_DATA, "simulated store outage")));
        when(failing.delete(any(UUID.class))).thenReturn(CompletableFuture.failedFuture(
                new JobSchedulerException(ErrorKind.CANT_REMOVE, "simulated store outage")));
        TickScheduler withFailingStore = new TickScheduler(props(Duration.ofMillis(50)), failing);
        AtomicInteger runs = new AtomicInteger();
        try {
            withFailingStore.start();
            withFailingStore.repeated(Duration.ofMillis(100), (jobId, s) -> runs.incrementAndGet())
                    .startImmediately()
                    .add();

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(runs.get()).isGreaterThanOrEqualTo(3));
            verify(failing, atLeastOnce()).addOrUpdate(any(JobStoredData.class));
        } finally {
            withFailingStore.stop();
        }
    }

    @Test
    void stoppedJobShouldBeRemovedOnNextTick() {
        scheduler.start();
        UUID id = scheduler.repeated(Duration.ofMinutes(5), (jobId, s) -> { }).add();

        scheduler.stopJob(id);

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(scheduler.jobIds()).doesNotContain(id));
    }

    @Test
    void stoppingUnknownJobShouldFailWithGetJobData() {
        assertThatThrownBy(() -> scheduler.stopJob(UUID.randomUUID()))
                .isInstanceOf(JobSchedulerException.class)
                .satisfies(e -> assertThat(((JobSchedulerException) e).kind()).isEqualTo(ErrorKind.GET_JOB_DATA));
    }

    @Test
    void storeShouldMirrorRunState() {
        scheduler.start();
        UUID id = scheduler.repeated(Duration.ofSeconds(2), (jobId, s) -> { }).startImmediately().add();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            JobStoredData data = store.get(id).join().orElseThrow();
            assertThat(data.ran()).isTrue();
            assertThat(data.count()).isGreaterThanOrEqualTo(1);
            assertThat(data.repeatedEverySeconds()).isEqualTo(2L);
            assertThat(data.nextTick()).isAfter(data.lastTick());
        });
    }

    @Test
    void storeInitFailureShouldFailStartWithCantInit() {
        MetadataStore broken = mock(MetadataStore.class);
        when(broken.init()).thenReturn(CompletableFuture.failedFuture(
                new JobSchedulerException(ErrorKind.CANT_INIT, "simulated init failure")));
        TickScheduler withBrokenStore = new TickScheduler(props(Duration.ofMillis(50)), broken);

        assertThatThrownBy(withBrokenStore::start)
                .isInstanceOf(JobSchedulerException.class)
                .satisfies(e -> assertThat(((JobSchedulerException) e).kind()).isEqualTo(ErrorKind.CANT_INIT));
        assertThat(withBrokenStore.isRunning()).isFalse();
    }

    @Test
    void shutdownShouldClearJobsAndFireHandlerOnce() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.setShutdownHandler(ShutdownHandler.of(calls::incrementAndGet));
        scheduler.repeated(Duration.ofMinutes(1), (jobId, s) -> { }).add();
        scheduler.cron("0 0 * * * *", (jobId, s) -> { }).add();

        scheduler.shutdown().join();
        scheduler.shutdown().join();

        assertThat(scheduler.jobIds()).isEmpty();
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(calls).hasValue(1));
    }

    @Test
    void addedThenRemovedJobsShouldLeaveNoStoreRows() {
        scheduler.start();

        for (int i = 0; i < 2000; i++) {
            UUID id = scheduler.repeated(Duration.ofMinutes(5), (jobId, s) -> { }).add();
            scheduler.remove(id);
        }

        assertThat(scheduler.jobIds()).isEmpty();
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertThat(store.size()).isZero());
    }

    @Test
    void removingRunningJobShouldLetItFinishThenDeleteRow() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        scheduler.start();
        UUID id = scheduler.repeated(Duration.ofMinutes(5), blockingJob(started, release, finished))
                .startImmediately()
                .add();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.remove(id);

        assertThat(scheduler.jobIds()).doesNotContain(id);
        assertRowKeptWhileRunning(id);

        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(store.get(id).join()).isEmpty());
    }

    @Test
    void shutdownWithRunningJobShouldLetItFinishThenDeleteRow() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        scheduler.start();
        UUID id = scheduler.repeated(Duration.ofMinutes(5), blockingJob(started, release, finished))
                .startImmediately()
                .add();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.shutdown().join();

        assertThat(scheduler.jobIds()).isEmpty();
        assertRowKeptWhileRunning(id);

        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(store.size()).isZero());
    }

    @Test
    void stopShouldShutDownOwnedNotifierPool() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.setShutdownHandler(ShutdownHandler.of(calls::incrementAndGet));
        scheduler.start();
        scheduler.shutdown().join();
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(calls).hasValue(1));

        scheduler.stop();

        assertThat(scheduler.isNotifierPoolShutdown()).isTrue();
    }

    @Test
    void injectedNotifierExecutorShouldRunListenersAndOutliveStop() {
        ExecutorService notifications = Executors.newSingleThreadExecutor(r -> new Thread(r, "host-notifier"));
        TickScheduler withExecutor = new TickScheduler(props(Duration.ofMillis(50)), new JobRegistry(), store, notifications);
        Queue<String> threads = new ConcurrentLinkedQueue<>();
        try {
            UUID listener = withExecutor.addListener((jobId, listenerId, state) -> threads.add(Thread.currentThread().getName()));
            withExecutor.start();
            withExecutor.repeated(Duration.ofSeconds(1), (jobId, s) -> { })
                    .repeatTimes(1)
                    .startImmediately()
                    .onStarted(listener)
                    .add();

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(threads).containsOnly("host-notifier"));

            withExecutor.stop();

            assertThat(notifications.isShutdown()).isFalse();
        } finally {
            withExecutor.stop();
            notifications.shutdownNow();
        }
    }

    private static JobExecution blockingJob(CountDownLatch started, CountDownLatch release, CountDownLatch finished) {
        return (jobId, s) -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
        };
    }

    // the row must survive while the execution is still in flight
    private void assertRowKeptWhileRunning(UUID id) {
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(store.get(id).join()).isPresent());
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(store.get(id).join()).isPresent());
    }

    private static SchedulerProperties props(Duration tickInterval) {
        SchedulerProperties props = new SchedulerProperties();
        props.setTickInterval(tickInterval);
        return props;
    }
}
