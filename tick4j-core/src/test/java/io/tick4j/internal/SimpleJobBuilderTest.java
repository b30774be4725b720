package io.tick4j.internal;

import io.tick4j.core.CronSchedule;
import io.tick4j.core.JobSpec;
import io.tick4j.core.JobState;
import io.tick4j.core.JobType;
import io.tick4j.core.RepeatingSchedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleJobBuilderTest {

    private final List<JobSpec> registered = new ArrayList<>();

    private UUID register(JobSpec spec) {
        registered.add(spec);
        return spec.id() != null ? spec.id() : UUID.randomUUID();
    }

    @Test
    void cronBuilderShouldApplyTimezone() {
        JobSpec spec = SimpleJobBuilder.cron("0 30 9 * * *", (id, s) -> { }, this::register)
                .timezone("Asia/Taipei")
                .build();

        assertThat(spec.schedule()).isInstanceOf(CronSchedule.class);
        assertThat(((CronSchedule) spec.schedule()).zone()).isEqualTo(ZoneId.of("Asia/Taipei"));
        assertThat(spec.schedule().jobType()).isEqualTo(JobType.CRON);
    }

    @Test
    void malformedCronShouldFailFast() {
        assertThatThrownBy(() -> SimpleJobBuilder.cron("not a cron", (id, s) -> { }, this::register))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void repeatTimesShouldBoundTheBudget() {
        JobSpec spec = SimpleJobBuilder.repeated(Duration.ofSeconds(5), (id, s) -> { }, this::register)
                .repeatTimes(3)
                .build();

        RepeatingSchedule schedule = (RepeatingSchedule) spec.schedule();
        assertThat(schedule.repeatIndefinitely()).isFalse();
        assertThat(schedule.remaining()).isEqualTo(3);
        assertThat(schedule.interval()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void repeatedWithoutTimesShouldRepeatIndefinitely() {
        JobSpec spec = SimpleJobBuilder.repeated(Duration.ofSeconds(5), (id, s) -> { }, this::register).build();

        assertThat(((RepeatingSchedule) spec.schedule()).repeatIndefinitely()).isTrue();
        assertThat(spec.firstRunAt()).isNull();
    }

    @Test
    void repeatTimesShouldBeRejectedForCronAndOneShot() {
        assertThatThrownBy(() -> SimpleJobBuilder.cron("0 * * * * *", (id, s) -> { }, this::register).repeatTimes(2))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> SimpleJobBuilder.oneShot(Duration.ofSeconds(1), (id, s) -> { }, this::register).repeatTimes(2))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void oneShotShouldRunOnce() {
        JobSpec spec = SimpleJobBuilder.oneShot(Duration.ofSeconds(10), (id, s) -> { }, this::register).build();

        RepeatingSchedule schedule = (RepeatingSchedule) spec.schedule();
        assertThat(schedule.jobType()).isEqualTo(JobType.ONE_SHOT);
        assertThat(schedule.remaining()).isEqualTo(1);
    }

    @Test
    void startImmediatelyShouldSetFirstRun() {
        Instant before = Instant.now();
        JobSpec spec = SimpleJobBuilder.repeated(Duration.ofHours(1), (id, s) -> { }, this::register)
                .startImmediately()
                .build();

        assertThat(spec.firstRunAt()).isBetween(before, Instant.now());
    }

    @Test
    void addShouldHandTheSpecToTheRegistrar() {
        UUID id = UUID.randomUUID();
        UUID listenerId = UUID.randomUUID();
        byte[] payload = {4, 2};

        UUID returned = SimpleJobBuilder.repeated(Duration.ofSeconds(1), (jobId, s) -> { }, this::register)
                .id(id)
                .extra(payload)
                .onDone(listenerId)
                .add();
        payload[0] = 9;

        assertThat(returned).isEqualTo(id);
        assertThat(registered).hasSize(1);
        JobSpec spec = registered.get(0);
        assertThat(spec.extra()).containsExactly(4, 2);
        assertThat(spec.listenersFor(JobState.DONE)).containsExactly(listenerId);
        assertThat(spec.listenersFor(JobState.STARTED)).isEmpty();
    }
}
