package io.stackcontroller.scheduler;

import io.stackcontroller.models.ScheduledTask;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ScheduleTest {

    @Test
    void testCron_EveryFifteenMinutesFromQuarterPast() {
        CronSchedule schedule = new CronSchedule("0 15-59/15 * * * *");

        Instant first = schedule.next(Instant.parse("2024-03-01T12:00:00Z"));
        Instant second = schedule.next(first);
        Instant third = schedule.next(second);
        Instant fourth = schedule.next(third);

        assertThat(first).isEqualTo(Instant.parse("2024-03-01T12:15:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2024-03-01T12:30:00Z"));
        assertThat(third).isEqualTo(Instant.parse("2024-03-01T12:45:00Z"));
        assertThat(fourth).isEqualTo(Instant.parse("2024-03-01T13:15:00Z"));
    }

    @Test
    void testCron_MonthlyIsEvaluatedInUtc() {
        CronSchedule schedule = new CronSchedule("0 0 0 1 * *");

        assertThat(schedule.next(Instant.parse("2024-03-01T00:00:00Z"))).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
    }

    @Test
    void testCron_InvalidExpressionRejected() {
        assertThatThrownBy(() -> new CronSchedule("every minute"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInterval_AlignedToEpoch() {
        IntervalSchedule schedule = new IntervalSchedule(Duration.ofMinutes(1));

        assertThat(schedule.next(Instant.parse("2024-03-01T12:00:00Z"))).isEqualTo(Instant.parse("2024-03-01T12:01:00Z"));
        assertThat(schedule.next(Instant.parse("2024-03-01T12:00:42.5Z"))).isEqualTo(Instant.parse("2024-03-01T12:01:00Z"));
    }

    @Test
    void testInterval_NonPositiveRejected() {
        assertThatThrownBy(() -> new IntervalSchedule(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testOf_RequiresExactlyOneOfCronAndInterval() {
        ScheduledTask both = ScheduledTask.builder()
                .name("update-fees-every-1-month")
                .taskName("tasks.task.update_fees")
                .cronExpression("0 0 0 1 * *")
                .interval(Duration.ofDays(30))
                .build();
        ScheduledTask neither = ScheduledTask.builder().name("empty").taskName("tasks.task.update_fees").build();

        assertThatThrownBy(() -> Schedule.of(both)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Schedule.of(neither)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Schedule.of(ScheduledTask.builder().name("x").taskName("y").interval(Duration.ofMinutes(1)).build()))
                .isInstanceOf(IntervalSchedule.class);
    }
}
