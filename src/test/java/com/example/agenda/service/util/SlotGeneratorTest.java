package com.example.agenda.service.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.agenda.service.util.IntervalAlgebraTest.at;
import static com.example.agenda.service.util.IntervalAlgebraTest.time;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotGeneratorTest {

    @Test
    void shouldSlideWindowAcrossFreeIntervals() {
        List<TimeInterval> slots = collect(SlotGenerator.slots(
                List.of(at("08:30", "09:30"), at("10:00", "10:45")), 30, 15));

        assertThat(slots).containsExactly(
                at("08:30", "09:00"),
                at("08:45", "09:15"),
                at("09:00", "09:30"),
                at("10:00", "10:30"),
                at("10:15", "10:45"));
    }

    @Test
    void shouldSkipFreeIntervalShorterThanDuration() {
        List<TimeInterval> slots = collect(SlotGenerator.slots(
                List.of(at("08:00", "08:20"), at("09:00", "09:30")), 30, 15));

        assertThat(slots).containsExactly(at("09:00", "09:30"));
    }

    @Test
    void shouldNeverExtendPastFreeIntervalEnd() {
        List<TimeInterval> free = List.of(at("08:00", "09:10"));

        List<TimeInterval> slots = collect(SlotGenerator.slots(free, 45, 20));

        assertThat(slots).containsExactly(at("08:00", "08:45"), at("08:20", "09:05"));
        assertThat(slots).allSatisfy(s -> {
            assertThat(s.durationMinutes()).isEqualTo(45);
            assertThat(free.get(0).contains(s)).isTrue();
        });
    }

    @Test
    void shouldBeRestartable() {
        Iterable<TimeInterval> slots = SlotGenerator.slots(List.of(at("08:00", "10:00")), 30, 30);

        assertThat(collect(slots)).hasSize(4).isEqualTo(collect(slots));
    }

    @Test
    void shouldRejectNonPositiveStep() {
        assertThatThrownBy(() -> SlotGenerator.slots(List.of(at("08:00", "10:00")), 30, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stepMinutes");
    }

    @Test
    void shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> SlotGenerator.slots(List.of(at("08:00", "10:00")), 0, 15))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("durationMinutes");
    }

    @Test
    void freeIntervalsShouldSubtractMergedBusyFromBusinessHours() {
        List<TimeInterval> free = SlotGenerator.freeIntervals(
                List.of(at("14:00", "19:00"), at("08:00", "12:00")),
                List.of(at("08:00", "08:30"), at("08:30", "08:40"), at("15:00", "16:00")));

        assertThat(free).containsExactly(
                at("08:40", "12:00"),
                at("14:00", "15:00"),
                at("16:00", "19:00"));
        assertThat(free.get(0).start()).isEqualTo(time("08:40"));
    }

    private static List<TimeInterval> collect(Iterable<TimeInterval> slots) {
        List<TimeInterval> out = new ArrayList<>();
        slots.forEach(out::add);
        return out;
    }
}
