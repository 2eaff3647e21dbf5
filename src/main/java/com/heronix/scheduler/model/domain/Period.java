package com.heronix.scheduler.model.domain;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A class period in the school day.
 *
 * Periods never overlap each other; sections reference the period they meet in.
 */
@Entity
@Table(name = "periods", indexes = {
    @Index(name = "idx_period_name", columnList = "name", unique = true),
    @Index(name = "idx_period_times", columnList = "start_time, end_time")
})
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Period {

    private static final int MINUTES_PER_DAY = 24 * 60;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @NotNull
    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @NotNull
    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    /**
     * Length in minutes. A period ending before it starts is taken to cross midnight.
     */
    public long durationMinutes() {
        Duration duration = Duration.between(startTime, endTime);
        if (duration.isNegative()) {
            duration = duration.plusDays(1);
        }
        return duration.toMinutes();
    }

    /**
     * Check whether this period shares any time with another one, taking
     * periods that cross midnight into account.
     */
    public boolean overlaps(Period other) {
        int start = startTime.toSecondOfDay() / 60;
        int end = start + (int) durationMinutes();
        int otherStart = other.startTime.toSecondOfDay() / 60;
        int otherEnd = otherStart + (int) other.durationMinutes();
        for (int shift : new int[] {-MINUTES_PER_DAY, 0, MINUTES_PER_DAY}) {
            if (start < otherEnd + shift && otherStart + shift < end) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Period other = (Period) o;
        if (id == null || other.id == null) {
            return false;
        }
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
