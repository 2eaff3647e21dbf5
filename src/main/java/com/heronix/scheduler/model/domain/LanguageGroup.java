package com.heronix.scheduler.model.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Language courses of one grade level that share a set of periods.
 *
 * Every student of the grade takes every course of the group, one per
 * trimester: the course at position N runs in trimester N + 1. List order of
 * both courses and periods is significant and persisted.
 */
@Entity
@Table(name = "language_groups")
@Getter
@Setter
@ToString(exclude = {"periods", "courses"})
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @NotNull
    @Min(6)
    @Max(12)
    @Column(name = "grade_level", nullable = false)
    private Integer gradeLevel;

    @ManyToMany
    @JoinTable(name = "language_group_periods",
            joinColumns = @JoinColumn(name = "language_group_id"),
            inverseJoinColumns = @JoinColumn(name = "period_id"))
    @OrderColumn(name = "sort_order")
    @Builder.Default
    private List<Period> periods = new ArrayList<>();

    @ManyToMany
    @JoinTable(name = "language_group_courses",
            joinColumns = @JoinColumn(name = "language_group_id"),
            inverseJoinColumns = @JoinColumn(name = "course_id"))
    @OrderColumn(name = "sort_order")
    @Builder.Default
    private List<Course> courses = new ArrayList<>();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LanguageGroup other = (LanguageGroup) o;
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
