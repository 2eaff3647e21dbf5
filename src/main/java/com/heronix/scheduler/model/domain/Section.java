package com.heronix.scheduler.model.domain;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One scheduled instance of a course.
 *
 * A section references (but does not own) its teacher, period and room; any of
 * them may be missing. The enrolled students are written by the distributors.
 */
@Entity
@Table(name = "sections",
    uniqueConstraints = @UniqueConstraint(name = "uk_section_course_number",
            columnNames = {"course_id", "section_number"}),
    indexes = {
        @Index(name = "idx_section_teacher_period", columnList = "teacher_id, period_id"),
        @Index(name = "idx_section_room_period", columnList = "room_id, period_id"),
        @Index(name = "idx_section_trimester", columnList = "trimester")
    })
@Getter
@Setter
@ToString(exclude = {"course", "teacher", "period", "room", "students"})
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Section {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @NotNull
    @Min(1)
    @Column(name = "section_number", nullable = false)
    private Integer sectionNumber;

    /**
     * Generated on first save, e.g. ENG7-1.
     */
    @Column(name = "name", nullable = false, unique = true, length = 150)
    private String name;

    /**
     * Trimester 1-3. Required for trimester courses, absent for year-long ones.
     */
    @Min(1)
    @Max(3)
    @Column(name = "trimester")
    private Integer trimester;

    /**
     * Per-section override of the course's maximum section size.
     */
    @Min(1)
    @Column(name = "max_students")
    private Integer maxStudents;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private User teacher;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "period_id")
    private Period period;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room_id")
    private Room room;

    @ManyToMany
    @JoinTable(name = "section_enrollments",
            joinColumns = @JoinColumn(name = "section_id"),
            inverseJoinColumns = @JoinColumn(name = "student_id"))
    @Builder.Default
    private Set<User> students = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        if (name == null && course != null && sectionNumber != null) {
            name = buildName(course, sectionNumber);
        }
    }

    public static String buildName(Course course, int sectionNumber) {
        return course.getLabel() + "-" + sectionNumber;
    }

    /**
     * Largest number of students this section may hold: the section override (or
     * the course maximum), further capped by the room when one is assigned.
     */
    public int getEffectiveCapacity() {
        int capacity = maxStudents != null ? maxStudents : course.getMaxStudentsPerSection();
        if (room != null && room.getCapacity() != null) {
            capacity = Math.min(capacity, room.getCapacity());
        }
        return capacity;
    }

    public int getEnrolledCount() {
        return students.size();
    }

    public boolean isAtCapacity() {
        return getEnrolledCount() >= getEffectiveCapacity();
    }

    public void enroll(User student) {
        students.add(student);
    }

    public void clearEnrollment() {
        students.clear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Section other = (Section) o;
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
