package com.heronix.scheduler.model.domain;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import com.heronix.scheduler.model.enums.CourseDuration;
import com.heronix.scheduler.model.enums.CourseType;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * An academic offering for one grade level.
 *
 * Students sign up for the course first (the registered roster); the
 * distributors later place each registered student into one of the course's
 * sections.
 */
@Entity
@Table(name = "courses", indexes = {
    @Index(name = "idx_course_grade_name", columnList = "grade_level, name"),
    @Index(name = "idx_course_type_grade", columnList = "course_type, grade_level"),
    @Index(name = "idx_course_duration_grade", columnList = "duration, grade_level")
})
@Getter
@Setter
@ToString(exclude = {"registeredStudents", "courseGroup"})
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Short code such as ENG7, letters and digits only.
     */
    @Pattern(regexp = "[A-Za-z0-9]+", message = "Course code must contain only letters and numbers")
    @Column(name = "code", unique = true, length = 20)
    private String code;

    @Column(name = "description", length = 1000)
    private String description;

    @NotNull
    @Min(6)
    @Max(12)
    @Column(name = "grade_level", nullable = false)
    private Integer gradeLevel;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "course_type", nullable = false, length = 20)
    @Builder.Default
    private CourseType courseType = CourseType.CORE;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "duration", nullable = false, length = 10)
    @Builder.Default
    private CourseDuration duration = CourseDuration.TRIMESTER;

    /**
     * Number of sections the course is meant to offer.
     */
    @NotNull
    @Min(1)
    @Column(name = "num_sections", nullable = false)
    @Builder.Default
    private Integer numSections = 1;

    @NotNull
    @Min(1)
    @Column(name = "max_students_per_section", nullable = false)
    @Builder.Default
    private Integer maxStudentsPerSection = 30;

    /**
     * Exclusivity group, if the course is one of several mutually exclusive offerings.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_group_id")
    private CourseGroup courseGroup;

    @Valid
    @Embedded
    private StudentCountRequirement studentCountRequirement;

    /**
     * Students signed up for the course, not yet placed in a section.
     */
    @ManyToMany
    @JoinTable(name = "course_registrations",
            joinColumns = @JoinColumn(name = "course_id"),
            inverseJoinColumns = @JoinColumn(name = "student_id"))
    @Builder.Default
    private Set<User> registeredStudents = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Code if present, otherwise the name. Used to build section names.
     */
    public String getLabel() {
        return code != null && !code.isBlank() ? code : name;
    }

    public boolean isLanguage() {
        return courseType == CourseType.LANGUAGE;
    }

    /**
     * Register a student for this course.
     */
    public void register(User student) {
        registeredStudents.add(student);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Course other = (Course) o;
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
