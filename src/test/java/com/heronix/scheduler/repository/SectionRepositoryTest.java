package com.heronix.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.enums.UserRole;

@DataJpaTest
class SectionRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private SectionRepository sectionRepository;

    private User student;
    private Period first;
    private Period second;
    private Course english;
    private Course math;

    @BeforeEach
    void setUp() {
        student = entityManager.persist(User.builder()
                .username("student-1")
                .role(UserRole.STUDENT)
                .gradeLevel(6)
                .build());
        first = entityManager.persist(Period.builder()
                .name("Period 1").startTime(LocalTime.of(8, 0)).endTime(LocalTime.of(8, 50)).build());
        second = entityManager.persist(Period.builder()
                .name("Period 2").startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(9, 50)).build());
        english = entityManager.persist(Course.builder().name("English 6").code("ENG6").gradeLevel(6).build());
        math = entityManager.persist(Course.builder().name("Math 6").code("MATH6").gradeLevel(6).build());

        Section englishSection = Section.builder()
                .course(english)
                .sectionNumber(1)
                .period(first)
                .students(new HashSet<>(Set.of(student)))
                .build();
        entityManager.persist(englishSection);
        entityManager.flush();
    }

    @Test
    void conflictOnlyForOtherCourses() {
        assertThat(sectionRepository.existsEnrollmentInPeriodOutsideCourse(
                student.getId(), first.getId(), math.getId())).isTrue();
        assertThat(sectionRepository.existsEnrollmentInPeriodOutsideCourse(
                student.getId(), first.getId(), english.getId())).isFalse();
        assertThat(sectionRepository.existsEnrollmentInPeriodOutsideCourse(
                student.getId(), second.getId(), math.getId())).isFalse();
    }

    @Test
    void loadsPlacementsOfStudents() {
        List<Object[]> placements = sectionRepository.findPlacementsOfStudents(List.of(student.getId()));

        assertThat(placements).hasSize(1);
        assertThat(placements.get(0)).containsExactly(student.getId(), first.getId(), english.getId());
    }

    @Test
    void generatesSectionNameOnSave() {
        Section section = sectionRepository.saveAndFlush(Section.builder()
                .course(math)
                .sectionNumber(4)
                .build());

        assertThat(section.getName()).isEqualTo("MATH6-4");
        assertThat(sectionRepository.findMaxSectionNumber(math.getId())).isEqualTo(4);
        assertThat(sectionRepository.findMaxSectionNumber(999L)).isZero();
    }

    @Test
    void countsDistinctStudentsPerPeriodForGrade() {
        List<Object[]> rows = sectionRepository.countStudentsPerPeriodForGrade(6);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)[1]).isEqualTo("Period 1");
        assertThat(((Number) rows.get(0)[2]).longValue()).isEqualTo(1L);
    }

    @Test
    void clearPeriodDetachesSections() {
        int updated = sectionRepository.clearPeriod(first.getId());

        assertThat(updated).isEqualTo(1);
        assertThat(sectionRepository.findByCourse_IdOrderBySectionNumberAsc(english.getId()).get(0).getPeriod())
                .isNull();
    }
}
