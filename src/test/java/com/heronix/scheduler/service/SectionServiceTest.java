package com.heronix.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import com.heronix.scheduler.SchedulerTestData;
import com.heronix.scheduler.exception.ResourceNotFoundException;
import com.heronix.scheduler.exception.SchedulingValidationException;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.domain.Room;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.dto.SectionDTO;
import com.heronix.scheduler.model.dto.SectionRequestDTO;
import com.heronix.scheduler.model.enums.CourseDuration;
import com.heronix.scheduler.model.enums.CourseType;

@SpringBootTest
@Import(SchedulerTestData.class)
class SectionServiceTest {

    @Autowired
    private SectionService sectionService;

    @Autowired
    private SchedulerTestData data;

    private Period first;
    private Period second;
    private Course english;
    private Course trimesterCourse;

    @BeforeEach
    void setUp() {
        data.reset();
        first = data.period("Period 1", "08:00", "08:50");
        second = data.period("Period 2", "09:00", "09:50");
        english = data.coreCourse("ENG6", 6, List.of());
        trimesterCourse = data.course("HLTH6", 6, CourseType.REQUIRED_ELECTIVE, CourseDuration.TRIMESTER, 25, List.of());
    }

    @Test
    void numbersAndNamesNewSections() {
        SectionDTO firstSection = sectionService.createSection(request(english).periodId(first.getId()).build());
        SectionDTO secondSection = sectionService.createSection(request(english).periodId(second.getId()).build());

        assertThat(firstSection.getName()).isEqualTo("ENG6-1");
        assertThat(secondSection.getSectionNumber()).isEqualTo(2);
        assertThat(secondSection.getName()).isEqualTo("ENG6-2");
        assertThat(secondSection.getEffectiveCapacity()).isEqualTo(30);
        assertThat(sectionService.listSections(english.getId())).hasSize(2);
    }

    @Test
    void rejectsTakenSectionNumber() {
        sectionService.createSection(request(english).sectionNumber(3).build());

        assertThatThrownBy(() -> sectionService.createSection(request(english).sectionNumber(3).build()))
                .isInstanceOf(SchedulingValidationException.class);
    }

    @Test
    void trimesterCourseNeedsTrimester() {
        assertThatThrownBy(() -> sectionService.createSection(request(trimesterCourse).build()))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("Trimester is required");

        SectionDTO section = sectionService.createSection(request(trimesterCourse).trimester(2).build());
        assertThat(section.getTrimester()).isEqualTo(2);
    }

    @Test
    void yearCourseRejectsTrimester() {
        assertThatThrownBy(() -> sectionService.createSection(request(english).trimester(1).build()))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("Year-long");
    }

    @Test
    void teacherTeachesOneSectionPerPeriod() {
        User teacher = data.teacher("mrs.lee");
        sectionService.createSection(request(english).teacherId(teacher.getId()).periodId(first.getId()).build());

        assertThatThrownBy(() -> sectionService.createSection(
                request(trimesterCourse).trimester(1).teacherId(teacher.getId()).periodId(first.getId()).build()))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("already teaches");
    }

    @Test
    void roomHostsOneSectionPerPeriod() {
        Room room = data.room("Room 101", 30);
        sectionService.createSection(request(english).roomId(room.getId()).periodId(first.getId()).build());
        SectionDTO other = sectionService.createSection(
                request(trimesterCourse).trimester(1).roomId(room.getId()).periodId(second.getId()).build());

        assertThatThrownBy(() -> sectionService.assignPeriod(other.getId(), first.getId()))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("already in use");
    }

    @Test
    void assignPeriodMovesSection() {
        SectionDTO section = sectionService.createSection(request(english).periodId(first.getId()).build());

        SectionDTO moved = sectionService.assignPeriod(section.getId(), second.getId());

        assertThat(moved.getPeriodName()).isEqualTo("Period 2");
        assertThat(sectionService.listSections(null)).extracting(SectionDTO::getPeriodId)
                .containsExactly(second.getId());
    }

    @Test
    void studentCannotTeach() {
        User student = data.students(6, 1).get(0);

        assertThatThrownBy(() -> sectionService.createSection(request(english).teacherId(student.getId()).build()))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("is not a teacher");
    }

    @Test
    void unknownCourseIsNotFound() {
        assertThatThrownBy(() -> sectionService.createSection(SectionRequestDTO.builder().courseId(9_999L).build()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private SectionRequestDTO.SectionRequestDTOBuilder request(Course course) {
        return SectionRequestDTO.builder().courseId(course.getId());
    }
}
