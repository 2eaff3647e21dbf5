package com.heronix.scheduler.service.distribution;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.scheduler.SchedulerTestData;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.LanguageGroup;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.dto.LanguageGroupResultDTO;
import com.heronix.scheduler.model.dto.SectionRosterDTO;
import com.heronix.scheduler.model.dto.StudentSummaryDTO;
import com.heronix.scheduler.model.enums.CourseDuration;
import com.heronix.scheduler.model.enums.CourseType;
import com.heronix.scheduler.repository.CourseRepository;
import com.heronix.scheduler.repository.SectionRepository;

@SpringBootTest
@Import(SchedulerTestData.class)
class LanguageGroupDistributionServiceTest {

    @Autowired
    private LanguageGroupDistributionService distributionService;

    @Autowired
    private SchedulerTestData data;

    @Autowired
    private SectionRepository sectionRepository;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private Period third;
    private Period fourth;

    @BeforeEach
    void setUp() {
        data.reset();
        third = data.period("Period 3", "10:00", "10:50");
        fourth = data.period("Period 4", "11:00", "11:50");
    }

    @Test
    void rotatesGradeSevenThroughFrenchAndSpanish() {
        List<User> students = data.students(7, 40);
        Course french = data.languageCourse("FR7", 7);
        Course spanish = data.languageCourse("SP7", 7);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third, fourth), List.of(french, spanish));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotalStudents()).isEqualTo(40);
        assertThat(result.getSections()).hasSize(4);
        assertThat(result.getSections()).extracting(SectionRosterDTO::getEnrolledCount)
                .containsExactly(20, 20, 20, 20);
        assertThat(result.getSections()).extracting(SectionRosterDTO::getTrimester)
                .containsExactly(1, 1, 2, 2);
        assertThat(result.getSections()).extracting(SectionRosterDTO::getPeriodName)
                .containsExactly("Period 3", "Period 4", "Period 3", "Period 4");

        // Each share keeps its period for both courses
        Map<String, Set<Long>> rosters = rosters(result);
        assertThat(rosters.get("FR7-1")).isEqualTo(rosters.get("SP7-1"));
        assertThat(rosters.get("FR7-2")).isEqualTo(rosters.get("SP7-2"));

        Set<Long> everyone = students.stream().map(User::getId).collect(Collectors.toSet());
        Set<Long> french1and2 = new HashSet<>(rosters.get("FR7-1"));
        french1and2.addAll(rosters.get("FR7-2"));
        assertThat(french1and2).isEqualTo(everyone);

        assertThat(registeredIds(french.getId())).isEqualTo(everyone);
        assertThat(registeredIds(spanish.getId())).isEqualTo(everyone);
    }

    @Test
    void spreadsRemainderInsteadOfDroppingIt() {
        data.students(7, 41);
        Course french = data.languageCourse("FR7", 7);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third, fourth), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.getSections()).extracting(SectionRosterDTO::getEnrolledCount)
                .containsExactly(21, 20);
        assertThat(sectionRepository.countEnrolledInCourse(french.getId())).isEqualTo(41);
    }

    @Test
    void configuredSeedRepeatsSharesAcrossRuns() {
        data.students(7, 30);
        Course french = data.languageCourse("FR7", 7);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third, fourth), List.of(french));

        Map<String, Set<Long>> firstRun = rosters(distributionService.distributeLanguageGroup(group.getId()));
        Map<String, Set<Long>> secondRun = rosters(distributionService.distributeLanguageGroup(group.getId()));

        assertThat(secondRun).isEqualTo(firstRun);
    }

    @Test
    void reusesExistingSectionsAndCreatesMissingOnes() {
        data.students(7, 10);
        Course french = data.languageCourse("FR7", 7);
        data.section(french, 1, fourth, 3);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third, fourth), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSections()).extracting(SectionRosterDTO::getSectionName)
                .containsExactly("FR7-2", "FR7-1");
        assertThat(result.getSections()).extracting(SectionRosterDTO::getTrimester)
                .containsOnly(1);
        assertThat(sectionRepository.countByCourse_Id(french.getId())).isEqualTo(2);
    }

    @Test
    void rejectsNonLanguageCourse() {
        data.students(7, 10);
        Course english = data.coreCourse("ENG7", 7, List.of());
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third), List.of(english));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("not a language course");
        assertThat(sectionRepository.countByCourse_Id(english.getId())).isZero();
    }

    @Test
    void rejectsMoreCoursesThanTrimesters() {
        data.students(7, 10);
        List<Course> courses = List.of(
                data.languageCourse("FR7", 7),
                data.languageCourse("SP7", 7),
                data.languageCourse("DE7", 7),
                data.languageCourse("LA7", 7));
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third), courses);

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("trimesters");
    }

    @Test
    void rejectsCourseFromAnotherGrade() {
        data.students(7, 10);
        Course french = data.languageCourse("FR8", 8);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("grade 8");
    }

    @Test
    void failsWithoutStudents() {
        Course french = data.languageCourse("FR7", 7);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("No students found in grade 7");
    }

    @Test
    void failsWithoutPeriods() {
        data.students(7, 5);
        Course french = data.languageCourse("FR7", 7);
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("No periods");
    }

    @Test
    void shareLargerThanSectionFailsWithoutWritingAnything() {
        data.students(7, 40);
        Course french = data.course("FR7", 7, CourseType.LANGUAGE, CourseDuration.TRIMESTER, 15, List.of());
        LanguageGroup group = data.languageGroup("Grade 7 languages", 7, List.of(third, fourth), List.of(french));

        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(group.getId());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("holds 15");
        assertThat(sectionRepository.countByCourse_Id(french.getId())).isZero();
        assertThat(registeredIds(french.getId())).isEmpty();
    }

    @Test
    void failsForUnknownGroup() {
        LanguageGroupResultDTO result = distributionService.distributeLanguageGroup(424_242L);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("not found");
    }

    @Test
    void splitGivesRemainderToFirstShares() {
        List<List<Integer>> shares = LanguageGroupDistributionService.split(List.of(1, 2, 3, 4, 5, 6, 7), 3);

        assertThat(shares).containsExactly(List.of(1, 2, 3), List.of(4, 5), List.of(6, 7));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Map<String, Set<Long>> rosters(LanguageGroupResultDTO result) {
        return result.getSections().stream().collect(Collectors.toMap(
                SectionRosterDTO::getSectionName,
                roster -> roster.getStudents().stream()
                        .map(StudentSummaryDTO::getId)
                        .collect(Collectors.toSet())));
    }

    private Set<Long> registeredIds(Long courseId) {
        return transactionTemplate.execute(status -> courseRepository.findById(courseId).orElseThrow()
                .getRegisteredStudents().stream()
                .map(User::getId)
                .collect(Collectors.toSet()));
    }
}
