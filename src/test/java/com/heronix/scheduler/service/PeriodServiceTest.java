package com.heronix.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalTime;
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
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.dto.PeriodDTO;
import com.heronix.scheduler.model.dto.PeriodRequestDTO;
import com.heronix.scheduler.repository.SectionRepository;

@SpringBootTest
@Import(SchedulerTestData.class)
class PeriodServiceTest {

    @Autowired
    private PeriodService periodService;

    @Autowired
    private SchedulerTestData data;

    @Autowired
    private SectionRepository sectionRepository;

    @BeforeEach
    void setUp() {
        data.reset();
    }

    @Test
    void listsPeriodsByStartTime() {
        periodService.createPeriod(request("Period 2", "09:00", "09:50"));
        periodService.createPeriod(request("Period 1", "08:00", "08:50"));

        assertThat(periodService.listPeriods())
                .extracting(PeriodDTO::getName)
                .containsExactly("Period 1", "Period 2");
    }

    @Test
    void rejectsOverlappingPeriod() {
        periodService.createPeriod(request("Period 1", "08:00", "08:50"));

        assertThatThrownBy(() -> periodService.createPeriod(request("Assembly", "08:30", "09:10")))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("overlaps with period Period 1");
    }

    @Test
    void backToBackPeriodsDoNotOverlap() {
        periodService.createPeriod(request("Period 1", "08:00", "08:50"));

        PeriodDTO next = periodService.createPeriod(request("Period 2", "08:50", "09:40"));

        assertThat(next.getDurationMinutes()).isEqualTo(50);
    }

    @Test
    void rejectsPeriodShorterThanThirtyMinutes() {
        assertThatThrownBy(() -> periodService.createPeriod(request("Homeroom", "08:00", "08:20")))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("at least 30 minutes");
    }

    @Test
    void measuresPeriodAcrossMidnight() {
        PeriodDTO late = periodService.createPeriod(request("Night", "23:45", "00:30"));

        assertThat(late.getDurationMinutes()).isEqualTo(45);
        assertThatThrownBy(() -> periodService.createPeriod(request("Early", "00:00", "01:00")))
                .isInstanceOf(SchedulingValidationException.class);
    }

    @Test
    void rejectsDuplicateName() {
        periodService.createPeriod(request("Period 1", "08:00", "08:50"));

        assertThatThrownBy(() -> periodService.createPeriod(request("Period 1", "13:00", "13:50")))
                .isInstanceOf(SchedulingValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void deletingPeriodDetachesItsSections() {
        Period period = data.period("Period 1", "08:00", "08:50");
        Course english = data.coreCourse("ENG6", 6, List.of());
        Section section = data.section(english, 1, period, null);
        data.languageGroup("Grade 6 languages", 6, List.of(period), List.of());

        periodService.deletePeriod(period.getId());

        List<Section> remaining = sectionRepository.findByCourse_IdOrderBySectionNumberAsc(english.getId());
        assertThat(remaining).extracting(Section::getId).containsExactly(section.getId());
        assertThat(remaining.get(0).getPeriod()).isNull();
        assertThat(periodService.listPeriods()).isEmpty();
    }

    @Test
    void deletingUnknownPeriodIsNotFound() {
        assertThatThrownBy(() -> periodService.deletePeriod(77L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private PeriodRequestDTO request(String name, String start, String end) {
        return PeriodRequestDTO.builder()
                .name(name)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .build();
    }
}
