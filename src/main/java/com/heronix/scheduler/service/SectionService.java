package com.heronix.scheduler.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.scheduler.exception.ResourceNotFoundException;
import com.heronix.scheduler.exception.SchedulingValidationException;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.domain.Room;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.dto.SectionDTO;
import com.heronix.scheduler.model.dto.SectionRequestDTO;
import com.heronix.scheduler.model.enums.CourseDuration;
import com.heronix.scheduler.model.enums.UserRole;
import com.heronix.scheduler.repository.CourseRepository;
import com.heronix.scheduler.repository.PeriodRepository;
import com.heronix.scheduler.repository.RoomRepository;
import com.heronix.scheduler.repository.SectionRepository;
import com.heronix.scheduler.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates sections and moves them between periods.
 *
 * Rules enforced here:
 * - a trimester course's section names its trimester, a year-long one does not
 * - a teacher teaches at most one section per period
 * - a room hosts at most one section per period
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SectionService {

    private final SectionRepository sectionRepository;
    private final CourseRepository courseRepository;
    private final PeriodRepository periodRepository;
    private final RoomRepository roomRepository;
    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<SectionDTO> listSections(Long courseId) {
        List<Section> sections = courseId != null
                ? sectionRepository.findByCourse_IdOrderBySectionNumberAsc(courseId)
                : sectionRepository.findAllByOrderByCourse_IdAscSectionNumberAsc();
        return sections.stream()
                .map(SectionDTO::fromEntity)
                .toList();
    }

    @Transactional
    public SectionDTO createSection(SectionRequestDTO request) {
        Course course = courseRepository.findById(request.getCourseId())
                .orElseThrow(() -> new ResourceNotFoundException("Course", request.getCourseId()));

        int number = request.getSectionNumber() != null
                ? request.getSectionNumber()
                : sectionRepository.findMaxSectionNumber(course.getId()) + 1;
        if (sectionRepository.existsByCourse_IdAndSectionNumber(course.getId(), number)) {
            throw new SchedulingValidationException("Course " + course.getLabel()
                    + " already has a section number " + number);
        }
        String name = Section.buildName(course, number);
        if (sectionRepository.existsByName(name)) {
            throw new SchedulingValidationException("Section name " + name + " is already taken");
        }

        checkTrimester(course, request.getTrimester());

        Section section = Section.builder()
                .course(course)
                .sectionNumber(number)
                .name(name)
                .trimester(request.getTrimester())
                .maxStudents(request.getMaxStudents())
                .teacher(request.getTeacherId() != null ? findTeacher(request.getTeacherId()) : null)
                .period(request.getPeriodId() != null ? findPeriod(request.getPeriodId()) : null)
                .room(request.getRoomId() != null ? findRoom(request.getRoomId()) : null)
                .build();

        checkPeriodBookings(section);

        Section saved = sectionRepository.save(section);
        log.info("Created section {}", saved.getName());
        return SectionDTO.fromEntity(saved);
    }

    /**
     * Move a section to another period.
     */
    @Transactional
    public SectionDTO assignPeriod(Long sectionId, Long periodId) {
        Section section = sectionRepository.findById(sectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Section", sectionId));

        section.setPeriod(findPeriod(periodId));
        checkPeriodBookings(section);

        log.info("Section {} moved to period {}", section.getName(), section.getPeriod().getName());
        return SectionDTO.fromEntity(section);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void checkTrimester(Course course, Integer trimester) {
        if (course.getDuration() == CourseDuration.TRIMESTER && trimester == null) {
            throw new SchedulingValidationException("Trimester is required for trimester courses");
        }
        if (course.getDuration() == CourseDuration.YEAR && trimester != null) {
            throw new SchedulingValidationException("Year-long courses cannot have a trimester");
        }
    }

    private void checkPeriodBookings(Section section) {
        if (section.getPeriod() == null) {
            return;
        }
        Long periodId = section.getPeriod().getId();

        if (section.getTeacher() != null) {
            Long teacherId = section.getTeacher().getId();
            boolean taken = section.getId() == null
                    ? sectionRepository.existsByTeacher_IdAndPeriod_Id(teacherId, periodId)
                    : sectionRepository.existsByTeacher_IdAndPeriod_IdAndIdNot(teacherId, periodId, section.getId());
            if (taken) {
                throw new SchedulingValidationException("Teacher " + section.getTeacher().getFullName()
                        + " already teaches a section in period " + section.getPeriod().getName());
            }
        }

        if (section.getRoom() != null) {
            Long roomId = section.getRoom().getId();
            boolean taken = section.getId() == null
                    ? sectionRepository.existsByRoom_IdAndPeriod_Id(roomId, periodId)
                    : sectionRepository.existsByRoom_IdAndPeriod_IdAndIdNot(roomId, periodId, section.getId());
            if (taken) {
                throw new SchedulingValidationException("Room " + section.getRoom().getName()
                        + " is already in use in period " + section.getPeriod().getName());
            }
        }
    }

    private User findTeacher(Long teacherId) {
        User teacher = userRepository.findById(teacherId)
                .orElseThrow(() -> new ResourceNotFoundException("Teacher", teacherId));
        if (teacher.getRole() != UserRole.TEACHER) {
            throw new SchedulingValidationException("User " + teacher.getUsername() + " is not a teacher");
        }
        return teacher;
    }

    private Period findPeriod(Long periodId) {
        return periodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("Period", periodId));
    }

    private Room findRoom(Long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }
}
