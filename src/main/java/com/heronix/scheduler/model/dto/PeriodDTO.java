package com.heronix.scheduler.model.dto;

import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.heronix.scheduler.model.domain.Period;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PeriodDTO {

    private Long id;
    private String name;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime endTime;

    private long durationMinutes;

    public static PeriodDTO fromEntity(Period period) {
        return PeriodDTO.builder()
                .id(period.getId())
                .name(period.getName())
                .startTime(period.getStartTime())
                .endTime(period.getEndTime())
                .durationMinutes(period.durationMinutes())
                .build();
    }
}
