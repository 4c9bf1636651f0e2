package com.example.agenda.dto;

import java.time.LocalDate;
import java.util.List;

/** Bookable starts of one provider on one day, with the parameters they were computed for. */
public record AvailabilityDTO(Long providerId,
                              LocalDate date,
                              int durationMinutes,
                              int step,
                              int bufferMinutes,
                              String zone,
                              List<SlotDTO> slots) {
}
