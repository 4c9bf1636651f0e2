package com.example.agenda.controllers;

import com.example.agenda.config.AgendaProperties;
import com.example.agenda.dto.AppointmentDTO;
import com.example.agenda.dto.AppointmentRequest;
import com.example.agenda.dto.AvailabilityDTO;
import com.example.agenda.dto.CalendarEventDTO;
import com.example.agenda.dto.ConflictCheckDTO;
import com.example.agenda.dto.StatusChangeRequest;
import com.example.agenda.model.Appointment;
import com.example.agenda.service.AppointmentScope;
import com.example.agenda.service.AppointmentService;
import com.example.agenda.service.AvailabilityService;
import com.example.agenda.service.util.AgendaTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appointment endpoints. {@code X-Provider-Scope} is set by the upstream authorization
 * layer for callers restricted to their own provider id.
 */
@RestController
@RequestMapping("/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    static final String SCOPE_HEADER = "X-Provider-Scope";

    private final AppointmentService appointments;
    private final AvailabilityService availability;
    private final AgendaProperties properties;

    @GetMapping
    public List<AppointmentDTO> list(@RequestParam String from,
                                     @RequestParam String to,
                                     @RequestParam(required = false) Long providerId,
                                     @RequestParam(required = false) Appointment.Status status,
                                     @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return appointments.list(timestamp(from, "from"), timestamp(to, "to"), providerId, status, AppointmentScope.ofProvider(scope))
                .stream()
                .map(AppointmentDTO::from)
                .toList();
    }

    @GetMapping("/calendar")
    public List<CalendarEventDTO> calendar(@RequestParam String from,
                                           @RequestParam String to,
                                           @RequestParam(required = false) Long providerId,
                                           @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return appointments.calendar(timestamp(from, "from"), timestamp(to, "to"), providerId, AppointmentScope.ofProvider(scope));
    }

    @GetMapping("/slots")
    public AvailabilityDTO slots(@RequestParam Long providerId,
                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                 @RequestParam(required = false) Integer durationMinutes,
                                 @RequestParam(required = false) Integer step,
                                 @RequestParam(required = false) Integer bufferMinutes,
                                 @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return availability.listAvailability(providerId, date, durationMinutes, step, bufferMinutes,
                AppointmentScope.ofProvider(scope));
    }

    @GetMapping("/conflicts")
    public ConflictCheckDTO conflicts(@RequestParam Long providerId,
                                      @RequestParam String start,
                                      @RequestParam(required = false) Integer durationMinutes,
                                      @RequestParam(required = false) Long excludeId,
                                      @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return appointments.checkConflict(providerId, timestamp(start, "start"), durationMinutes, excludeId,
                        AppointmentScope.ofProvider(scope))
                .map(ConflictCheckDTO::of)
                .orElseGet(ConflictCheckDTO::none);
    }

    @GetMapping("/{id}")
    public AppointmentDTO get(@PathVariable Long id,
                              @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return AppointmentDTO.from(appointments.get(id, AppointmentScope.ofProvider(scope)));
    }

    @PostMapping
    public ResponseEntity<AppointmentDTO> create(@RequestBody AppointmentRequest request,
                                                 @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        Appointment created = appointments.create(request, AppointmentScope.ofProvider(scope));
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentDTO.from(created));
    }

    @PutMapping("/{id}")
    public AppointmentDTO update(@PathVariable Long id,
                                 @RequestBody AppointmentRequest request,
                                 @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return AppointmentDTO.from(appointments.update(id, request, AppointmentScope.ofProvider(scope)));
    }

    @PostMapping("/{id}/status")
    public AppointmentDTO changeStatus(@PathVariable Long id,
                                       @RequestBody StatusChangeRequest request,
                                       @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        return AppointmentDTO.from(appointments.changeStatus(id, request.status(), AppointmentScope.ofProvider(scope)));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id,
                                      @RequestHeader(value = SCOPE_HEADER, required = false) Long scope) {
        appointments.delete(id, AppointmentScope.ofProvider(scope));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("deletedId", id);
        return body;
    }

    private LocalDateTime timestamp(String raw, String field) {
        return AgendaTimestamps.parse(raw, field, properties.zoneId());
    }
}
