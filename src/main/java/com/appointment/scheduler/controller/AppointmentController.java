package com.appointment.scheduler.controller;

import com.appointment.scheduler.dto.AppointmentRequest;
import com.appointment.scheduler.dto.AppointmentResponse;
import com.appointment.scheduler.dto.AppointmentWeekResponse;
import com.appointment.scheduler.dto.AvailableSlotsResponse;
import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.exception.SchedulingException;
import com.appointment.scheduler.scheduling.AvailabilityEnumerator;
import com.appointment.scheduler.scheduling.TimeGrid;
import com.appointment.scheduler.service.AppointmentChanges;
import com.appointment.scheduler.service.AppointmentService;
import com.appointment.scheduler.utils.SlotTimes;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final TimeGrid timeGrid;
    private final Clock clock;

    public AppointmentController(AppointmentService appointmentService, TimeGrid timeGrid, Clock clock) {
        this.appointmentService = appointmentService;
        this.timeGrid = timeGrid;
        this.clock = clock;
    }

    @GetMapping
    public AppointmentWeekResponse list(@RequestParam(value = "page", required = false) String page) {
        return new AppointmentWeekResponse(appointmentService.listWeek(parsePage(page), clock.instant()), timeGrid);
    }

    @PostMapping
    public ResponseEntity<AppointmentResponse> create(@RequestBody(required = false) AppointmentRequest request) {
        AppointmentRequest body = request != null ? request : new AppointmentRequest();
        if (StringUtils.isBlank(body.getStartTime())
                || StringUtils.isBlank(body.getName())
                || StringUtils.isBlank(body.getEmail())) {
            throw SchedulingException.invalidRequest("start_time, name, and email are required fields.");
        }
        Instant startTime = SlotTimes.parse(body.getStartTime(), timeGrid.getZone());
        Appointment created = appointmentService.create(
                startTime, body.getName(), body.getEmail(), body.getPhone(), body.getReason(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentResponse.of(created, timeGrid));
    }

    @GetMapping("/available")
    public AvailableSlotsResponse available(@RequestParam(value = "page", required = false) String page) {
        return new AvailableSlotsResponse(appointmentService.availableSlots(parsePage(page), clock.instant()), timeGrid);
    }

    @GetMapping("/{id}")
    public AppointmentResponse get(@PathVariable("id") Long id) {
        return AppointmentResponse.of(appointmentService.get(id), timeGrid);
    }

    @PatchMapping("/{id}")
    public AppointmentResponse update(@PathVariable("id") Long id,
                                      @RequestBody(required = false) AppointmentRequest request) {
        AppointmentRequest body = request != null ? request : new AppointmentRequest();
        AppointmentChanges changes = AppointmentChanges.builder()
                .startTime(body.getStartTime() != null ? SlotTimes.parse(body.getStartTime(), timeGrid.getZone()) : null)
                .name(body.getName())
                .email(body.getEmail())
                .phone(body.getPhone())
                .reason(body.getReason())
                .build();
        return AppointmentResponse.of(appointmentService.update(id, changes, clock.instant()), timeGrid);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@PathVariable("id") Long id) {
        appointmentService.cancel(id);
        return ResponseEntity.noContent().build();
    }

    private static int parsePage(String raw) {
        if (StringUtils.isBlank(raw)) return 0;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw SchedulingException.invalidPage(raw, AvailabilityEnumerator.MAX_PAGE);
        }
    }
}
