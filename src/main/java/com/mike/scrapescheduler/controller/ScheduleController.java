package com.mike.scrapescheduler.controller;

import com.mike.scrapescheduler.dto.ScheduleRequest;
import com.mike.scrapescheduler.entity.Schedule;
import com.mike.scrapescheduler.service.ScheduleService;
import com.mike.scrapescheduler.service.schedule.ScheduleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final ScheduleManager scheduleManager;

    @GetMapping
    public List<Schedule> list() {
        return scheduleService.list();
    }

    @GetMapping("/{id}")
    public Schedule get(@PathVariable Long id) {
        return scheduleService.get(id);
    }

    @PostMapping
    public ResponseEntity<Schedule> create(@RequestBody ScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(request));
    }

    @PutMapping("/{id}")
    public Schedule update(@PathVariable Long id, @RequestBody ScheduleRequest request) {
        return scheduleService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable Long id) {
        scheduleManager.pause(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable Long id) {
        scheduleManager.resume(id);
        return ResponseEntity.noContent().build();
    }
}
