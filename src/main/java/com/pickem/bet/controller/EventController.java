package com.pickem.bet.controller;

import com.pickem.bet.model.EventView;
import com.pickem.bet.service.BettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/events")
public class EventController {

    private final BettingService bettingService;

    /**
     * Events still open for betting, soonest first.
     */
    @GetMapping("/bettable")
    public ResponseEntity<Map<String, Object>> getBettableEvents() {
        log.info("GET /api/v1/events/bettable");

        List<EventView> events = bettingService.listBettable();

        Map<String, Object> response = new HashMap<>();
        response.put("events", events);
        response.put("count", events.size());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EventView> getEvent(@PathVariable Long id) {
        return ResponseEntity.ok(bettingService.getEventView(id));
    }
}
