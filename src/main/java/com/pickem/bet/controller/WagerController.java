package com.pickem.bet.controller;

import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.interfaces.CurrentUserProvider;
import com.pickem.bet.model.PlaceWagerRequest;
import com.pickem.bet.model.WagerView;
import com.pickem.bet.service.BettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/wagers")
public class WagerController {

    private final BettingService bettingService;
    private final CurrentUserProvider currentUserProvider;

    @PostMapping
    public ResponseEntity<WagerView> placeWager(@RequestBody PlaceWagerRequest request) {
        String userId = currentUserProvider.currentUserId();
        log.info("POST /api/v1/wagers - user={}, eventId={}, pick={}, stake={}",
                userId, request.getEventId(), request.getPick(), request.getStake());

        Wager wager = bettingService.placeWager(userId, request.getEventId(), request.getPick(), request.getStake());
        return ResponseEntity.status(HttpStatus.CREATED).body(WagerView.from(wager));
    }

    @PostMapping("/{wagerId}/cancel")
    public ResponseEntity<WagerView> cancelWager(@PathVariable String wagerId) {
        String userId = currentUserProvider.currentUserId();
        log.info("POST /api/v1/wagers/{}/cancel - user={}", wagerId, userId);

        return ResponseEntity.ok(WagerView.from(bettingService.cancelWager(userId, wagerId)));
    }

    @GetMapping("/{wagerId}")
    public ResponseEntity<WagerView> getWager(@PathVariable String wagerId) {
        String userId = currentUserProvider.currentUserId();
        return ResponseEntity.ok(WagerView.from(bettingService.getWager(userId, wagerId)));
    }

    /**
     * The caller's wagers, newest first.
     *
     * @param status PENDING, WON, LOST, PUSH, CANCELLED or "all" (default)
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getMyWagers(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int page
    ) {
        String userId = currentUserProvider.currentUserId();
        WagerStatus filter = WagerStatus.fromFilter(status)
                .orElse(null);
        if (filter == null && status != null && !status.isBlank() && !status.trim().equalsIgnoreCase("all")) {
            throw new IllegalArgumentException("Unknown wager status filter: " + status);
        }

        Page<Wager> wagers = bettingService.getUserWagers(userId, filter, page);

        Map<String, Object> response = new HashMap<>();
        response.put("wagers", wagers.getContent().stream().map(WagerView::from).toList());
        response.put("page", wagers.getNumber());
        response.put("totalPages", wagers.getTotalPages());
        response.put("totalElements", wagers.getTotalElements());
        response.put("status", filter == null ? "all" : filter.name());
        return ResponseEntity.ok(response);
    }
}
