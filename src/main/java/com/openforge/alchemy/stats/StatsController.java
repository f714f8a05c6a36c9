package com.openforge.alchemy.stats;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final StoreStatisticsService statistics;

    @GetMapping
    public ResponseEntity<StoreStatistics> stats() {
        return ResponseEntity.ok(statistics.collect());
    }
}
