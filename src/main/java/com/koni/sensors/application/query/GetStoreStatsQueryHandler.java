package com.koni.sensors.application.query;

import com.koni.sensors.domain.model.StoreStats;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class GetStoreStatsQueryHandler {

    private final SensorReadingRepository repository;

    public StoreStats handle(GetStoreStatsQuery query) {
        StoreStats stats = repository.stats();
        log.debug("Store stats: {}", stats);
        return stats;
    }
}
