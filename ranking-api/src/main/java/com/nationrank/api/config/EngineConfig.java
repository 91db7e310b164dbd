package com.nationrank.api.config;

import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.RankingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RankingEngine rankingEngine(RankingProperties properties, Clock clock) {
        EngineSettings settings = properties.toEngineSettings();
        log.info("Ranking engine: window={}d, playerMinGames={}, workerThreads={}, factionCodes={}",
                properties.getWindowDays(), settings.getPlayerMinGames(), settings.getWorkerThreads(),
                settings.getFactionCodes());
        return new RankingEngine(settings, clock);
    }
}
