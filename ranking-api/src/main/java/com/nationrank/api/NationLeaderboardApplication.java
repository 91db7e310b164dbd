package com.nationrank.api;

import com.nationrank.api.config.RankingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RankingProperties.class)
public class NationLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(NationLeaderboardApplication.class, args);
    }
}
