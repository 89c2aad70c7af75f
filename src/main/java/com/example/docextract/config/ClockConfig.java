package com.example.docextract.config;

import com.example.docextract.service.polling.OperationPoller;
import com.example.docextract.service.polling.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Источники времени: системные часы и опрашиватель операций с прерываемыми паузами.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationPoller operationPoller(Clock clock) {
        return new OperationPoller(clock, Sleeper.cancellable());
    }
}
