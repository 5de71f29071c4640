package com.spreadsheet.engine.config;

import com.spreadsheet.engine.functions.FunctionLibrary;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaConfig {

    @Bean
    public Clock formulaClock(FormulaProperties properties) {
        String zone = properties.getTimeZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public FunctionLibrary functionLibrary(Clock formulaClock) {
        return FunctionLibrary.standard(formulaClock);
    }
}
