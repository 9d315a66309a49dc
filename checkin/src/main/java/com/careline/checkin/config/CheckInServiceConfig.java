package com.careline.checkin.config;

import com.careline.checkin.trend.KeywordTextCategorizer;
import com.careline.checkin.trend.TextCategorizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CheckInServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TextCategorizer symptomCategorizer() {
        return KeywordTextCategorizer.symptoms();
    }

    @Bean
    public TextCategorizer concernCategorizer() {
        return KeywordTextCategorizer.concerns();
    }
}
