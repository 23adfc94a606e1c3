package com.aiinpocket.mystica.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 系統時鐘。session 到期判定與回合時間戳記皆以此為準，測試可替換為固定時鐘。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
