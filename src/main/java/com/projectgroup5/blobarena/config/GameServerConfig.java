package com.projectgroup5.blobarena.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * 游戏服务器配置 - 时钟与随机源单独成 Bean，测试可替换
 */
@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class GameServerConfig {

    @Bean
    public Clock gameClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random gameRandom() {
        return new Random();
    }
}
