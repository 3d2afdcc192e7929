package cn.bitsleep.sysdocs.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // token expiry and document timestamps read time from here
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
