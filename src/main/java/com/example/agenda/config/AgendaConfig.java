package com.example.agenda.config;

import com.example.agenda.service.StatusTransitionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AgendaConfig {

    @Bean
    public StatusTransitionPolicy statusTransitionPolicy(AgendaProperties properties) {
        StatusTransitionPolicy policy = StatusTransitionPolicy.named(properties.getStatusPolicy());
        log.info("Appointment status policy: {}", properties.getStatusPolicy());
        return policy;
    }
}
