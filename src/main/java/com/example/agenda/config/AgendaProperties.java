package com.example.agenda.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "agenda")
@Data
public class AgendaProperties {

    /** Zone in which appointment wall-clock times and calendar days are read. */
    private String zone = "America/Montevideo";

    /** {@code permissive} or {@code strict}. */
    private String statusPolicy = "permissive";

    private Scheduling scheduling = new Scheduling();

    private BusinessHours businessHours = new BusinessHours();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    @Data
    public static class Scheduling {
        private int defaultDurationMinutes = 30;
        private int defaultStepMinutes = 15;
        private int defaultBufferMinutes = 0;
    }

    @Data
    public static class BusinessHours {
        /** Windows as {@code HH:mm-HH:mm}, used for providers without their own entry. */
        private List<String> defaultWindows = new ArrayList<>(List.of("09:00-19:00"));
        private Map<Long, List<String>> providers = new HashMap<>();
    }
}
