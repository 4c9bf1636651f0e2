package com.example.agenda.dto;

import java.util.List;

/** Opening windows as {@code HH:mm-HH:mm}. */
public record BusinessHoursDTO(Long providerId, boolean defaultTemplate, List<String> windows) {
}
