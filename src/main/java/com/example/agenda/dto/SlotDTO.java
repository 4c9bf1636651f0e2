package com.example.agenda.dto;

import java.time.LocalDateTime;

public record SlotDTO(LocalDateTime start, LocalDateTime end) {
}
