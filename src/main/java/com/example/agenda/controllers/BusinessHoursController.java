package com.example.agenda.controllers;

import com.example.agenda.dto.BusinessHoursDTO;
import com.example.agenda.service.BusinessHoursProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/business-hours")
@RequiredArgsConstructor
public class BusinessHoursController {

    private final BusinessHoursProvider businessHours;

    @GetMapping("/{providerId}")
    public BusinessHoursDTO get(@PathVariable Long providerId) {
        return toDto(providerId);
    }

    /** Replaces the provider's windows until the next reload. */
    @PutMapping("/{providerId}")
    public BusinessHoursDTO replace(@PathVariable Long providerId, @RequestBody List<String> windows) {
        businessHours.replace(providerId, windows.stream().map(BusinessHoursProvider.Window::parse).toList());
        return toDto(providerId);
    }

    @DeleteMapping("/{providerId}")
    public BusinessHoursDTO reset(@PathVariable Long providerId) {
        businessHours.reset(providerId);
        return toDto(providerId);
    }

    /** Re-reads every template from configuration, dropping runtime replacements. */
    @PostMapping("/reload")
    public ResponseEntity<Void> reload() {
        businessHours.reload();
        return ResponseEntity.noContent().build();
    }

    private BusinessHoursDTO toDto(Long providerId) {
        List<String> windows = businessHours.template(providerId).stream()
                .map(BusinessHoursProvider.Window::toString)
                .toList();
        return new BusinessHoursDTO(providerId, !businessHours.hasOwnTemplate(providerId), windows);
    }
}
