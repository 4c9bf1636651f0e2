package com.example.agenda.service.impl;

import com.example.agenda.model.CatalogService;
import com.example.agenda.repository.CatalogServiceRepository;
import com.example.agenda.service.ServiceCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaServiceCatalog implements ServiceCatalog {

    private final CatalogServiceRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> defaultDurationMinutes(Long serviceRef) {
        if (serviceRef == null) {
            return Optional.empty();
        }
        return repository.findById(serviceRef)
                .map(CatalogService::getDurationMinutes)
                .filter(minutes -> minutes > 0);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, String> names(Collection<Long> serviceRefs) {
        if (serviceRefs == null || serviceRefs.isEmpty()) {
            return Map.of();
        }
        return repository.findAllById(serviceRefs).stream()
                .collect(Collectors.toMap(CatalogService::getId, CatalogService::getName, (a, b) -> a));
    }
}
