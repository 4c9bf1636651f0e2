package com.example.agenda.repository;

import com.example.agenda.model.CatalogService;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CatalogServiceRepository extends JpaRepository<CatalogService, Long> {
}
