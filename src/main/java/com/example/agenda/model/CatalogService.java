package com.example.agenda.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "catalog_services")
@Getter @Setter
public class CatalogService {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /** Typical length of the service in minutes. */
    private Integer durationMinutes = 30;

    private boolean active = true;
}
