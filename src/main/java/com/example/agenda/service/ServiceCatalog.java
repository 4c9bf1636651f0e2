package com.example.agenda.service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/** Read access to the catalog of bookable services. */
public interface ServiceCatalog {

    /** Typical duration of the service, if it exists and declares a positive one. */
    Optional<Integer> defaultDurationMinutes(Long serviceRef);

    Map<Long, String> names(Collection<Long> serviceRefs);
}
