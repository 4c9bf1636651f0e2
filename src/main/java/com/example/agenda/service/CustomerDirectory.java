package com.example.agenda.service;

import java.util.Collection;
import java.util.Map;

/** Read access to customer records owned by the customer module. */
public interface CustomerDirectory {

    /** Display names for the ids that exist; unknown ids are absent from the result. */
    Map<Long, String> displayNames(Collection<Long> customerIds);
}
