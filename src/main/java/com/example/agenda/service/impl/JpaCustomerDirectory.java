package com.example.agenda.service.impl;

import com.example.agenda.model.Customer;
import com.example.agenda.repository.CustomerRepository;
import com.example.agenda.service.CustomerDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaCustomerDirectory implements CustomerDirectory {

    private final CustomerRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Map<Long, String> displayNames(Collection<Long> customerIds) {
        if (customerIds == null || customerIds.isEmpty()) {
            return Map.of();
        }
        return repository.findAllById(customerIds).stream()
                .collect(Collectors.toMap(Customer::getId, Customer::displayName, (a, b) -> a));
    }
}
