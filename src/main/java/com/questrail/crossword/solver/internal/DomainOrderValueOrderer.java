package com.questrail.crossword.solver.internal;

import com.questrail.crossword.api.Slot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tries candidates in domain iteration order.
 */
public final class DomainOrderValueOrderer implements ValueOrderer
{
    private final DomainStore domains;

    public DomainOrderValueOrderer(DomainStore domains) {
        this.domains = Objects.requireNonNull(domains, "domains");
    }

    @Override
    public List<String> order(Slot slot, PartialAssignment assignment) {
        return new ArrayList<>(domains.domain(slot));
    }
}
