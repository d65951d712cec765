package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecordValidator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of dependency service names the application status is derived from.
 *
 * @param names dependency names in probing order; non-empty, unique, valid service identifiers
 */
public record DependencySet(List<String> names) {

    public DependencySet {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("dependency set must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!StatusRecordValidator.isValidServiceName(name)) {
                throw new IllegalArgumentException("invalid dependency name: '" + name + "'");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("duplicate dependency name: " + name);
            }
        }
        names = List.copyOf(names);
    }

    public static DependencySet of(String... names) {
        return new DependencySet(List.of(names));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return names.size();
    }
}
