package com.example.purgejobs.access;

import com.example.purgejobs.models.InvalidationJob;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filter for a job scan. Every criterion and the delivery service scope are ANDed together.
 *
 * @param criteria             equality predicates on allow-listed fields
 * @param deliveryServiceIds   the delivery services the caller may see; an empty set matches nothing
 * @param startedAtOrAfter     optional lower bound on start time, epoch millis
 */
public record JobQuery(
        List<Criterion> criteria,
        Set<Long> deliveryServiceIds,
        Long startedAtOrAfter
) {

    public JobQuery {
        criteria = List.copyOf(Objects.requireNonNull(criteria, "criteria"));
        deliveryServiceIds = Set.copyOf(Objects.requireNonNull(deliveryServiceIds, "deliveryServiceIds"));
    }

    public boolean matches(InvalidationJob job) {
        if (!deliveryServiceIds.contains(job.getDeliveryServiceId())) {
            return false;
        }
        if (startedAtOrAfter != null && job.getStartTime() < startedAtOrAfter) {
            return false;
        }
        return criteria.stream().allMatch(c -> c.value().equals(c.field().valueOf(job)));
    }

    public record Criterion(JobFilterField field, Object value) {
        public Criterion {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }
}
