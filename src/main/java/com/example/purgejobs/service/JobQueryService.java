package com.example.purgejobs.service;

import com.example.purgejobs.access.DeletionLogAccess;
import com.example.purgejobs.access.DeliveryServiceAccess;
import com.example.purgejobs.access.InvalidationJobAccess;
import com.example.purgejobs.access.JobFilterField;
import com.example.purgejobs.access.JobQuery;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.InvalidationJob;
import com.example.purgejobs.models.User;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lists jobs visible to a user. Visibility is always narrowed to the delivery services of the
 * user's tenant and its descendants; query parameters can only narrow it further.
 */
@Service
@Slf4j
public class JobQueryService {

    public static final String ORDER_BY = "orderby";
    public static final String SORT_ORDER = "sortOrder";
    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String PAGE = "page";
    public static final String CDN = "cdn";
    public static final String RECENT_ONLY = "maxRevalDurationDays";

    private final InvalidationJobAccess jobAccess;
    private final DeliveryServiceAccess deliveryServiceAccess;
    private final DeletionLogAccess deletionLogAccess;
    private final TenantAuthorizationGate authorizationGate;
    private final GlobalParameters globalParameters;
    private final Clock clock;

    public JobQueryService(InvalidationJobAccess jobAccess,
                           DeliveryServiceAccess deliveryServiceAccess,
                           DeletionLogAccess deletionLogAccess,
                           TenantAuthorizationGate authorizationGate,
                           GlobalParameters globalParameters,
                           Clock clock) {
        this.jobAccess = jobAccess;
        this.deliveryServiceAccess = deliveryServiceAccess;
        this.deletionLogAccess = deletionLogAccess;
        this.authorizationGate = authorizationGate;
        this.globalParameters = globalParameters;
        this.clock = clock;
    }

    /**
     * @param parameters      raw query parameters; names outside the filter allow-list and the
     *                        paging controls are ignored
     * @param ifModifiedSince the caller's cached version, or null for an unconditional read
     * @throws PurgeJobsException with {@code INVALID_REQUEST} naming every malformed parameter
     */
    public JobListing list(User actingUser, Map<String, String> parameters, Instant ifModifiedSince) {
        Objects.requireNonNull(actingUser, "actingUser");
        Objects.requireNonNull(parameters, "parameters");

        List<String> errors = new ArrayList<>();
        List<JobQuery.Criterion> criteria = new ArrayList<>();
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            Optional<JobFilterField> field = JobFilterField.fromParameter(entry.getKey());
            if (field.isEmpty()) {
                continue;
            }
            try {
                criteria.add(new JobQuery.Criterion(field.get(), field.get().parse(entry.getValue())));
            } catch (IllegalArgumentException ex) {
                errors.add(ex.getMessage());
            }
        }
        Paging paging = Paging.parse(parameters, errors);
        if (!errors.isEmpty()) {
            throw PurgeJobsException.invalid(String.join("; ", errors));
        }

        JobQuery query = new JobQuery(criteria, visibleDeliveryServiceIds(actingUser, parameters.get(CDN)),
                recencyBound(parameters));

        Optional<Long> lastModified = Stream.of(
                        jobAccess.findLatestUpdate(query),
                        deletionLogAccess.findLastDeleted(InvalidationJobAccess.TABLE_NAME))
                .flatMap(Optional::stream)
                .max(Long::compare);
        Instant lastModifiedAt = lastModified.map(Instant::ofEpochMilli).orElse(null);

        if (ifModifiedSince != null && lastModifiedAt != null
                && ifModifiedSince.getEpochSecond() >= lastModifiedAt.getEpochSecond()) {
            log.debug("Job listing not modified since {}", ifModifiedSince);
            return JobListing.notModified(lastModifiedAt);
        }
        if (ifModifiedSince != null) {
            log.debug("Job listing modified since {} (last change {})", ifModifiedSince, lastModifiedAt);
        }

        List<InvalidationJob> jobs = paging.apply(jobAccess.find(query));
        return new JobListing(false, jobs, lastModifiedAt);
    }

    private Set<Long> visibleDeliveryServiceIds(User actingUser, String cdnName) {
        Set<Long> tenantIds = authorizationGate.accessibleTenantIds(actingUser);
        if (tenantIds.isEmpty()) {
            return Set.of();
        }
        return deliveryServiceAccess.findAllByTenantIds(tenantIds).stream()
                .filter(ds -> cdnName == null || cdnName.equals(ds.getCdnName()))
                .map(DeliveryService::getId)
                .collect(Collectors.toSet());
    }

    private Long recencyBound(Map<String, String> parameters) {
        if (!parameters.containsKey(RECENT_ONLY)) {
            return null;
        }
        int days = globalParameters.maxRevalDurationDays();
        return clock.instant().minus(Duration.ofDays(days)).toEpochMilli();
    }

    /**
     * Result of a listing. When {@code notModified} is set the job list is empty and the caller's
     * copy is current.
     */
    public record JobListing(boolean notModified, List<InvalidationJob> jobs, Instant lastModified) {
        public JobListing {
            jobs = List.copyOf(jobs);
        }

        static JobListing notModified(Instant lastModified) {
            return new JobListing(true, List.of(), lastModified);
        }
    }

    private record Paging(JobFilterField orderBy, boolean descending, Integer limit, int offset) {

        static Paging parse(Map<String, String> parameters, List<String> errors) {
            JobFilterField orderBy = Optional.ofNullable(parameters.get(ORDER_BY))
                    .flatMap(JobFilterField::fromParameter)
                    .orElse(JobFilterField.ID);

            boolean descending = false;
            String sortOrder = parameters.get(SORT_ORDER);
            if (sortOrder != null) {
                if ("desc".equals(sortOrder)) {
                    descending = true;
                } else if (!"asc".equals(sortOrder)) {
                    errors.add(SORT_ORDER + " must be 'asc' or 'desc'");
                }
            }

            Integer limit = parseInt(parameters, LIMIT, 1, errors);
            Integer offset = parseInt(parameters, OFFSET, 0, errors);
            Integer page = parseInt(parameters, PAGE, 1, errors);

            int skip = 0;
            if (limit != null) {
                if (page != null) {
                    skip = (page - 1) * limit;
                } else if (offset != null) {
                    skip = offset;
                }
            }
            return new Paging(orderBy, descending, limit, skip);
        }

        private static Integer parseInt(Map<String, String> parameters, String name, int min, List<String> errors) {
            String raw = parameters.get(name);
            if (raw == null) {
                return null;
            }
            String message = name + " must be an integer no less than " + min;
            int value;
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException ex) {
                errors.add(message);
                return null;
            }
            if (value < min) {
                errors.add(message);
                return null;
            }
            return value;
        }

        List<InvalidationJob> apply(List<InvalidationJob> jobs) {
            Comparator<InvalidationJob> order = orderBy.comparator();
            if (descending) {
                order = order.reversed();
            }
            Stream<InvalidationJob> sorted = jobs.stream().sorted(order).skip(offset);
            if (limit != null) {
                sorted = sorted.limit(limit);
            }
            return sorted.toList();
        }
    }
}
