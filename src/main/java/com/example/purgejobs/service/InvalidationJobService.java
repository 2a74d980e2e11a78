package com.example.purgejobs.service;

import com.example.purgejobs.access.DeliveryServiceAccess;
import com.example.purgejobs.access.InvalidationJobAccess;
import com.example.purgejobs.access.JobSequenceAccess;
import com.example.purgejobs.access.TransactionAccess;
import com.example.purgejobs.access.WriteTransaction;
import com.example.purgejobs.config.JobsProperties;
import com.example.purgejobs.models.DeletionMarker;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.DeliveryServiceRef;
import com.example.purgejobs.models.InvalidationJob;
import com.example.purgejobs.models.User;
import com.example.purgejobs.requests.CreateJobServiceRequest;
import com.example.purgejobs.requests.ReplaceJobServiceRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates, replaces and deletes invalidation jobs. Each mutation stages the job write, the
 * fleet flags and the change-log entry on one transaction and commits them together.
 */
@Service
@Slf4j
public class InvalidationJobService {

    private final InvalidationJobAccess jobAccess;
    private final DeliveryServiceAccess deliveryServiceAccess;
    private final JobSequenceAccess jobSequenceAccess;
    private final TransactionAccess transactionAccess;
    private final TenantAuthorizationGate authorizationGate;
    private final CdnLockGuard cdnLockGuard;
    private final ConflictValidator conflictValidator;
    private final RevalidationFlagPropagator flagPropagator;
    private final ChangeLogService changeLogService;
    private final GlobalParameters globalParameters;
    private final JobsProperties properties;
    private final Clock clock;

    public InvalidationJobService(InvalidationJobAccess jobAccess,
                                  DeliveryServiceAccess deliveryServiceAccess,
                                  JobSequenceAccess jobSequenceAccess,
                                  TransactionAccess transactionAccess,
                                  TenantAuthorizationGate authorizationGate,
                                  CdnLockGuard cdnLockGuard,
                                  ConflictValidator conflictValidator,
                                  RevalidationFlagPropagator flagPropagator,
                                  ChangeLogService changeLogService,
                                  GlobalParameters globalParameters,
                                  JobsProperties properties,
                                  Clock clock) {
        this.jobAccess = jobAccess;
        this.deliveryServiceAccess = deliveryServiceAccess;
        this.jobSequenceAccess = jobSequenceAccess;
        this.transactionAccess = transactionAccess;
        this.authorizationGate = authorizationGate;
        this.cdnLockGuard = cdnLockGuard;
        this.conflictValidator = conflictValidator;
        this.flagPropagator = flagPropagator;
        this.changeLogService = changeLogService;
        this.globalParameters = globalParameters;
        this.properties = properties;
        this.clock = clock;
    }

    public JobMutationResult create(User actingUser, CreateJobServiceRequest request) {
        Objects.requireNonNull(actingUser, "actingUser");
        Objects.requireNonNull(request, "request");

        Instant now = clock.instant();
        if (!request.assetPath().startsWith("/")) {
            throw PurgeJobsException.invalid("assetURL must be a path beginning with '/'");
        }
        validateTtl(request.ttlHours());
        validateStartTime(request.startTime(), now);

        DeliveryService deliveryService = authorizedDeliveryService(actingUser, request.deliveryService());
        cdnLockGuard.ensureCanModify(actingUser, deliveryService);
        if (!deliveryService.hasPrimaryOrigin()) {
            throw PurgeJobsException.invalid("Delivery Service '" + deliveryService.getXmlId()
                    + "' has no primary origin");
        }
        String assetUrl = deliveryService.primaryOrigin() + request.assetPath();

        List<String> warnings = conflictValidator.findConflicts(
                deliveryService.getId(), request.startTime(), request.ttlHours(), assetUrl, null);

        InvalidationJob job = InvalidationJob.builder()
                .id(jobSequenceAccess.nextJobId())
                .assetUrl(assetUrl)
                .deliveryServiceId(deliveryService.getId())
                .deliveryServiceXmlId(deliveryService.getXmlId())
                .createdById(actingUser.getId())
                .createdByName(actingUser.getUsername())
                .startTime(request.startTime().toEpochMilli())
                .ttlHours(request.ttlHours())
                .enteredTime(now.toEpochMilli())
                .lastUpdated(now.toEpochMilli())
                .build();

        WriteTransaction transaction = transactionAccess.begin();
        transaction.createJob(job);
        flagPropagator.propagate(transaction, DeliveryServiceRef.byId(deliveryService.getId()));
        changeLogService.recordCreated(transaction, actingUser, job, !warnings.isEmpty());
        transaction.commit();

        log.info("Created invalidation job {} on {} for {}", job.getId(), job.getDeliveryServiceXmlId(), assetUrl);
        return new JobMutationResult(job, warnings, describeWindow("created", job));
    }

    public JobMutationResult replace(User actingUser, ReplaceJobServiceRequest request) {
        Objects.requireNonNull(actingUser, "actingUser");
        Objects.requireNonNull(request, "request");

        InvalidationJob existing = authorizedJob(actingUser, request.jobId());
        long now = clock.millis();
        if (existing.hasStarted(now)) {
            throw PurgeJobsException.alreadyStarted();
        }

        DeliveryService deliveryService = deliveryServiceAccess.findById(existing.getDeliveryServiceId())
                .orElseThrow(() -> PurgeJobsException.noSuchJob(request.jobId()));
        if (!request.deliveryService().refersTo(deliveryService)) {
            throw PurgeJobsException.identityConflict("deliveryService");
        }
        if (!request.createdBy().equals(existing.getCreatedByName())) {
            throw PurgeJobsException.identityConflict("createdBy");
        }
        if (request.payloadId() != request.jobId()) {
            throw PurgeJobsException.identityConflict("id");
        }

        if (!deliveryService.hasPrimaryOrigin() || !request.assetUrl().startsWith(deliveryService.primaryOrigin())) {
            throw PurgeJobsException.invalid("assetURL must begin with the Delivery Service's primary origin");
        }
        validateTtl(request.ttlHours());
        validateStartTime(request.startTime(), Instant.ofEpochMilli(now));

        cdnLockGuard.ensureCanModify(actingUser, deliveryService);

        List<String> warnings = conflictValidator.findConflicts(deliveryService.getId(),
                request.startTime(), request.ttlHours(), request.assetUrl(), existing.getId());

        InvalidationJob updated = existing.toBuilder()
                .assetUrl(request.assetUrl())
                .ttlHours(request.ttlHours())
                .startTime(request.startTime().toEpochMilli())
                .lastUpdated(now)
                .build();

        WriteTransaction transaction = transactionAccess.begin();
        transaction.updateJob(updated, now);
        flagPropagator.propagate(transaction, DeliveryServiceRef.byXmlId(deliveryService.getXmlId()));
        changeLogService.recordUpdated(transaction, actingUser, updated);
        transaction.commit();

        log.info("Updated invalidation job {} on {}", updated.getId(), updated.getDeliveryServiceXmlId());
        return new JobMutationResult(updated, warnings, describeWindow("updated", updated));
    }

    public JobMutationResult delete(User actingUser, long jobId) {
        Objects.requireNonNull(actingUser, "actingUser");

        InvalidationJob existing = authorizedJob(actingUser, jobId);
        DeliveryService deliveryService = deliveryServiceAccess.findById(existing.getDeliveryServiceId())
                .orElseThrow(() -> PurgeJobsException.noSuchJob(jobId));
        cdnLockGuard.ensureCanModify(actingUser, deliveryService);

        WriteTransaction transaction = transactionAccess.begin();
        transaction.deleteJob(existing);
        transaction.recordDeletion(DeletionMarker.builder()
                .tableName(InvalidationJobAccess.TABLE_NAME)
                .lastUpdated(clock.millis())
                .build());
        flagPropagator.propagate(transaction, DeliveryServiceRef.byId(deliveryService.getId()));
        changeLogService.recordDeleted(transaction, actingUser, existing);
        transaction.commit();

        log.info("Deleted invalidation job {} on {}", existing.getId(), existing.getDeliveryServiceXmlId());
        return new JobMutationResult(existing, List.of(), "Content invalidation job was deleted");
    }

    private DeliveryService authorizedDeliveryService(User actingUser, DeliveryServiceRef ref) {
        if (!authorizationGate.authorize(actingUser, AuthorizationTarget.deliveryService(ref))) {
            throw PurgeJobsException.noSuchDeliveryService();
        }
        return deliveryServiceAccess.findByRef(ref).orElseThrow(PurgeJobsException::noSuchDeliveryService);
    }

    /**
     * Loads a job the acting user may change: both its delivery service and its creator must
     * fall within the user's tenancy. Anything else looks like a missing job.
     */
    private InvalidationJob authorizedJob(User actingUser, long jobId) {
        InvalidationJob job = jobAccess.findById(jobId)
                .orElseThrow(() -> PurgeJobsException.noSuchJob(jobId));
        boolean permitted = authorizationGate.authorize(actingUser,
                        new AuthorizationTarget.DeliveryServiceById(job.getDeliveryServiceId()))
                && authorizationGate.authorize(actingUser,
                        new AuthorizationTarget.UserById(job.getCreatedById()));
        if (!permitted) {
            log.debug("User {} may not modify job {}", actingUser.getUsername(), jobId);
            throw PurgeJobsException.noSuchJob(jobId);
        }
        return job;
    }

    private void validateTtl(int ttlHours) {
        if (ttlHours <= 0) {
            throw PurgeJobsException.invalid("ttlHours must be a positive number of hours");
        }
        int maxDays = globalParameters.maxRevalDurationDays();
        long maxHours = maxDays * 24L;
        if (ttlHours > maxHours) {
            throw PurgeJobsException.invalid("ttlHours cannot exceed " + maxHours
                    + " (" + maxDays + " days)");
        }
    }

    private void validateStartTime(Instant startTime, Instant now) {
        if (startTime.isBefore(now)) {
            throw PurgeJobsException.invalid("startTime cannot be in the past");
        }
        int leadDays = properties.getMaxStartLeadDays();
        if (startTime.isAfter(now.plus(Duration.ofDays(leadDays)))) {
            throw PurgeJobsException.invalid("startTime must be within " + leadDays + " days from now");
        }
    }

    private static String describeWindow(String verb, InvalidationJob job) {
        return "Invalidation request " + verb + " for " + job.getAssetUrl()
                + ", start:" + job.startInstant() + " end " + job.endInstant();
    }

    /**
     * Outcome of a job mutation.
     *
     * @param warnings conflict warnings; the mutation succeeded regardless
     * @param message  success text for the caller
     */
    public record JobMutationResult(InvalidationJob job, List<String> warnings, String message) {
        public JobMutationResult {
            Objects.requireNonNull(job, "job");
            warnings = List.copyOf(warnings);
            Objects.requireNonNull(message, "message");
        }
    }
}
