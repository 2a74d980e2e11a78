package com.example.purgejobs.models;

import java.util.EnumSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

/**
 * A cache server in the fleet. The stored {@code upd_pending} / {@code reval_pending} flags are
 * set by tools outside this service; jobs raise their flags CDN-wide through
 * {@link CdnRevalidation}, and the server reports when it last applied each kind of change.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Server {

    public static final Set<String> EXCLUDED_STATUSES = Set.of("OFFLINE", "PRE_PROD");

    private Long id;
    private String hostName;
    private Long cdnId;
    private String status;
    private String profile;
    private Boolean updPending;
    private Boolean revalPending;
    private Long configAppliedAt;
    private Long revalAppliedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public Long getId() { return id; }

    @DynamoDbAttribute("host_name")
    public String getHostName() { return hostName; }

    @DynamoDbAttribute("cdn_id")
    @DynamoDbSecondaryPartitionKey(indexNames = "servers_by_cdn")
    public Long getCdnId() { return cdnId; }

    @DynamoDbAttribute("status")
    public String getStatus() { return status; }

    @DynamoDbAttribute("profile")
    public String getProfile() { return profile; }

    @DynamoDbAttribute("upd_pending")
    public Boolean getUpdPending() { return updPending; }

    @DynamoDbAttribute("reval_pending")
    public Boolean getRevalPending() { return revalPending; }

    @DynamoDbAttribute("config_applied_at")
    public Long getConfigAppliedAt() { return configAppliedAt; }

    @DynamoDbAttribute("reval_applied_at")
    public Long getRevalAppliedAt() { return revalAppliedAt; }

    public boolean inService() {
        return status != null && !EXCLUDED_STATUSES.contains(status);
    }

    /**
     * Flags this server still has to act on: its own stored flags plus any CDN-wide flag raised
     * after it last applied that kind of change. CDN-wide flags only reach in-service servers
     * whose profile reads the revalidation config.
     *
     * @param marker               the CDN's marker, or null if no job ever raised one
     * @param revalidatingProfiles profiles that carry the revalidation config location
     */
    public Set<RevalidationFlag> pendingFlags(CdnRevalidation marker, Set<String> revalidatingProfiles) {
        Set<RevalidationFlag> pending = EnumSet.noneOf(RevalidationFlag.class);
        if (Boolean.TRUE.equals(updPending)) {
            pending.add(RevalidationFlag.UPDATE_PENDING);
        }
        if (Boolean.TRUE.equals(revalPending)) {
            pending.add(RevalidationFlag.REVALIDATION_PENDING);
        }
        if (marker == null || !inService() || profile == null || !revalidatingProfiles.contains(profile)) {
            return pending;
        }
        if (raisedSince(marker.getUpdPendingSince(), configAppliedAt)) {
            pending.add(RevalidationFlag.UPDATE_PENDING);
        }
        if (raisedSince(marker.getRevalPendingSince(), revalAppliedAt)) {
            pending.add(RevalidationFlag.REVALIDATION_PENDING);
        }
        return pending;
    }

    private static boolean raisedSince(Long raisedAt, Long appliedAt) {
        return raisedAt != null && (appliedAt == null || raisedAt > appliedAt);
    }
}
