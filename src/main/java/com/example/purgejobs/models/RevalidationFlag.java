package com.example.purgejobs.models;

/**
 * Flags a job can raise on fleet members. Incremental revalidation only asks the server to
 * re-read its revalidation rules; a full update makes it pull its whole configuration.
 */
public enum RevalidationFlag {
    REVALIDATION_PENDING("reval_pending"),
    UPDATE_PENDING("upd_pending");

    private final String attributeName;

    RevalidationFlag(String attributeName) {
        this.attributeName = attributeName;
    }

    public String attributeName() {
        return attributeName;
    }

    /**
     * Builds the partial marker that raises this flag on every server of {@code cdnId} as of
     * {@code raisedAt}.
     */
    public CdnRevalidation raisedOn(long cdnId, long raisedAt) {
        CdnRevalidation.CdnRevalidationBuilder builder = CdnRevalidation.builder().cdnId(cdnId);
        switch (this) {
            case REVALIDATION_PENDING -> builder.revalPendingSince(raisedAt);
            case UPDATE_PENDING -> builder.updPendingSince(raisedAt);
        }
        return builder.build();
    }
}
