package ippnotify.server.subscription;

/**
 * Selection criteria of Get-Subscriptions. The request target does not narrow the listing.
 */
public class SubscriptionFilter {

    private int jobId = 0;
    private String owner = null;
    private int limit = 0;

    /**
     * A positive job id selects that job's subscriptions; otherwise job subscriptions are excluded.
     */
    public SubscriptionFilter setJobId(int jobId) {
        this.jobId = jobId;
        return this;
    }

    /**
     * Only subscriptions created by this user; null for everyone's.
     */
    public SubscriptionFilter setOwner(String owner) {
        this.owner = owner;
        return this;
    }

    /**
     * Maximum number of results, 0 for no limit.
     */
    public SubscriptionFilter setLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    public boolean accepts(Subscription s) {
        SubscriptionScope scope = s.getScope();
        if (jobId > 0) {
            if (scope.getJobId() == null || scope.getJobId() != jobId) {
                return false;
            }
        } else if (scope.getJobId() != null) {
            return false;
        }
        return owner == null || owner.equals(s.getUsername());
    }

    @Override
    public String toString() {
        return "{job=" + jobId + ", owner=" + owner + ", limit=" + limit + "}";
    }
}
