package ippnotify.common.configuration;

import javax.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and timings of the subscription registry and of notification delivery.
 */
@Validated
@ConfigurationProperties(prefix = "ippnotify.subscriptions")
public class SubscriptionProperties {

    /** Lease given to a subscription that does not ask for one, and to a renewal without a duration. */
    @Min(0)
    private int defaultLeaseSeconds = 86400;
    @Min(1)
    private int maxSubscriptions = 100;
    @Min(1)
    private int leaseScanIntervalSeconds = 60;
    /** Capacity of each notification queue. */
    @Min(1)
    private int maxEvents = 100;
    /** Upper bound on the records returned for one subscription by one Get-Notifications. */
    @Min(1)
    private int notificationBatchSize = 100;
    /** Value of notify-get-interval, the poll interval suggested to clients. */
    @Min(1)
    private int getIntervalSeconds = 30;

    public int getDefaultLeaseSeconds() {
        return defaultLeaseSeconds;
    }

    public void setDefaultLeaseSeconds(int defaultLeaseSeconds) {
        this.defaultLeaseSeconds = defaultLeaseSeconds;
    }

    public int getMaxSubscriptions() {
        return maxSubscriptions;
    }

    public void setMaxSubscriptions(int maxSubscriptions) {
        this.maxSubscriptions = maxSubscriptions;
    }

    public int getLeaseScanIntervalSeconds() {
        return leaseScanIntervalSeconds;
    }

    public void setLeaseScanIntervalSeconds(int leaseScanIntervalSeconds) {
        this.leaseScanIntervalSeconds = leaseScanIntervalSeconds;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }

    public int getNotificationBatchSize() {
        return notificationBatchSize;
    }

    public void setNotificationBatchSize(int notificationBatchSize) {
        this.notificationBatchSize = notificationBatchSize;
    }

    public int getGetIntervalSeconds() {
        return getIntervalSeconds;
    }

    public void setGetIntervalSeconds(int getIntervalSeconds) {
        this.getIntervalSeconds = getIntervalSeconds;
    }
}
