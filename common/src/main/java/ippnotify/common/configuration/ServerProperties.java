package ippnotify.common.configuration;

import javax.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "ippnotify.server")
public class ServerProperties {

    @Min(0)
    private Integer shutdownQuietPeriod = 5;

    /**
     * Time to wait (in seconds) for connections to finish and to make sure no new connections happen before shutting down Netty event
     * loop groups.
     */
    public int getShutdownQuietPeriod() {
        return this.shutdownQuietPeriod;
    }

    public void setShutdownQuietPeriod(Integer quietPeriod) {
        this.shutdownQuietPeriod = quietPeriod;
    }
}
