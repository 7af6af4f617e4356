package ippnotify.common.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({HttpProperties.class, PrinterProperties.class, SecurityProperties.class, ServerProperties.class,
        SubscriptionProperties.class})
public class IppNotifyCommonConfiguration {

}
