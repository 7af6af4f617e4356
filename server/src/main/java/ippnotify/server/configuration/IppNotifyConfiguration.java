package ippnotify.server.configuration;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ippnotify.common.component.AuthenticationService;
import ippnotify.common.configuration.HttpProperties;
import ippnotify.common.configuration.PrinterProperties;
import ippnotify.common.configuration.ServerProperties;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.server.Server;
import ippnotify.server.printer.InMemoryPrinterDirectory;
import ippnotify.server.subscription.SubscriptionLeaseManager;
import ippnotify.server.subscription.SubscriptionRegistry;

@Configuration
public class IppNotifyConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public SubscriptionRegistry subscriptionRegistry(SubscriptionProperties subscriptionProperties, Clock clock) {
        return new SubscriptionRegistry(subscriptionProperties, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public SubscriptionLeaseManager subscriptionLeaseManager(SubscriptionRegistry subscriptionRegistry, SubscriptionProperties subscriptionProperties) {
        SubscriptionLeaseManager leaseManager = new SubscriptionLeaseManager(subscriptionRegistry, subscriptionProperties);
        leaseManager.start();
        return leaseManager;
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemoryPrinterDirectory printerDirectory(SubscriptionRegistry subscriptionRegistry, PrinterProperties printerProperties) {
        return new InMemoryPrinterDirectory(subscriptionRegistry, printerProperties.getNames());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Server server(ApplicationContext applicationContext, AuthenticationService authenticationService, SubscriptionRegistry subscriptionRegistry,
                    InMemoryPrinterDirectory printerDirectory, ServerProperties serverProperties, HttpProperties httpProperties,
                    SubscriptionProperties subscriptionProperties) {
        Server server = new Server(applicationContext, authenticationService, subscriptionRegistry, printerDirectory, serverProperties, httpProperties,
                        subscriptionProperties);
        server.start();
        return server;
    }
}
