package ippnotify.server;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"ippnotify.server", "ippnotify.common"})
public class IppNotifyServer {

    public static void main(String[] args) {
        new SpringApplicationBuilder(IppNotifyServer.class).main(IppNotifyServer.class).web(WebApplicationType.NONE).run(args);
    }
}
