package ippnotify.server;

import java.lang.Runtime.Version;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.internal.SystemPropertyUtil;
import ippnotify.common.component.AuthenticationService;
import ippnotify.common.configuration.HttpProperties;
import ippnotify.common.configuration.ServerProperties;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.netty.http.IppExceptionHandler;
import ippnotify.netty.http.IppRequestDecoder;
import ippnotify.server.netty.http.subscription.CancelSubscriptionRequestHandler;
import ippnotify.server.netty.http.subscription.CreateSubscriptionsRequestHandler;
import ippnotify.server.netty.http.subscription.GetNotificationsRequestHandler;
import ippnotify.server.netty.http.subscription.GetSubscriptionAttributesRequestHandler;
import ippnotify.server.netty.http.subscription.GetSubscriptionsRequestHandler;
import ippnotify.server.netty.http.subscription.RenewSubscriptionRequestHandler;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.SubscriptionAttributeValidator;
import ippnotify.server.subscription.SubscriptionRegistry;

public class Server {

    private static final Logger log = LoggerFactory.getLogger(Server.class);
    private static final String EPOLL_MIN_VERSION = "2.7";
    private static final String OS_NAME = "os.name";
    private static final String OS_VERSION = "os.version";

    private final ServerProperties serverProperties;
    private final HttpProperties httpProperties;
    private final SubscriptionProperties subscriptionProperties;
    protected final AuthenticationService authenticationService;
    protected final SubscriptionRegistry registry;
    protected final PrinterDirectory printerDirectory;
    protected final ApplicationContext applicationContext;
    private final SubscriptionAttributeValidator validator;

    private int shutdownQuietPeriod;
    private EventLoopGroup httpWorkerGroup = null;
    private EventLoopGroup httpBossGroup = null;
    protected Channel httpChannelHandle = null;

    private static boolean useEpoll() {
        final String osName = SystemPropertyUtil.get(OS_NAME).toLowerCase().trim();
        final String osVersion = SystemPropertyUtil.get(OS_VERSION).toLowerCase();
        // split at periods, keep the first two, join with a period
        final String majMinVers = StringUtils.join(Arrays.stream(osVersion.split("\\.")).limit(2).collect(Collectors.toList()), ".");
        if (osName.startsWith("linux") && Epoll.isAvailable()) {
            try {
                Version currentVersion = Version.parse(majMinVers);
                Version epollMinVersion = Version.parse(EPOLL_MIN_VERSION);
                return currentVersion.compareTo(epollMinVersion) > 0;
            } catch (Exception e) {
                log.error(e.getMessage(), e);
            }
        }
        return false;
    }

    public Server(ApplicationContext applicationContext, AuthenticationService authenticationService, SubscriptionRegistry registry,
                    PrinterDirectory printerDirectory, ServerProperties serverProperties, HttpProperties httpProperties,
                    SubscriptionProperties subscriptionProperties) {
        this.applicationContext = applicationContext;
        this.authenticationService = authenticationService;
        this.registry = registry;
        this.printerDirectory = printerDirectory;
        this.serverProperties = serverProperties;
        this.httpProperties = httpProperties;
        this.subscriptionProperties = subscriptionProperties;
        this.validator = new SubscriptionAttributeValidator(subscriptionProperties.getDefaultLeaseSeconds());
    }

    public void start() {
        log.info("Starting {}", this.getClass().getSimpleName());
        try {
            shutdownQuietPeriod = serverProperties.getShutdownQuietPeriod();
            final boolean useEpoll = useEpoll();
            Class<? extends ServerSocketChannel> channelClass;
            if (useEpoll) {
                httpWorkerGroup = new EpollEventLoopGroup();
                httpBossGroup = new EpollEventLoopGroup();
                channelClass = EpollServerSocketChannel.class;
            } else {
                httpWorkerGroup = new NioEventLoopGroup();
                httpBossGroup = new NioEventLoopGroup();
                channelClass = NioServerSocketChannel.class;
            }
            log.info("Using channel class {}", channelClass.getSimpleName());

            log.info("Creating http server");
            final int httpPort = httpProperties.getPort();
            final String httpIp = httpProperties.getIp();
            final ServerBootstrap httpServer = new ServerBootstrap();
            httpServer.group(httpBossGroup, httpWorkerGroup);
            httpServer.channel(channelClass);
            httpServer.handler(new LoggingHandler());
            httpServer.childHandler(setupHttpChannel());
            httpServer.option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
            httpServer.option(ChannelOption.SO_BACKLOG, 128);
            httpServer.childOption(ChannelOption.SO_KEEPALIVE, true);
            httpChannelHandle = httpServer.bind(httpIp, httpPort).sync().channel();
            final String httpAddress = ((InetSocketAddress) httpChannelHandle.localAddress()).getAddress().getHostAddress();
            log.info("IPP notification server started. Listening on {}:{} for HTTP traffic", httpAddress, httpPort);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            SpringApplication.exit(applicationContext, () -> 0);
        }
    }

    public void shutdown() {
        if (httpChannelHandle != null) {
            log.info("Closing httpChannelHandle");
            try {
                httpChannelHandle.close().get();
            } catch (final Exception e) {
                log.error("Channel:" + httpChannelHandle.config() + " -> " + e.getMessage(), e);
            }
        }

        List<Future<?>> groupFutures = new ArrayList<>();

        if (httpBossGroup != null) {
            log.info("Shutting down httpBossGroup");
            groupFutures.add(httpBossGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }

        if (httpWorkerGroup != null) {
            log.info("Shutting down httpWorkerGroup");
            groupFutures.add(httpWorkerGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }

        groupFutures.forEach(f -> {
            try {
                f.get();
            } catch (final Exception e) {
                log.error("Group:" + f.toString() + " -> " + e.getMessage(), e);
            }
        });
        log.info("{} shut down.", this.getClass().getSimpleName());
    }

    protected ChannelHandler setupHttpChannel() {
        return new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(SocketChannel ch) throws Exception {
                setupHttpPipeline(ch);
            }
        };
    }

    /**
     * The HTTP pipeline, also used by tests on an embedded channel.
     */
    public void setupHttpPipeline(Channel ch) {
        ch.pipeline().addLast("http", new HttpServerCodec());
        ch.pipeline().addLast("aggregator", new HttpObjectAggregator(httpProperties.getMaxContentLength()));
        ch.pipeline().addLast("ippDecoder", new IppRequestDecoder(authenticationService));
        ch.pipeline().addLast("create", new CreateSubscriptionsRequestHandler(registry, printerDirectory, validator));
        ch.pipeline().addLast("getAttributes", new GetSubscriptionAttributesRequestHandler(registry, printerDirectory));
        ch.pipeline().addLast("list", new GetSubscriptionsRequestHandler(registry, printerDirectory));
        ch.pipeline().addLast("notifications", new GetNotificationsRequestHandler(registry, printerDirectory, subscriptionProperties));
        ch.pipeline().addLast("cancel", new CancelSubscriptionRequestHandler(registry, printerDirectory));
        ch.pipeline().addLast("renew", new RenewSubscriptionRequestHandler(registry, printerDirectory, subscriptionProperties));
        ch.pipeline().addLast("error", new IppExceptionHandler());
    }
}
