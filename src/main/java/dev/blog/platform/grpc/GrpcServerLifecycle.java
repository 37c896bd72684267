package dev.blog.platform.grpc;

import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the gRPC server alongside the Spring context.
 * A configured port of 0 binds an ephemeral port, readable through {@link #getPort()} once started.
 */
@Slf4j
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final BlogGrpcService blogGrpcService;
    private final AuthorizationServerInterceptor authorizationInterceptor;
    private final int configuredPort;

    private volatile Server server;

    public GrpcServerLifecycle(BlogGrpcService blogGrpcService,
                               AuthorizationServerInterceptor authorizationInterceptor,
                               @Value("${blog.grpc.port:50051}") int configuredPort) {
        this.blogGrpcService = blogGrpcService;
        this.authorizationInterceptor = authorizationInterceptor;
        this.configuredPort = configuredPort;
    }

    @Override
    public void start() {
        try {
            server = Grpc.newServerBuilderForPort(configuredPort, InsecureServerCredentials.create())
                    .addService(ServerInterceptors.intercept(blogGrpcService, authorizationInterceptor))
                    .build()
                    .start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start gRPC server on port " + configuredPort, e);
        }
        log.info("gRPC server started: port={}", server.getPort());
    }

    @Override
    public void stop() {
        Server current = server;
        if (current == null) {
            return;
        }
        log.info("Stopping gRPC server: port={}", current.getPort());
        current.shutdown();
        try {
            if (!current.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not terminate in {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    public int getPort() {
        Server current = server;
        if (current == null) {
            throw new IllegalStateException("gRPC server is not running");
        }
        return current.getPort();
    }
}
