// file: gateway/src/main/java/io/fieldsync/gateway/GatewayMain.java
package io.fieldsync.gateway;

import io.fieldsync.core.chain.NodeKeys;
import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the reference Cloud Sync Gateway.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load the node registry and the gateway's own signing key.
 *  - Start the gRPC SyncGateway service (TLS when configured).
 *  - Stop cleanly on shutdown.
 */
public final class GatewayMain {
    private static final Logger log = Logger.getLogger(GatewayMain.class.getName());

    private GatewayMain() {
        // no-op
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        configureLogging();
        var cfg = GatewayConfig.fromArgs(args);
        Clock clock = Clock.systemUTC();

        var registry = new NodeRegistry(GatewayConfig.loadRegistry(Path.of(cfg.registryPath())), clock);
        var gatewayKeys = NodeKeys.loadOrCreate(Path.of(cfg.keyDir()));
        var outbox = new DownlinkOutbox(gatewayKeys, clock);
        var service = new GatewayService(registry, outbox, clock);

        ServerBuilder<?> builder = ServerBuilder.forPort(cfg.port()).addService(service);
        if (cfg.tlsEnabled()) {
            builder.useTransportSecurity(new File(cfg.tlsCert()), new File(cfg.tlsKey()));
        }
        Server server = builder.build().start();

        log.log(Level.INFO, "Gateway listening on grpc://0.0.0.0:{0} ({1}); downlink key {2}/node.pub",
                new Object[]{String.valueOf(cfg.port()), cfg.tlsEnabled() ? "tls" : "plaintext", cfg.keyDir()});

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.shutdown();
            try {
                if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                    server.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                server.shutdownNow();
            }
        }));
        server.awaitTermination();
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = GatewayMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
