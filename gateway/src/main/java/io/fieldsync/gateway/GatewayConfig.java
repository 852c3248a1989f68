// file: gateway/src/main/java/io/fieldsync/gateway/GatewayConfig.java
package io.fieldsync.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.chain.NodeKeys;
import io.fieldsync.gateway.dto.RegistryJson;

import java.io.IOException;
import java.nio.file.Path;
import java.security.PublicKey;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Gateway configuration parsed from CLI args.
 *
 * Supports:
 *  - port:          gRPC listen port
 *  - registryPath:  JSON file with the node ids and public keys allowed to sync
 *  - keyDir:        directory holding the gateway's own signing key (created on first start)
 *  - tlsCert/tlsKey: PEM files; when both are set the server uses TLS
 */
public record GatewayConfig(
        int port,
        String registryPath,
        String keyDir,
        String tlsCert,
        String tlsKey
) {

    /**
     * Supported flags:
     *   --port,     -p <port>
     *   --registry, -r <path>
     *   --key-dir,  -k <path>
     *   --tls-cert <path>
     *   --tls-key  <path>
     *   --help,     -h
     */
    public static GatewayConfig fromArgs(String[] args) {
        int port = 7443;
        String registry = "./gateway/registry.json";
        String keyDir = "./gateway/keys";
        String tlsCert = null;
        String tlsKey = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        port = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--registry", "-r" -> {
                    ensureValue(args, i);
                    registry = args[++i];
                }

                case "--key-dir", "-k" -> {
                    ensureValue(args, i);
                    keyDir = args[++i];
                }

                case "--tls-cert" -> {
                    ensureValue(args, i);
                    tlsCert = args[++i];
                }

                case "--tls-key" -> {
                    ensureValue(args, i);
                    tlsKey = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new GatewayConfig(port, registry, keyDir, tlsCert, tlsKey);
    }

    public boolean tlsEnabled() {
        return tlsCert != null && tlsKey != null;
    }

    /**
     * Load node id -> public key from a registry file:
     * <pre>
     * { "nodes": [ { "nodeId": "edge-01", "publicKey": "MCowBQYDK2VwAyEA..." } ] }
     * </pre>
     * Keys are Base64 X.509 encodings, i.e. the contents of a node's node.pub.
     */
    public static Map<String, PublicKey> loadRegistry(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            RegistryJson json = mapper.readValue(path.toFile(), RegistryJson.class);
            Map<String, PublicKey> keys = new HashMap<>();
            if (json.nodes != null) {
                for (RegistryJson.Node n : json.nodes) {
                    if (n.nodeId == null || n.nodeId.isBlank()) {
                        throw new IllegalArgumentException("registry entry without nodeId");
                    }
                    keys.put(n.nodeId, NodeKeys.decodePublicKey(Base64.getDecoder().decode(n.publicKey)));
                }
            }
            return keys;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load node registry from " + path, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: gateway [options]

            Options:
              --port,     -p   gRPC port (default: 7443)
              --registry, -r   Node registry JSON (default: ./gateway/registry.json)
              --key-dir,  -k   Gateway signing key directory (default: ./gateway/keys)
              --tls-cert       PEM certificate chain (enables TLS together with --tls-key)
              --tls-key        PEM private key
              --help,     -h   Show this help message
            """);
        System.exit(0);
    }
}
