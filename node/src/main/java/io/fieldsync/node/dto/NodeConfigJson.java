package io.fieldsync.node.dto;

/**
 * JSON file accepted by --config. Every field is optional; absent fields keep
 * their defaults and command-line flags win over the file.
 * Example:
 *   {
 *     "nodeId": "edge-07",
 *     "dataDir": "/var/lib/fieldsync",
 *     "gatewayHost": "sync.example.net",
 *     "gatewayPort": 7443,
 *     "tickMillis": 1000
 *   }
 */
public class NodeConfigJson {
    public String nodeId;
    public String dataDir;
    public String gatewayHost;
    public Integer gatewayPort;
    public Integer adminPort;
    public Long quotaBytes;
    public Long tickMillis;
    public Long ackTimeoutMillis;
    public Integer degradedBudget;
    public Integer ingestCapacity;
    public Boolean plaintext;
    public String gatewayKey;        // path to the gateway's X.509 public key
    public Long retentionSweepMillis;
    public Long clockDriftToleranceMillis;
    public Integer authFailureAlertThreshold;
}
