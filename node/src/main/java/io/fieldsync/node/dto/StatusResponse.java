package io.fieldsync.node.dto;

import java.util.Map;

/**
 * Body of GET /admin/status.
 */
public class StatusResponse {
    public String nodeId;
    public String connection;          // DISCONNECTED, CONNECTING, ...
    public Integer connectAttempts;    // only while CONNECTING
    public Double linkQuality;
    public boolean halted;
    public String haltReason;

    public Map<String, Integer> queueDepths;
    public Map<String, Integer> storedByPriority;
    public int pendingUnchained;
    public long usedBytes;
    public long quotaBytes;
    public long chainHeadSequence;
    public String chainHeadHash;

    public Map<String, Long> engine;   // sent, acked, duplicates, ...
    public Map<String, Long> ingest;   // submitted, chained, refused, dropped, buffered
    public Map<String, Long> alerts;
    public Long clockDriftMillis;
}
