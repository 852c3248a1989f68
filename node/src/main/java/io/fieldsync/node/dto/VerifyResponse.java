package io.fieldsync.node.dto;

/**
 * Body of POST /admin/verify.
 */
public class VerifyResponse {
    public boolean ok;
    public int verifiedRecords;
    public Long failedSequence;
    public String reason;
    public String message;
}
