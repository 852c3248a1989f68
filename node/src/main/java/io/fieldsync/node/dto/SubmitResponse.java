package io.fieldsync.node.dto;

public class SubmitResponse {
    public String id;
    public boolean accepted;
    public String reason;
}
