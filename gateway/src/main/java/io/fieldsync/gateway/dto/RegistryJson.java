package io.fieldsync.gateway.dto;

import java.util.List;

public class RegistryJson {
    public List<Node> nodes;

    public static class Node {
        public String nodeId;
        public String publicKey; // Base64 X.509
    }
}
