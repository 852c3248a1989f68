// file: node/src/main/java/io/fieldsync/node/dto/SubmitRequest.java
package io.fieldsync.node.dto;

/**
 * JSON body for POST /records.
 * Example:
 *   {
 *     "priority": 1,
 *     "msgType": "detection",
 *     "payloadBase64": "aGVsbG8="
 *   }
 */
public class SubmitRequest {
    public Integer priority;      // 0..5
    public String msgType;        // MessageType name, case-insensitive
    public String payloadBase64;  // opaque producer bytes
}
