package io.hivemesh.voting;

import io.hivemesh.model.Ballot;
import io.hivemesh.util.Hashing;
import io.hivemesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The live vote of one agent in one session.
 */
public record VoteRecord(String sessionId, String agentId, Ballot ballot, long timestamp, String signature) {

    static VoteRecord signed(String sessionId, String agentId, Ballot ballot, long timestamp, String secret) {
        String canonical = canonicalJson(sessionId, agentId, ballot, timestamp);
        return new VoteRecord(sessionId, agentId, ballot, timestamp, sign(canonical, secret));
    }

    /**
     * Key-sorted compact JSON of everything except the signature. Input to both the
     * signature and the audit chain.
     */
    public String canonicalJson() {
        return canonicalJson(sessionId, agentId, ballot, timestamp);
    }

    boolean signatureValid(String secret) {
        return Hashing.digestEquals(sign(canonicalJson(), secret), signature);
    }

    private static String sign(String canonical, String secret) {
        if (secret == null || secret.isBlank()) {
            return Hashing.sha256Hex(canonical);
        }
        return Hashing.hmacSha256Hex(secret, canonical);
    }

    private static String canonicalJson(String sessionId, String agentId, Ballot ballot, long timestamp) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("session_id", sessionId);
        row.put("agent_id", agentId);
        row.put("ballot", ballot);
        row.put("timestamp", timestamp);
        return Jsons.toCompactJson(row);
    }
}
