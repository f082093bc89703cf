package io.hivemesh.voting;

import io.hivemesh.util.Hashing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session hash chain over every cast, overwritten casts included. Tampering with a
 * stored entry breaks every later link. The process that appends could also rewrite
 * the whole chain, so this detects external modification only.
 */
public final class VoteAuditTrail {
    static final String GENESIS_HASH = "";

    private final Map<String, List<AuditEntry>> chains = new ConcurrentHashMap<>();

    public String append(VoteRecord vote) {
        List<AuditEntry> chain = chains.computeIfAbsent(vote.sessionId(), ignored -> new ArrayList<>());
        synchronized (chain) {
            String previous = chain.isEmpty() ? GENESIS_HASH : chain.get(chain.size() - 1).hash();
            String canonical = vote.canonicalJson();
            String hash = Hashing.sha256Hex(previous + canonical);
            chain.add(new AuditEntry(chain.size(), vote.sessionId(), vote.agentId(), canonical,
                    vote.timestamp(), previous, hash));
            return hash;
        }
    }

    public String headHash(String sessionId) {
        List<AuditEntry> chain = chains.get(sessionId);
        if (chain == null) {
            return GENESIS_HASH;
        }
        synchronized (chain) {
            return chain.isEmpty() ? GENESIS_HASH : chain.get(chain.size() - 1).hash();
        }
    }

    public List<AuditEntry> entries(String sessionId) {
        List<AuditEntry> chain = chains.get(sessionId);
        if (chain == null) {
            return List.of();
        }
        synchronized (chain) {
            return List.copyOf(chain);
        }
    }

    public boolean contains(String sessionId) {
        return chains.containsKey(sessionId);
    }

    /**
     * Recomputes every link. False for an unknown session.
     */
    public boolean verify(String sessionId) {
        List<AuditEntry> chain = chains.get(sessionId);
        if (chain == null) {
            return false;
        }
        synchronized (chain) {
            String previous = GENESIS_HASH;
            for (int i = 0; i < chain.size(); i++) {
                AuditEntry entry = chain.get(i);
                if (entry.sequence() != i || !previous.equals(entry.previousHash())) {
                    return false;
                }
                String expected = Hashing.sha256Hex(previous + entry.vote());
                if (!Hashing.digestEquals(expected, entry.hash())) {
                    return false;
                }
                previous = entry.hash();
            }
            return true;
        }
    }

    /**
     * Latest canonical vote per agent according to the chain.
     */
    Map<String, String> latestVotes(String sessionId) {
        Map<String, String> latest = new HashMap<>();
        for (AuditEntry entry : entries(sessionId)) {
            latest.put(entry.agentId(), entry.vote());
        }
        return latest;
    }

    // live list, for tests that simulate tampering
    List<AuditEntry> chain(String sessionId) {
        return chains.get(sessionId);
    }

    void register(String sessionId) {
        chains.putIfAbsent(sessionId, new ArrayList<>());
    }
}
