package decentralabs.sso.service.session;

import decentralabs.sso.model.PendingSamlSession;
import decentralabs.sso.util.LogSanitizer;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory table of SAML AuthnRequests awaiting a response, keyed by request id.
 *
 * Entries are never persisted: after a restart an outstanding login is simply not found.
 */
@Slf4j
public class PendingSessionStore {

    // request id -> session; guarded by this
    private final Map<String, PendingSamlSession> outstandingRequests = new HashMap<>();

    /**
     * Records a new outstanding request.
     *
     * @throws IllegalStateException if the request id is already tracked
     */
    public synchronized void create(String requestId, long nowMs, String uiAuthSessionId) {
        if (requestId == null || requestId.isEmpty()) {
            throw new IllegalArgumentException("requestId must not be empty");
        }
        if (outstandingRequests.containsKey(requestId)) {
            throw new IllegalStateException("Duplicate SAML request id " + LogSanitizer.sanitize(requestId));
        }
        outstandingRequests.put(requestId, new PendingSamlSession(requestId, nowMs, uiAuthSessionId));
    }

    /**
     * Removes and returns the session for {@code requestId}; each session is returned at most once.
     */
    public synchronized Optional<PendingSamlSession> popIfPresent(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outstandingRequests.remove(requestId));
    }

    /**
     * Drops every session created before {@code nowMs - lifetimeMs}.
     *
     * @return number of sessions removed
     */
    public synchronized int sweepExpired(long nowMs, long lifetimeMs) {
        long expireBefore = nowMs - lifetimeMs;
        int removed = 0;
        Iterator<PendingSamlSession> it = outstandingRequests.values().iterator();
        while (it.hasNext()) {
            PendingSamlSession session = it.next();
            if (session.creationTimeMs() < expireBefore) {
                log.debug("Expiring session id {}", LogSanitizer.sanitize(session.requestId()));
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return snapshot of the tracked request ids
     */
    public synchronized Set<String> outstandingRequestIds() {
        return Set.copyOf(outstandingRequests.keySet());
    }

    public synchronized int size() {
        return outstandingRequests.size();
    }
}
