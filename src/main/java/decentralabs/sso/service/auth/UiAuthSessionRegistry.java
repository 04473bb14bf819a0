package decentralabs.sso.service.auth;

import decentralabs.sso.config.SamlSsoProperties;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records interactive-auth sessions whose SSO stage has been completed.
 *
 * A completion is kept for the SAML session lifetime; expired completions are dropped on every write.
 */
@Service
@Slf4j
public class UiAuthSessionRegistry {

    public static final String SSO_STAGE = "m.login.sso";

    private final Clock clock;
    private final long lifetimeMs;

    // ui auth session id -> completion; guarded by this
    private final Map<String, CompletedStage> completedSsoStages = new HashMap<>();

    public UiAuthSessionRegistry(SamlSsoProperties properties, Clock clock) {
        this.clock = clock;
        this.lifetimeMs = properties.getSessionLifetimeMs();
    }

    public synchronized void markStageComplete(String sessionId, String userId) {
        long now = clock.millis();
        int expired = sweepExpired(now);
        if (expired > 0) {
            log.debug("Dropped {} expired UI auth completion(s)", expired);
        }
        completedSsoStages.put(sessionId, new CompletedStage(userId, now));
        log.info("Stage {} completed for UI auth session {}", SSO_STAGE, sessionId);
    }

    public synchronized Optional<String> getCompletedUser(String sessionId) {
        CompletedStage stage = completedSsoStages.get(sessionId);
        if (stage == null || isExpired(stage, clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(stage.userId());
    }

    /**
     * Removes the completion once the interactive-auth flow has consumed it.
     */
    public synchronized Optional<String> consume(String sessionId) {
        CompletedStage stage = completedSsoStages.remove(sessionId);
        if (stage == null || isExpired(stage, clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(stage.userId());
    }

    synchronized int size() {
        return completedSsoStages.size();
    }

    private int sweepExpired(long now) {
        int before = completedSsoStages.size();
        completedSsoStages.values().removeIf(stage -> isExpired(stage, now));
        return before - completedSsoStages.size();
    }

    private boolean isExpired(CompletedStage stage, long now) {
        return stage.completedAtMs() < now - lifetimeMs;
    }

    private record CompletedStage(String userId, long completedAtMs) {
    }
}
