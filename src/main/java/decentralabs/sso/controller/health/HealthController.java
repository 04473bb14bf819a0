package decentralabs.sso.controller.health;

import decentralabs.sso.config.SamlSsoProperties;
import decentralabs.sso.config.ServerProperties;
import decentralabs.sso.service.auth.SamlHandler;
import decentralabs.sso.service.persistence.AccountStore;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final SamlHandler samlHandler;
    private final AccountStore accountStore;
    private final SamlSsoProperties samlProperties;
    private final ServerProperties serverProperties;
    private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;

    @GetMapping
    @CrossOrigin(origins = "*")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new HashMap<>();

        try {
            healthStatus.put("status", "UP");
            healthStatus.put("timestamp", Instant.now().toString());
            healthStatus.put("service", "sso-mapping-services");
            healthStatus.put("version", "1.0.0");
            healthStatus.put("server_name", serverProperties.getName());
            healthStatus.put("auth_provider_id", samlProperties.getAuthProviderId());
            healthStatus.put("outstanding_saml_requests", samlHandler.getOutstandingRequestCount());
            healthStatus.put("account_store", accountStore.getStoreType());

            boolean jdbcStore = "jdbc".equals(accountStore.getStoreType());
            boolean databaseUp = !jdbcStore || isDatabaseUp();
            healthStatus.put("database_up", databaseUp);

            if (!databaseUp) {
                healthStatus.put("status", "DEGRADED");
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(healthStatus);
            }
            return ResponseEntity.ok(healthStatus);
        } catch (Exception e) {
            log.error("Health check failed", e);
            healthStatus.put("status", "DOWN");
            healthStatus.put("error", e.getMessage());
            healthStatus.put("timestamp", Instant.now().toString());
            healthStatus.put("service", "sso-mapping-services");

            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(healthStatus);
        }
    }

    private boolean isDatabaseUp() {
        try {
            JdbcTemplate jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
            if (jdbcTemplate == null) {
                log.warn("No JdbcTemplate available for database health check");
                return false;
            }
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return result != null && result == 1;
        } catch (Exception e) {
            log.warn("Database connectivity check failed: {}", e.getMessage());
            return false;
        }
    }
}
