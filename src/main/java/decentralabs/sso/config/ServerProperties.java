package decentralabs.sso.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@ConfigurationProperties(prefix = "homeserver")
@Validated
public class ServerProperties {

    /** Server name used as the domain part of local user ids. Can be set via env HOMESERVER_NAME. */
    @NotBlank
    private String name = "localhost";
}
