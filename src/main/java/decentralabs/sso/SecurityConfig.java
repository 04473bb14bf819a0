package decentralabs.sso;

import java.util.Arrays;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class SecurityConfig {

    @Value("${allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${endpoint.saml2:/auth/saml2}")
    private String saml2BasePath;

    @Value("${endpoint.health:/health}")
    private String healthEndpoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            // the identity provider posts the response cross-site; it carries its own signature
            .csrf(csrf -> csrf
                .ignoringRequestMatchers(
                    saml2BasePath + "/**",
                    healthEndpoint
                )
            )
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(saml2BasePath + "/**").permitAll()
                .requestMatchers(healthEndpoint).permitAll()
                .anyRequest().denyAll()
            );

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration publicConfiguration = new CorsConfiguration();
        publicConfiguration.setAllowedOrigins(Arrays.asList(allowedOrigins));
        publicConfiguration.setAllowedMethods(Arrays.asList("GET", "POST"));
        publicConfiguration.addAllowedHeader("*");

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(saml2BasePath + "/attributes", publicConfiguration);
        source.registerCorsConfiguration(healthEndpoint, publicConfiguration);
        return source;
    }
}
