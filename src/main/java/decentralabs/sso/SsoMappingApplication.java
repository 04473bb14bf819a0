package decentralabs.sso;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SsoMappingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SsoMappingApplication.class, args);
    }
}
