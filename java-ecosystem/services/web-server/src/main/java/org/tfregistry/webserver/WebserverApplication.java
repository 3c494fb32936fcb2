package org.tfregistry.webserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "org.tfregistry.webserver")
@EntityScan(basePackages = {
        "org.tfregistry.core.model"
})
@ComponentScan(basePackages = {
        "org.tfregistry.webserver",
        "org.tfregistry.scmclient",
        "org.tfregistry.security.jwt.utils",
        "org.tfregistry.security.web"
})
@EnableJpaRepositories(basePackages = "org.tfregistry.core.persistence.repository")
public class WebserverApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebserverApplication.class, args);
    }
}
