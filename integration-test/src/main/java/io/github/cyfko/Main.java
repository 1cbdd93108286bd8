package io.github.cyfko;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Sample blog application serving its resources through RestQL.
 */
@SpringBootApplication
@EnableJpaRepositories(basePackages = "io.github.cyfko.blog")
@EntityScan(basePackages = "io.github.cyfko.blog")
public class Main {

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }
}
