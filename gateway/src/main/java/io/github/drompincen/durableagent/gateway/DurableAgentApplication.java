package io.github.drompincen.durableagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.durableagent")
@EnableMongoRepositories(basePackages = "io.github.drompincen.durableagent.persistence.repository")
public class DurableAgentApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(DurableAgentApplication.class, args);
        if (isOneShot(ctx.getEnvironment())) {
            // shell or scenario runs have finished inside run(); exit with their code
            System.exit(SpringApplication.exit(ctx));
        }
    }

    static boolean isOneShot(Environment env) {
        return env.getProperty("durableagent.cli.enabled", Boolean.class, false)
                || env.containsProperty("durableagent.scenario");
    }
}
