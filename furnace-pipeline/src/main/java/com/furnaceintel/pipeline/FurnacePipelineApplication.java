package com.furnaceintel.pipeline;

import com.furnaceintel.pipeline.scheduler.PipelineCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class FurnacePipelineApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(FurnacePipelineApplication.class);
        // A --mode=... invocation is a one-shot command and does not need the HTTP server.
        if (Arrays.stream(args).anyMatch(a -> a.startsWith("--mode"))) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);

        if (context.getBean(PipelineCommandRunner.class).isOneShot()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
