package world.willfrog.review.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class FanOutExecutorConfig {

    @Bean
    public ExecutorService fanOutPool(WorkflowProperties workflowProperties) {
        return Executors.newFixedThreadPool(Math.max(1, workflowProperties.getFanOut().getPoolSize()));
    }
}
