package io.taskkit.config;

import io.taskkit.TaskKit;
import io.taskkit.internal.ThreadedTaskKit;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for TaskKit.
 *
 * <p>A {@link Clock} bean, when present, drives time-of-day scheduling; otherwise the system clock
 * in {@code taskkit.time-zone} is used.
 */
@AutoConfiguration
@ConditionalOnClass(TaskKit.class)
@EnableConfigurationProperties(TaskKitProperties.class)
@ConditionalOnProperty(prefix = "taskkit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TaskKitConfig {

    @Bean
    @ConditionalOnMissingBean
    public TaskKit taskKit(TaskKitProperties props, ObjectProvider<Clock> clockProvider) {
        Clock clock = clockProvider.getIfAvailable(() -> Clock.system(props.resolveZone()));
        return new ThreadedTaskKit(props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskKitLifecycle taskKitLifecycle(TaskKit taskKit) {
        return new TaskKitLifecycle(taskKit);
    }
}
