package io.taskkit.config;

import io.taskkit.TaskKit;
import io.taskkit.concurrent.LockMisusePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TaskKitAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TaskKitConfig.class));

    @Test
    void shouldAutoConfigureTaskKitBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TaskKit.class);
            assertThat(context).hasSingleBean(TaskKitLifecycle.class);
            assertThat(context).hasSingleBean(TaskKitProperties.class);
            assertThat(context.getBean(TaskKit.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindTaskKitProperties() {
        contextRunner
                .withPropertyValues(
                        "taskkit.executor-queue-capacity=7",
                        "taskkit.executor-submit-timeout=250ms",
                        "taskkit.pool-idle-timeout=30s",
                        "taskkit.lock-misuse-policy=abort",
                        "taskkit.time-zone=Europe/Berlin"
                )
                .run(context -> {
                    TaskKitProperties props = context.getBean(TaskKitProperties.class);
                    assertThat(props.getExecutorQueueCapacity()).isEqualTo(7);
                    assertThat(props.getExecutorSubmitTimeout()).isEqualTo(Duration.ofMillis(250));
                    assertThat(props.getPoolIdleTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(props.getLockMisusePolicy()).isEqualTo(LockMisusePolicy.ABORT);
                    assertThat(props.resolveZone().getId()).isEqualTo("Europe/Berlin");
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("taskkit.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TaskKit.class);
                    assertThat(context).doesNotHaveBean(TaskKitLifecycle.class);
                });
    }

    @Test
    void shouldKeepUserDefinedTaskKit() {
        TaskKit custom = mock(TaskKit.class);

        contextRunner
                .withBean(TaskKit.class, () -> custom)
                .run(context -> {
                    assertThat(context).getBean(TaskKit.class).isSameAs(custom);
                    verify(custom).start();
                });
    }

    @Test
    void shouldStopTaskKitWhenContextCloses() {
        TaskKit[] seen = new TaskKit[1];

        contextRunner.run(context -> seen[0] = context.getBean(TaskKit.class));

        assertThat(seen[0].isRunning()).isFalse();
    }
}
