package com.example.linkservice.config;

import net.javacrumbs.shedlock.core.LockProvider;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ShedLockConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ShedLockConfig.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void noLockProviderWithoutInProcessScheduler() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(LockProvider.class));
    }

    @Test
    void noLockProviderWhenSchedulerExplicitlyDisabled() {
        contextRunner.withPropertyValues("edge-sync.scheduler.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(LockProvider.class));
    }
}
