package com.webhookretry.autoconfig;

import com.webhookretry.core.engine.RetryExecutor;
import com.webhookretry.core.engine.WheelRetryExecutor;
import com.webhookretry.core.listener.LoggingRetryListener;
import com.webhookretry.core.listener.MetricsRetryListener;
import com.webhookretry.core.notify.WebhookNotifier;
import com.webhookretry.core.notify.WebhookTargets;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.WaitStrategy;
import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.core.transport.GuardedWebhookTransport;
import com.webhookretry.core.transport.JdkHttpWebhookTransport;
import com.webhookretry.core.wait.ExponentialWaitStrategy;
import com.webhookretry.core.wait.FixedChainWaitStrategy;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.WebhookResponse;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookRetryAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    OutcomeClassifierAutoConfiguration.class,
                    WebhookRetryMetricsAutoConfiguration.class,
                    WebhookRetryAutoConfiguration.class,
                    WebhookWheelAutoConfiguration.class));

    @Test
    void defaults_WireWholeStack() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(WebhookNotifier.class);
            assertThat(ctx).hasSingleBean(RetryExecutor.class);
            assertThat(ctx).hasSingleBean(WheelRetryExecutor.class);
            assertThat(ctx).hasSingleBean(OutcomeClassifier.class);
            assertThat(ctx).hasSingleBean(LoggingRetryListener.class);
            assertThat(ctx).hasSingleBean(MetricsRetryListener.class);
            assertThat(ctx.getBean(WebhookTransport.class)).isInstanceOf(JdkHttpWebhookTransport.class);

            RetryPolicy policy = ctx.getBean(RetryPolicy.class);
            assertThat(policy.getMaxAttempts()).isEqualTo(4);
            assertThat(policy.getWaitStrategy()).isInstanceOf(ExponentialWaitStrategy.class);
            assertThat(policy.getWaitStrategy().delay(3)).isEqualTo(Duration.ofSeconds(4));
        });
    }

    @Test
    void properties_TargetsAndStrategyBound() {
        runner.withPropertyValues(
                        "webhook.retry.max-attempts=6",
                        "webhook.retry.wait.strategy=fixed-chain",
                        "webhook.retry.wait.chain=1s,2s",
                        "webhook.retry.targets.slack.url=http://hooks.local/slack",
                        "webhook.retry.targets.slack.channel=learning")
                .run(ctx -> {
                    RetryPolicy policy = ctx.getBean(RetryPolicy.class);
                    assertThat(policy.getMaxAttempts()).isEqualTo(6);
                    assertThat(policy.getWaitStrategy()).isInstanceOf(FixedChainWaitStrategy.class);
                    assertThat(policy.getWaitStrategy().delay(5)).isEqualTo(Duration.ofSeconds(2));

                    WebhookTargets targets = ctx.getBean(WebhookTargets.class);
                    assertThat(targets.get("slack").getChannel()).isEqualTo("learning");
                });
    }

    @Test
    void guardEnabled_WrapsTransport() {
        runner.withPropertyValues("webhook.retry.guard.enabled=true")
                .run(ctx -> assertThat(ctx.getBean(WebhookTransport.class))
                        .isInstanceOf(GuardedWebhookTransport.class));
    }

    @Test
    void invalidMaxAttempts_FailsStartup() {
        runner.withPropertyValues("webhook.retry.max-attempts=0")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void blankTargetUrl_FailsStartup() {
        runner.withPropertyValues("webhook.retry.targets.slack.channel=learning")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void userStrategyBean_ResolvedThroughSpiPrefix() {
        runner.withUserConfiguration(CustomStrategyConfig.class)
                .withPropertyValues("webhook.retry.wait.strategy=spi:flat")
                .run(ctx -> assertThat(ctx.getBean(RetryPolicy.class).getWaitStrategy())
                        .isSameAs(ctx.getBean("flatWait")));
    }

    @Test
    void userTransportBean_BacksOffDefault() {
        runner.withUserConfiguration(CustomTransportConfig.class)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(WebhookTransport.class);
                    assertThat(ctx.getBean(WebhookTransport.class))
                            .isNotInstanceOf(JdkHttpWebhookTransport.class);
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStrategyConfig {
        @Bean
        WaitStrategy flatWait() {
            return new WaitStrategy() {
                @Override
                public String name() {
                    return "flat";
                }

                @Override
                public Duration delay(int attempt) {
                    return Duration.ofMillis(250);
                }
            };
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTransportConfig {
        @Bean
        WebhookTransport stubTransport() {
            return (url, body, headers) -> WebhookResponse.of(200, "ok");
        }
    }
}
