package com.webhookretry.autoconfig;

import com.webhookretry.config.WebhookGuardProperties;
import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.engine.RetryExecutor;
import com.webhookretry.core.engine.ThreadSleeper;
import com.webhookretry.core.listener.LoggingRetryListener;
import com.webhookretry.core.notify.WebhookNotifier;
import com.webhookretry.core.notify.WebhookTargets;
import com.webhookretry.core.serializer.JacksonPayloadSerializer;
import com.webhookretry.core.spi.JitterSource;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.PayloadSerializer;
import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.core.spi.Sleeper;
import com.webhookretry.core.spi.WaitStrategy;
import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.core.transport.GuardedWebhookTransport;
import com.webhookretry.core.transport.JdkHttpWebhookTransport;
import com.webhookretry.core.wait.RandomJitterSource;
import com.webhookretry.core.wait.WaitStrategyRegistry;
import com.webhookretry.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Random;

/**
 * 重试引擎与 Webhook 通知组件
 */
@AutoConfiguration(after = {OutcomeClassifierAutoConfiguration.class, WebhookRetryMetricsAutoConfiguration.class})
@EnableConfigurationProperties({
        WebhookRetryProperties.class,
        WebhookGuardProperties.class
})
public class WebhookRetryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WebhookRetryAutoConfiguration.class);

    /**
     * 抖动, 默认关闭
     */
    @Bean
    @ConditionalOnMissingBean
    public JitterSource jitterSource(WebhookRetryProperties props) {
        if (props.getWait().getJitter() == null || props.getWait().getJitter().isZero()) {
            return JitterSource.NONE;
        }
        return new RandomJitterSource(props.getWait().getJitter(), new Random());
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public WaitStrategyRegistry waitStrategyRegistry(WebhookRetryProperties props, JitterSource jitter,
                                                     ObjectProvider<WaitStrategy> discovered) {
        return new WaitStrategyRegistry(props.getWait(), jitter, discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy webhookRetryPolicy(WebhookRetryProperties props, WaitStrategyRegistry registry) {
        return RetryPolicy.builder()
                .maxAttempts(props.getMaxAttempts())
                .waitStrategy(registry.resolve(props.getWait().getStrategy()))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return new ThreadSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingRetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(OutcomeClassifier classifier, Sleeper sleeper,
                                       ObjectProvider<RetryListener> listeners) {
        return new RetryExecutor(classifier, sleeper, listeners.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 默认 JDK 传输, 开启 guard 时加上熔断/限流
     */
    @Bean
    @ConditionalOnMissingBean
    public WebhookTransport webhookTransport(WebhookRetryProperties props, WebhookGuardProperties guard,
                                             WebhookTargets targets) {
        WebhookTransport transport = new JdkHttpWebhookTransport(
                props.getHttp().getConnectTimeout(), props.getHttp().getRequestTimeout());
        if (guard.isEnabled()) {
            log.info("[Webhook-Retry] guard enabled, circuitBreaker={}, rateLimiter={}",
                    guard.getCircuitBreaker().isEnabled(), guard.getRateLimiter().isEnabled());
            return new GuardedWebhookTransport(transport, guard, targets);
        }
        return transport;
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookTargets webhookTargets(WebhookRetryProperties props) {
        return WebhookTargets.from(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookNotifier webhookNotifier(WebhookTransport transport, OutcomeClassifier classifier,
                                           PayloadSerializer serializer, RetryExecutor executor,
                                           RetryPolicy policy, WebhookTargets targets) {
        return new WebhookNotifier(transport, classifier, serializer, executor, policy, targets);
    }
}
