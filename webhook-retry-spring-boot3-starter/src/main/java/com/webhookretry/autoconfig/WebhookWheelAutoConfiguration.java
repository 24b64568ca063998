package com.webhookretry.autoconfig;

import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.engine.WheelRetryExecutor;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.RetryListener;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮执行器
 */
@AutoConfiguration(after = WebhookRetryAutoConfiguration.class)
public class WebhookWheelAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    @ConditionalOnMissingBean
    public HashedWheelTimer webhookRetryWheelTimer(WebhookRetryProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("webhook-retry-wheel"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * handler执行线程池
     */
    @Bean("webhookRetryHandlerExecutor")
    @ConditionalOnMissingBean(name = "webhookRetryHandlerExecutor")
    public ExecutorService webhookRetryHandlerExecutor(WebhookRetryProperties props) {
        WebhookRetryProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("webhook-retry-handler"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public WheelRetryExecutor wheelRetryExecutor(HashedWheelTimer webhookRetryWheelTimer,
                                                 @Qualifier("webhookRetryHandlerExecutor") ExecutorService handlerExecutor,
                                                 OutcomeClassifier classifier,
                                                 ObjectProvider<RetryListener> listeners) {
        return new WheelRetryExecutor(webhookRetryWheelTimer, handlerExecutor, classifier,
                listeners.orderedStream().toList());
    }
}
