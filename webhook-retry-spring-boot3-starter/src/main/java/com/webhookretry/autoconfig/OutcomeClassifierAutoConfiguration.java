package com.webhookretry.autoconfig;

import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.classify.HttpStatusOutcomeClassifier;
import com.webhookretry.core.classify.RetryAfterParser;
import com.webhookretry.core.classify.handler.OpenCircuitHandler;
import com.webhookretry.core.classify.handler.RateLimitedHandler;
import com.webhookretry.core.classify.handler.TimeoutHandler;
import com.webhookretry.core.classify.handler.TransportErrorHandler;
import com.webhookretry.core.classify.handler.UnknownHandler;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.failure.FailureCaseHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(WebhookRetryProperties.class)
public class OutcomeClassifierAutoConfiguration {

    // 默认内置一组异常分类器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(TransportErrorHandler.class)
    public TransportErrorHandler transportErrorHandler(){ return new TransportErrorHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler(){ return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler(){ return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(RateLimitedHandler.class)
    public RateLimitedHandler rateLimitedHandler(){ return new RateLimitedHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler(){ return new UnknownHandler(); }

    @Bean
    @ConditionalOnMissingBean
    public RetryAfterParser retryAfterParser(WebhookRetryProperties props) {
        return new RetryAfterParser(Clock.systemUTC(), props.getRetryAfterMax());
    }

    // 状态码分类 + 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(OutcomeClassifier.class)
    public OutcomeClassifier outcomeClassifier(RetryAfterParser retryAfterParser,
                                               ObjectProvider<FailureCaseHandler<?>> handlers) {
        List<FailureCaseHandler<?>> list = handlers.orderedStream().toList();
        return new HttpStatusOutcomeClassifier(retryAfterParser, list);
    }
}
