package com.webhookretry.autoconfig;

import com.webhookretry.core.listener.MetricsRetryListener;
import com.webhookretry.core.metric.RetryMeterRegistryProvider;
import com.webhookretry.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class WebhookRetryMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRetryListener metricsRetryListener(RetryMetrics retryMetrics) {
        return new MetricsRetryListener(retryMetrics);
    }
}
