package com.webhookretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        // 保底 Simple, 未接入监控时指标仍可读
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        // 把外部业务接入的注册表也合入
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
