package com.webhookretry.core.metric;

import com.webhookretry.model.enums.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public final class RetryMetrics {
    private final Counter attempts;
    private final Counter retries;
    private final Counter success;
    private final Counter fatal;
    private final Counter exhausted;
    private final Counter cancelled;
    private final Map<FailureCategory, Counter> failures = new EnumMap<>(FailureCategory.class);
    private final DistributionSummary attemptsPerCall;
    private final Timer waitTimer;
    private final Timer callTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.attempts  = Counter.builder("webhook.retry.attempts").description("attempts made").register(reg);
        this.retries   = Counter.builder("webhook.retry.retries").description("attempts followed by a wait").register(reg);
        this.success   = Counter.builder("webhook.retry.success").description("calls succeeded").register(reg);
        this.fatal     = Counter.builder("webhook.retry.fatal").description("calls stopped by a fatal outcome").register(reg);
        this.exhausted = Counter.builder("webhook.retry.exhausted").description("calls that ran out of attempts").register(reg);
        this.cancelled = Counter.builder("webhook.retry.cancelled").description("calls cancelled").register(reg);
        for (FailureCategory c : FailureCategory.values()) {
            failures.put(c, Counter.builder("webhook.retry.failure")
                    .tag("category", c.name()).description("failed attempts by category").register(reg));
        }
        this.attemptsPerCall = DistributionSummary.builder("webhook.retry.attempts.per.call")
                .description("attempt count per call").baseUnit("times").register(reg);
        this.waitTimer = Timer.builder("webhook.retry.wait.time").description("wait chosen between attempts").register(reg);
        this.callTimer = Timer.builder("webhook.retry.call.time").description("first attempt to terminal state").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incAttempt(){   attempts.increment(); }
    public void incRetry(){     retries.increment(); }
    public void incSuccess(){   success.increment(); }
    public void incFatal(){     fatal.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void incCancelled(){ cancelled.increment(); }
    public void incFailure(FailureCategory category){
        if (category != null) failures.get(category).increment();
    }
    public void recordAttempts(int n){ attemptsPerCall.record(n); }
    public void recordWait(Duration d){ waitTimer.record(d); }
    public void recordCall(Duration d){ callTimer.record(d); }
}
