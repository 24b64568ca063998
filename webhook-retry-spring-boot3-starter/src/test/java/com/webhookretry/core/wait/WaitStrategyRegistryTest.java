package com.webhookretry.core.wait;

import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.spi.JitterSource;
import com.webhookretry.core.spi.WaitStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WaitStrategyRegistryTest {

    private final WebhookRetryProperties.Wait props = new WebhookRetryProperties().getWait();

    @Test
    void resolve_BuiltInNames_ReturnsBuiltIns() {
        WaitStrategyRegistry registry = new WaitStrategyRegistry(props, JitterSource.NONE, null);

        assertThat(registry.resolve("fixed")).isInstanceOf(FixedWaitStrategy.class);
        assertThat(registry.resolve("fixed-chain")).isInstanceOf(FixedChainWaitStrategy.class);
        assertThat(registry.resolve("Exponential")).isInstanceOf(ExponentialWaitStrategy.class);
        assertThat(registry.names()).contains("fixed", "fixed-chain", "exponential");
    }

    @Test
    void resolve_DefaultChain_MatchesConfiguredSteps() {
        WaitStrategyRegistry registry = new WaitStrategyRegistry(props, JitterSource.NONE, null);

        FixedChainWaitStrategy chain = (FixedChainWaitStrategy) registry.resolve("fixed-chain");

        assertThat(chain.getSteps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1),
                Duration.ofSeconds(3), Duration.ofSeconds(3), Duration.ofSeconds(6));
    }

    @Test
    void resolve_UnknownOrBlank_FallsBackToExponential() {
        WaitStrategyRegistry registry = new WaitStrategyRegistry(props, JitterSource.NONE, null);

        assertThat(registry.resolve("no-such")).isInstanceOf(ExponentialWaitStrategy.class);
        assertThat(registry.resolve(null)).isInstanceOf(ExponentialWaitStrategy.class);
        assertThat(registry.resolve(" ")).isInstanceOf(ExponentialWaitStrategy.class);
    }

    @Test
    void resolve_SpiPrefix_FindsDiscoveredStrategy() {
        WaitStrategy custom = new WaitStrategy() {
            @Override
            public String name() {
                return "linear";
            }

            @Override
            public Duration delay(int attempt) {
                return Duration.ofMillis(100L * attempt);
            }
        };
        WaitStrategyRegistry registry = new WaitStrategyRegistry(props, JitterSource.NONE, List.of(custom));

        assertThat(registry.resolve("spi:linear")).isSameAs(custom);
        assertThat(registry.resolve("linear")).isSameAs(custom);
    }

    @Test
    void register_SameName_Replaces() {
        WaitStrategyRegistry registry = new WaitStrategyRegistry(props, JitterSource.NONE, null);
        FixedWaitStrategy zero = new FixedWaitStrategy(Duration.ZERO);

        registry.register("exponential", zero);

        assertThat(registry.resolve("exponential")).isSameAs(zero);
        assertThat(registry.resolve("unknown")).isSameAs(zero);
    }
}
