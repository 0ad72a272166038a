package com.greeksync.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.greeksync.config.GreeksConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@DisplayName("GreeksConfig")
class GreeksConfigTest {

    private static GreeksConfig bind(Map<String, String> properties) {
        Binder binder = new Binder(new MapConfigurationPropertySource(properties));
        return binder.bind("greeks", GreeksConfig.class).orElseGet(GreeksConfig::new);
    }

    @Test
    @DisplayName("should default to 15s primary wait, 20s retry wait and a 48h horizon")
    void defaults() {
        GreeksConfig config = bind(Map.of());

        assertThat(config.getFetch().getPrimaryWait()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.getFetch().getRetryWait()).isEqualTo(Duration.ofSeconds(20));
        assertThat(config.getCache().getMaxAge()).isEqualTo(Duration.ofHours(48));
        assertThat(config.getCache().getFile()).isEqualTo(Path.of("data", "greeks_cache.json"));
        assertThat(config.getSync().isRunOnStartup()).isFalse();
    }

    @Test
    @DisplayName("should read plain numbers as seconds for waits and hours for the horizon")
    void units() {
        GreeksConfig config = bind(Map.of(
                "greeks.fetch.primary-wait", "30",
                "greeks.fetch.retry-wait", "0",
                "greeks.cache.max-age", "72",
                "greeks.cache.file", "/tmp/greeks/cache.json"));

        assertThat(config.getFetch().getPrimaryWait()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getFetch().getRetryWait()).isEqualTo(Duration.ZERO);
        assertThat(config.getCache().getMaxAge()).isEqualTo(Duration.ofHours(72));
        assertThat(config.getCache().getFile()).isEqualTo(Path.of("/tmp/greeks/cache.json"));
    }
}
