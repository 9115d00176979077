package com.webspec.core;

import org.testng.annotations.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WebSpecConfigTest {

    @Test
    public void defaults() {
        WebSpecConfig config = WebSpecConfig.defaults();

        assertThat(config.isParallel()).isTrue();
        assertThat(config.getMaxWorkers()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.getBatchTimeoutSeconds()).isEqualTo(300);
        assertThat(config.getFeatureExtension()).isEqualTo(".feature");
        assertThat(config.getStepCatalogPath()).isNull();
        assertThat(config.getAlertConfigPath()).isNull();
        assertThat(config.getWebhookConfigPath()).isNull();
        assertThat(config.getReportDir()).isEqualTo(Paths.get("target/webspec-reports"));
    }

    @Test
    public void builder_clampsWorkersAndTimeoutToOne() {
        WebSpecConfig config = WebSpecConfig.builder().maxWorkers(0).batchTimeoutSeconds(-5).build();

        assertThat(config.getMaxWorkers()).isEqualTo(1);
        assertThat(config.getBatchTimeoutSeconds()).isEqualTo(1);
    }

    @Test
    public void builder_rejectsBlankExtension() {
        assertThatThrownBy(() -> WebSpecConfig.builder().featureExtension(" ").build())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void toString_namesFallbacks() {
        assertThat(WebSpecConfig.defaults().toString())
            .contains("catalog=bundled", "alerts=defaults", "webhooks=none");
    }
}
