package com.draftreview.infrastructure.ai.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendPropertiesTest {

    @Test
    @DisplayName("기본값: 프로바이더 없음, 캐시 사용, 3회 시도")
    void defaults() {
        BackendProperties properties = new BackendProperties();

        assertThat(properties.toProviderSettings()).isEmpty();
        assertThat(properties.toCacheSettings()).isEqualTo(CacheSettings.defaults());
        assertThat(properties.toRetrySettings()).isEqualTo(RetrySettings.defaults());
    }

    @Test
    @DisplayName("프로바이더 키 대소문자 무시, 빈 base URL 제거")
    void toProviderSettings_openai() {
        BackendProperties properties = new BackendProperties();
        properties.setProvider(" OPENAI ");
        properties.setModel("gpt-4o");
        properties.setBaseUrl("  ");

        assertThat(properties.toProviderSettings()).contains(new OpenAiSettings("gpt-4o", null));
    }

    @Test
    @DisplayName("알 수 없는 프로바이더 → 설정 오류")
    void toProviderSettings_unknown() {
        BackendProperties properties = new BackendProperties();
        properties.setProvider("gemini");

        assertThatThrownBy(properties::toProviderSettings).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("백오프는 초기 지연부터 2배씩 증가")
    void retry_backoff() {
        RetrySettings retry = new RetrySettings(3, Duration.ofMillis(250), null, 10, 1.0);

        assertThat(retry.backoffMillis(0)).isEqualTo(250);
        assertThat(retry.backoffMillis(1)).isEqualTo(500);
        assertThat(retry.backoffMillis(2)).isEqualTo(1000);
        assertThat(retry.rateLimitMaxWait()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("잘못된 캐시/재시도 설정 거부")
    void settings_validation() {
        assertThatThrownBy(() -> new CacheSettings(true, Duration.ZERO, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CacheSettings(true, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrySettings(0, null, null, 10, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
