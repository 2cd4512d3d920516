package com.draftreview.infrastructure.ai.cache;

import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.ReviewContext;
import com.draftreview.domain.review.model.SemanticChange;
import com.draftreview.infrastructure.ai.config.CacheSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CacheKeyBuilder keyBuilder = new CacheKeyBuilder();

    @Test
    @DisplayName("캐시 저장 값 → 동일하게 조회")
    void put_then_get() {
        ResponseCache cache = new ResponseCache(CacheSettings.defaults(), objectMapper);
        DiffAnalysis analysis = new DiffAnalysis("添加了 1 行", 1, 0, 0,
                List.of(new SemanticChange(SemanticChange.ChangeType.ADDITION, "新内容", 4, 0.85)),
                new ConsistencyReport(95, List.of(), List.of("考虑将长句拆分为多个短句")));

        cache.put("k", analysis);

        assertThat(cache.get("k", DiffAnalysis.class)).contains(analysis);
        assertThat(cache.get("missing", DiffAnalysis.class)).isEmpty();
    }

    @Test
    @DisplayName("요청 타입으로 읽을 수 없는 항목 → 폐기")
    void get_unreadable_entry() {
        ResponseCache cache = new ResponseCache(CacheSettings.defaults(), objectMapper);
        cache.put("k", "plain string");

        assertThat(cache.get("k", DiffAnalysis.class)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("전체 페이로드 크기 상한 적용")
    void size_bounded() {
        ResponseCache cache = new ResponseCache(new CacheSettings(true, Duration.ofHours(1), 64), objectMapper);

        for (int i = 0; i < 20; i++) {
            cache.put("key-" + i, "value-" + i);
        }

        assertThat(cache.size()).isLessThan(20);
        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("캐시 키는 결정적이며 모든 입력에 민감")
    void buildKey() {
        ReviewContext context = ReviewContext.forPath("a.md");
        String key = keyBuilder.buildKey("text-review", "gpt-4", "正文", context);

        assertThat(key).hasSize(64).isEqualTo(keyBuilder.buildKey("text-review", "gpt-4", "正文", context));
        assertThat(key).isNotEqualTo(keyBuilder.buildKey("diff-analysis", "gpt-4", "正文", context));
        assertThat(key).isNotEqualTo(keyBuilder.buildKey("text-review", "gpt-4o", "正文", context));
        assertThat(key).isNotEqualTo(keyBuilder.buildKey("text-review", "gpt-4", "正文", ReviewContext.forPath("a.tex")));
    }
}
