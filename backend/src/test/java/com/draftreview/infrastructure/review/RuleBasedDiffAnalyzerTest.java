package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.SemanticChange;
import com.draftreview.domain.review.model.SemanticChange.ChangeType;
import com.draftreview.infrastructure.review.RuleBasedDiffAnalyzer.LineCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedDiffAnalyzerTest {

    private static final String DIFF = String.join("\n",
            "--- a/doc.md",
            "+++ b/doc.md",
            "@@ -1,2 +1,3 @@",
            " # Title",
            "-old line",
            "+new line",
            "+## Section");

    private final RuleBasedDiffAnalyzer analyzer = new RuleBasedDiffAnalyzer();

    @Test
    @DisplayName("단일 hunk의 개수, 줄 번호, 설명")
    void analyze_single_hunk() {
        DiffAnalysis analysis = analyzer.analyze(DIFF, "# Title\nnew line\n## Section");

        assertThat(analysis.additions()).isEqualTo(2);
        assertThat(analysis.deletions()).isEqualTo(1);
        assertThat(analysis.modifications()).isEqualTo(1);
        assertThat(analysis.summary()).isEqualTo("添加了 2 行，删除了 1 行，修改了 1 处。涉及1 个标题、2 段文本。");

        List<SemanticChange> changes = analysis.semanticChanges();
        assertThat(changes).extracting(SemanticChange::type)
                .containsExactly(ChangeType.DELETION, ChangeType.ADDITION, ChangeType.ADDITION);
        assertThat(changes.get(0).description()).isEqualTo("Text change: \"old line...\"");
        assertThat(changes.get(1).description()).isEqualTo("new line");
        assertThat(changes.get(2).description()).isEqualTo("## Section");
        assertThat(changes).extracting(SemanticChange::lineNumber).containsOnly(2);
        assertThat(changes).extracting(SemanticChange::confidence).containsOnly(RuleBasedDiffAnalyzer.CONFIDENCE);
    }

    @Test
    @DisplayName("CRLF diff → 추가 줄 끝의 \\r 제거, 결과는 LF diff와 동일")
    void analyze_crlf_diff() {
        DiffAnalysis lf = analyzer.analyze(DIFF, "# Title\nnew line\n## Section");
        DiffAnalysis crlf = analyzer.analyze(DIFF.replace("\n", "\r\n"), "# Title\r\nnew line\r\n## Section");

        assertThat(crlf.semanticChanges()).extracting(SemanticChange::description)
                .containsExactly("Text change: \"old line...\"", "new line", "## Section")
                .noneMatch(description -> description.contains("\r"));
        assertThat(crlf.semanticChanges()).isEqualTo(lf.semanticChanges());
        assertThat(crlf.summary()).isEqualTo(lf.summary());
    }

    @Test
    @DisplayName("빈 diff → 변경 없음, 변경 없음 요약")
    void analyze_empty() {
        DiffAnalysis analysis = analyzer.analyze("", "");

        assertThat(analysis.additions()).isZero();
        assertThat(analysis.deletions()).isZero();
        assertThat(analysis.semanticChanges()).isEmpty();
        assertThat(analysis.summary()).isEqualTo(RuleBasedDiffAnalyzer.NO_NOTABLE_CHANGE);
    }

    @Test
    @DisplayName("줄 분류")
    void categorize() {
        assertThat(RuleBasedDiffAnalyzer.categorize("   ")).isEqualTo(LineCategory.EMPTY);
        assertThat(RuleBasedDiffAnalyzer.categorize("## h")).isEqualTo(LineCategory.HEADING);
        assertThat(RuleBasedDiffAnalyzer.categorize("12. item")).isEqualTo(LineCategory.LIST_ITEM);
        assertThat(RuleBasedDiffAnalyzer.categorize("* bullet")).isEqualTo(LineCategory.BULLET);
        assertThat(RuleBasedDiffAnalyzer.categorize("x".repeat(101))).isEqualTo(LineCategory.PARAGRAPH);
        assertThat(RuleBasedDiffAnalyzer.categorize("short")).isEqualTo(LineCategory.TEXT);
    }

    @Test
    @DisplayName("긴 문장 → 점수 감점, 이슈 추가")
    void consistencyReport_long_sentences() {
        String content = String.join(" ", Collections.nCopies(31, "word")) + ".";

        ConsistencyReport report = RuleBasedDiffAnalyzer.consistencyReport(content, List.of());

        assertThat(report.score()).isEqualTo(90);
        assertThat(report.issues()).containsExactly("多个句子过长，可能影响可读性");
        assertThat(report.suggestions()).containsExactly("考虑将长句拆分为多个短句");
    }

    @Test
    @DisplayName("추가 텍스트에서 3회 넘게 반복된 단어 보고")
    void consistencyReport_repeated_words() {
        List<SemanticChange> changes = List.of(
                new SemanticChange(ChangeType.ADDITION, "Review review", 0, 0.85),
                new SemanticChange(ChangeType.ADDITION, "review REVIEW tiny", 1, 0.85),
                new SemanticChange(ChangeType.DELETION, "review review review", 2, 0.85));

        ConsistencyReport report = RuleBasedDiffAnalyzer.consistencyReport("", changes);

        assertThat(report.issues()).containsExactly("发现重复词汇: review");
        assertThat(report.suggestions()).contains("部分段落较短，考虑扩展内容或合并相关段落", "避免过度使用相同词汇，尝试使用同义词");
        assertThat(report.score()).isEqualTo(85);
    }
}
