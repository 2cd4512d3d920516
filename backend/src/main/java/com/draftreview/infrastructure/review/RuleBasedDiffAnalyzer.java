package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.SemanticChange;
import com.draftreview.domain.review.model.SemanticChange.ChangeType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Line-based analysis of a unified diff plus simple readability heuristics over the full text.
 *
 * Added lines are reported with their literal text so that later passes can locate them in the
 * document; deleted lines are reported with a short description of what kind of line they were.
 */
@Component
public class RuleBasedDiffAnalyzer {

    static final double CONFIDENCE = 0.85;
    static final String NO_NOTABLE_CHANGE = "无明显变化";

    private static final Pattern HUNK_HEADER = Pattern.compile("@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\d+\\..*", Pattern.DOTALL);
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("(?:\r?\n){2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    enum LineCategory {
        EMPTY, HEADING, LIST_ITEM, BULLET, PARAGRAPH, TEXT
    }

    public DiffAnalysis analyze(String diff, String fullText) {
        int additions = 0;
        int deletions = 0;
        int currentLine = 0;
        List<SemanticChange> changes = new ArrayList<>();
        Map<LineCategory, Integer> categories = new LinkedHashMap<>();

        for (String line : LINE_BREAK.split(diff, -1)) {
            if (line.startsWith("+") && !line.startsWith("+++")) {
                additions++;
                String text = line.substring(1);
                categories.merge(categorize(text), 1, Integer::sum);
                changes.add(new SemanticChange(ChangeType.ADDITION, text, currentLine, CONFIDENCE));
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                deletions++;
                String text = line.substring(1);
                categories.merge(categorize(text), 1, Integer::sum);
                changes.add(new SemanticChange(ChangeType.DELETION, describe(text), currentLine, CONFIDENCE));
            } else if (line.startsWith("@")) {
                Matcher matcher = HUNK_HEADER.matcher(line);
                if (matcher.find()) {
                    currentLine = Integer.parseInt(matcher.group(1));
                }
            } else {
                currentLine++;
            }
        }

        int modifications = Math.min(additions, deletions);
        ConsistencyReport report = consistencyReport(fullText != null ? fullText : "", changes);
        String summary = summarize(additions, deletions, modifications, categories);

        return new DiffAnalysis(summary, additions, deletions, modifications, changes, report);
    }

    static LineCategory categorize(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return LineCategory.EMPTY;
        }
        if (trimmed.startsWith("#")) {
            return LineCategory.HEADING;
        }
        if (NUMBERED_ITEM.matcher(trimmed).matches()) {
            return LineCategory.LIST_ITEM;
        }
        if (trimmed.startsWith("-") || trimmed.startsWith("*")) {
            return LineCategory.BULLET;
        }
        return trimmed.length() > 100 ? LineCategory.PARAGRAPH : LineCategory.TEXT;
    }

    static String describe(String line) {
        String trimmed = line.trim();
        String excerpt = trimmed.substring(0, Math.min(50, trimmed.length()));
        return switch (categorize(line)) {
            case EMPTY -> "Empty line change";
            case HEADING -> "Heading change: \"" + excerpt + "...\"";
            case LIST_ITEM -> "List item: \"" + excerpt + "...\"";
            case BULLET -> "Bullet point: \"" + excerpt + "...\"";
            case PARAGRAPH -> "Paragraph modification: \"" + excerpt + "...\"";
            case TEXT -> "Text change: \"" + excerpt + "...\"";
        };
    }

    static ConsistencyReport consistencyReport(String content, List<SemanticChange> changes) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int score = 100;

        String[] sentences = SENTENCE_END.split(content, -1);
        long longSentences = Arrays.stream(sentences)
                .filter(s -> wordCount(s) > 30)
                .count();
        if (longSentences > sentences.length * 0.2) {
            issues.add("多个句子过长，可能影响可读性");
            suggestions.add("考虑将长句拆分为多个短句");
            score -= 10;
        }

        String[] paragraphs = PARAGRAPH_BREAK.split(content, -1);
        long shortParagraphs = Arrays.stream(paragraphs)
                .filter(p -> wordCount(p) < 20)
                .count();
        if (shortParagraphs > paragraphs.length * 0.3) {
            suggestions.add("部分段落较短，考虑扩展内容或合并相关段落");
            score -= 5;
        }

        String addedText = changes.stream()
                .filter(c -> c.type() == ChangeType.ADDITION)
                .map(SemanticChange::description)
                .collect(Collectors.joining(" "));
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String word : WHITESPACE.split(addedText.toLowerCase(Locale.ROOT))) {
            if (word.length() > 4) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }
        List<String> repeated = frequencies.entrySet().stream()
                .filter(e -> e.getValue() > 3)
                .map(Map.Entry::getKey)
                .toList();
        if (!repeated.isEmpty()) {
            issues.add("发现重复词汇: " + String.join(", ", repeated));
            suggestions.add("避免过度使用相同词汇，尝试使用同义词");
            score -= 10;
        }

        return new ConsistencyReport(Math.max(0, score), issues, suggestions);
    }

    /**
     * Whitespace-separated tokens; an empty string counts as one, matching a plain split.
     */
    private static int wordCount(String text) {
        return WHITESPACE.split(text.trim(), -1).length;
    }

    static String summarize(int additions, int deletions, int modifications, Map<LineCategory, Integer> categories) {
        List<String> parts = new ArrayList<>();
        if (additions > 0) {
            parts.add("添加了 " + additions + " 行");
        }
        if (deletions > 0) {
            parts.add("删除了 " + deletions + " 行");
        }
        if (modifications > 0) {
            parts.add("修改了 " + modifications + " 处");
        }
        String summary = String.join("，", parts);

        int headings = categories.getOrDefault(LineCategory.HEADING, 0);
        int lists = categories.getOrDefault(LineCategory.LIST_ITEM, 0) + categories.getOrDefault(LineCategory.BULLET, 0);
        int paragraphs = categories.getOrDefault(LineCategory.PARAGRAPH, 0) + categories.getOrDefault(LineCategory.TEXT, 0);

        List<String> details = new ArrayList<>();
        if (headings > 0) {
            details.add(headings + " 个标题");
        }
        if (lists > 0) {
            details.add(lists + " 个列表项");
        }
        if (paragraphs > 0) {
            details.add(paragraphs + " 段文本");
        }

        if (!details.isEmpty()) {
            return summary + "。涉及" + String.join("、", details) + "。";
        }
        return summary.isEmpty() ? NO_NOTABLE_CHANGE : summary;
    }
}
