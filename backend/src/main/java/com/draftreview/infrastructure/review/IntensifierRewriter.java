package com.draftreview.infrastructure.review;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes the degree adverbs 很 and 非常 from added text.
 *
 * An adverb is only removed when it stands alone: it must not follow a letter or digit of a
 * space-delimited script, and it must be followed by a non-whitespace character. In Han text every
 * ideograph boundary is a word boundary. The fixed compounds 很多, 很少, 非常规 and 非常态 are kept.
 */
@Component
public class IntensifierRewriter {

    static final String HEN = "很";
    static final String FEICHANG = "非常";

    private static final Pattern STANDALONE_INTENSIFIER = Pattern.compile(
            "(?<![[\\p{L}\\p{N}]&&[^\\p{IsHan}]])(?:很(?![多少])|非常(?![规态]))(?=\\S)");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final String RATIONALE = "减少程度副词的使用可以使文字更精炼";
    private static final String KEPT_COMPOUNDS = "，\"很多\"、\"很少\"、\"非常规\"、\"非常态\"等固定搭配保持不变";

    public boolean containsIntensifier(String text) {
        return text != null && (text.contains(HEN) || text.contains(FEICHANG));
    }

    public String strip(String text) {
        if (text == null) {
            return "";
        }
        String stripped = STANDALONE_INTENSIFIER.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Rationale naming only the adverbs {@link #strip} would remove from {@code text}.
     */
    public String rationaleFor(String text) {
        boolean removesHen = false;
        boolean removesFeichang = false;
        Matcher matcher = STANDALONE_INTENSIFIER.matcher(text);
        while (matcher.find()) {
            removesHen |= HEN.equals(matcher.group());
            removesFeichang |= FEICHANG.equals(matcher.group());
        }
        if (removesHen && removesFeichang) {
            return RATIONALE + "（将移除单独修饰的\"很\"和\"非常\"" + KEPT_COMPOUNDS + "）";
        }
        if (removesHen) {
            return RATIONALE + "（将移除单独修饰的\"很\"" + KEPT_COMPOUNDS + "）";
        }
        if (removesFeichang) {
            return RATIONALE + "（将移除单独修饰的\"非常\"" + KEPT_COMPOUNDS + "）";
        }
        return RATIONALE;
    }
}
