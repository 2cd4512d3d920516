package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.model.ReviewContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ReviewPromptBuilder {

    static final String SYSTEM_PROMPT =
            "You are a professional writing assistant specializing in document analysis and review.";

    private static final String REVIEW_INSTRUCTIONS = """
            IMPORTANT: The text above has line numbers prepended (e.g., "1: ", "2: "). When providing suggestions:
            - "line" is the line number shown (1-based, for display)
            - "startLine" and "endLine" are 0-based (line number - 1)
            - "startColumn" and "endColumn" are 0-based positions in the ORIGINAL line, without the line number prefix
            - "original" must be the exact text from the document at that range, without line numbers
            - "suggested" is the recommended replacement

            Detect the primary language of the text and write every piece of feedback in that language.

            Rating (0-10): start from 7, add 0.5 to 1.0 for each strength (grammar, structure, style, content, flow)
            and subtract 0.5 to 1.0 for each weakness. Briefly explain the score in "overall".

            Respond in JSON with this structure:
            {
              "overall": "overall assessment with score explanation",
              "strengths": ["one entry per positive adjustment"],
              "improvements": ["one entry per negative adjustment"],
              "rating": 0-10,
              "suggestions": [
                {
                  "id": "unique-id",
                  "type": "grammar|style|structure|content|clarity",
                  "line": 1,
                  "startLine": 0,
                  "startColumn": 0,
                  "endLine": 0,
                  "endColumn": 0,
                  "original": "exact text from the line",
                  "suggested": "replacement",
                  "reason": "explanation",
                  "confidence": 0.0-1.0
                }
              ]
            }

            Review grammar and spelling, clarity, style consistency, structure and flow, and content quality.
            Provide specific, actionable suggestions. Respond ONLY with valid JSON.""";

    private static final String DIFF_INSTRUCTIONS = """
            Respond in JSON with this structure:
            {
              "summary": "brief summary of the changes in Chinese",
              "semanticChanges": [
                {
                  "type": "addition|deletion|modification",
                  "description": "the changed text or a description of it",
                  "lineNumber": 0,
                  "confidence": 0.0-1.0
                }
              ],
              "consistencyReport": {
                "score": 0-100,
                "issues": ["consistency issues"],
                "suggestions": ["suggestions for improvement"]
              }
            }

            Focus on semantic meaning rather than line counts, structural changes (headings, sections),
            tone and style changes, and consistency issues. Respond ONLY with valid JSON.""";

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildTextReviewPrompt(String text, ReviewContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a professional writing editor. Review the following text and provide detailed feedback.\n");
        if (context != null) {
            sb.append("Document Type: ").append(context.documentType().name().toLowerCase(Locale.ROOT)).append("\n");
            sb.append("Writing Style: ").append(context.writingStyle().name().toLowerCase(Locale.ROOT)).append("\n");
        }
        sb.append("\nText to Review (with line numbers):\n```\n");
        sb.append(numberLines(text));
        sb.append("\n```\n\n");
        sb.append(REVIEW_INSTRUCTIONS);
        return sb.toString();
    }

    public String buildDiffAnalysisPrompt(String diff, ReviewContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are analyzing changes in a document. Analyze the following git diff.\n");
        if (context != null) {
            sb.append("Document Type: ").append(context.documentType().name().toLowerCase(Locale.ROOT)).append("\n");
            sb.append("File Path: ").append(context.filePath() != null ? context.filePath() : "unknown").append("\n");
        }
        sb.append("\nGit Diff:\n```\n");
        sb.append(diff);
        sb.append("\n```\n\n");
        sb.append(DIFF_INSTRUCTIONS);
        return sb.toString();
    }

    /**
     * Prefixes each line with its 1-based number, e.g. {@code "1: first line"}.
     */
    String numberLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(": ").append(lines[i]);
        }
        return sb.toString();
    }
}
