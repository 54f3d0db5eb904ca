package io.github.hide212131.langchain4j.spindleflow.runtime.feedback;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form reviewer text into an approval flag and per-agent feedback. Stateless and
 * deterministic: the same text, targets and keyword always give the same result.
 *
 * <p>Per target agent the first matching form wins:</p>
 * <ol>
 *   <li>{@code id: text}, continuing over following lines until the next label</li>
 *   <li>heading forms {@code **id**: text} or {@code ## id}</li>
 *   <li>role keywords found in the id, e.g. {@code backend-dev} also matches {@code Backend Developer:}</li>
 * </ol>
 */
public final class FeedbackProcessor {

    public static final String GENERIC_FEEDBACK =
            "Please review and improve based on the reviewer's comments above.";

    static final List<String> ROLE_KEYWORDS =
            List.of("backend", "frontend", "database", "api", "ui", "developer", "engineer", "designer");

    // a following line that starts a new label, heading or bold marker ends the current block
    private static final String NEXT_LABEL = "(?![ \\t]*(?:\\*\\*|##|\\w[\\w-]*(?:[ \\t]+\\w[\\w-]*)?[ \\t]*:))";
    private static final String BLOCK = "([^\\n]+(?:\\n" + NEXT_LABEL + "[^\\n]+)*)";

    public FeedbackResult process(String reviewerText, List<String> targetAgentIds, String approvalKeyword) {
        if (approvalKeyword == null || approvalKeyword.isBlank()) {
            throw new IllegalArgumentException("approvalKeyword must not be blank");
        }
        String text = reviewerText == null ? "" : reviewerText;
        boolean approved = isApproved(text, approvalKeyword.trim());

        Map<String, String> feedback = new LinkedHashMap<>();
        for (String agentId : targetAgentIds) {
            extractFor(text, agentId).ifPresent(value -> feedback.put(agentId, value));
        }
        if (feedback.isEmpty() && !approved) {
            for (String agentId : targetAgentIds) {
                feedback.put(agentId, GENERIC_FEEDBACK);
            }
        }
        return new FeedbackResult(approved, feedback);
    }

    static boolean isApproved(String text, String keyword) {
        String upperText = text.toUpperCase(Locale.ROOT);
        String upperKeyword = keyword.toUpperCase(Locale.ROOT);
        if (upperText.contains(upperKeyword)) {
            return true;
        }
        String quoted = Pattern.quote(upperKeyword);
        return Pattern.compile("(?:STATUS|VERDICT|DECISION)\\s*:\\s*" + quoted).matcher(upperText).find()
                || Pattern.compile("(?m)^\\s*" + quoted).matcher(upperText).find();
    }

    static Optional<String> extractFor(String text, String agentId) {
        String id = Pattern.quote(agentId);
        Pattern labelled = Pattern.compile(
                "(?<![\\w-])" + id + "[ \\t]*:[ \\t]*" + BLOCK, Pattern.CASE_INSENSITIVE);
        Optional<String> match = firstGroup(labelled, text);
        if (match.isPresent()) {
            return match;
        }
        Pattern heading = Pattern.compile(
                "(?:\\*\\*|##)[ \\t]*" + id + "[ \\t]*(?:\\*\\*)?[ \\t]*:?\\s*" + BLOCK, Pattern.CASE_INSENSITIVE);
        match = firstGroup(heading, text);
        if (match.isPresent()) {
            return match;
        }
        String lowerId = agentId.toLowerCase(Locale.ROOT);
        for (String role : ROLE_KEYWORDS) {
            if (!lowerId.contains(role)) {
                continue;
            }
            Pattern byRole = Pattern.compile(
                    "^[ \\t]*(?:\\*\\*|##)?[ \\t]*(?:" + role + "|" + id + ")[ \\t]*(?:developer|engineer|designer)?"
                            + "[ \\t]*(?:\\*\\*)?[ \\t]*:[ \\t]*" + BLOCK,
                    Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
            match = firstGroup(byRole, text);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
