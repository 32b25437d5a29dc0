package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.DealAlert;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.eainde.dealflow.prompt.PromptText.orUnknown;

public final class MonitoringPrompts {

    static final int RECOVERY_EXCERPT_CHARS = 500;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private MonitoringPrompts() {
    }

    /**
     * @param communications newest first
     */
    public static String sentiment(Deal deal, List<Communication> communications) {
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < communications.size(); i++) {
            Communication c = communications.get(i);
            String label = i == 0 ? "MOST RECENT MESSAGE" : "Message #" + (i + 1);
            block.append("--- ").append(label).append(" (Date: ").append(date(c)).append(") ---\n")
                    .append("From: ").append(c.from() != null ? c.from() : "unknown").append('\n')
                    .append("Subject: ").append(c.subject() != null ? c.subject() : "(no subject)").append('\n')
                    .append(c.content() != null ? c.content() : "").append("\n\n");
        }
        return """
                # ROLE
                You analyze the sentiment of client communications for the deal "%s".

                # RULES
                The messages are sorted NEWEST FIRST. The most recent message reflects the client's current
                state of mind and carries the highest weight. Older messages give context only.
                Give one score per message, using the message position as "index" (0 = most recent).
                Name any competitor mention explicitly in "signals".

                # COMMUNICATIONS
                %s
                # OUTPUT (JSON)
                {
                  "scores": [
                    {"index": 0, "sentiment": -1.0 to 1.0, "signals": ["..."], "summary": "..."}
                  ],
                  "overall_sentiment": -1.0 to 1.0,
                  "key_concerns": ["..."],
                  "positive_signals": ["..."]
                }

                Return ONLY valid JSON.
                """.formatted(orUnknown(deal.title()), block);
    }

    public static String recovery(Deal deal, List<DealAlert> alerts, List<Communication> communications,
                                  double sentiment, String recipient, String recipientAddress) {
        boolean positive = alerts.stream().allMatch(DealAlert::isPositive);
        String sources = communications.isEmpty()
                ? "(No source messages available)"
                : communications.stream().map(MonitoringPrompts::excerpt).collect(Collectors.joining("\n---\n"));
        String task = positive
                ? """
                The client sent POSITIVE messages. Write a warm, professional reply to %s that thanks them,
                references the specific points they raised, reaffirms commitment and proposes next steps.
                Also list internal action items that build on the momentum.""".formatted(recipient)
                : """
                The alerts below put the deal at risk. Write a professional recovery email to %s that addresses
                their specific concerns, reaffirms value and offers concrete next steps.
                Also list internal action items for the team.""".formatted(recipient);

        return """
                # ROLE
                You are a deal intelligence agent.

                # TASK
                %s

                DEAL: %s
                CLIENT: %s
                SENTIMENT: %s
                DEAL VALUE: %s

                # ALERTS
                %s

                # SOURCE MESSAGES
                %s

                RECIPIENT: %s at %s

                # RULES
                Start the email with a "Subject:" line, then a greeting. Separate paragraphs with blank lines.
                End with a professional sign-off.

                # OUTPUT (JSON)
                {
                  "recovery_email": "Subject: Re: ...\\n\\nDear ...,\\n\\n...\\n\\nBest regards,\\n[Name]",
                  "recovery_actions": ["..."]
                }

                Return ONLY valid JSON.
                """.formatted(
                task,
                orUnknown(deal.title()),
                orUnknown(deal.clientName()),
                String.format(Locale.ROOT, "%.2f", sentiment),
                deal.dealValue() != null ? PromptText.money(deal.dealValue()) : "Unknown",
                alerts.stream()
                        .map(a -> "- [" + a.severity().value() + "] " + a.title() + ": " + a.description())
                        .collect(Collectors.joining("\n")),
                sources,
                recipient,
                recipientAddress != null ? recipientAddress : "their email");
    }

    private static String excerpt(Communication c) {
        String content = c.content() != null ? c.content() : "";
        if (content.length() > RECOVERY_EXCERPT_CHARS) {
            content = content.substring(0, RECOVERY_EXCERPT_CHARS);
        }
        return "From: " + (c.from() != null ? c.from() : "") + "\n"
                + "Subject: " + (c.subject() != null ? c.subject() : "(no subject)") + "\n"
                + "Date: " + date(c) + "\n"
                + content;
    }

    private static String date(Communication c) {
        return c.receivedAt() != null ? DATE.format(c.receivedAt()) : "unknown";
    }
}
