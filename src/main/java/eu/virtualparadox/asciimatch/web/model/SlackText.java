package eu.virtualparadox.asciimatch.web.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Slack text object, e.g. {@code {"type": "mrkdwn", "text": "..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SlackText(String type, String text) {

    public static SlackText markdown(final String text) {
        return new SlackText("mrkdwn", text);
    }

    public static SlackText plain(final String text) {
        return new SlackText("plain_text", text);
    }
}
