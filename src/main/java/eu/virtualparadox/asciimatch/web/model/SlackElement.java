package eu.virtualparadox.asciimatch.web.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Interactive element of an {@code actions} block.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SlackElement(String type,
                           String style,
                           String url,
                           String value,
                           @JsonProperty("action_id") String actionId,
                           SlackText text) {

    public static SlackElement button(final String label, final String style, final String actionId, final String value) {
        return new SlackElement("button", style, null, value, actionId, SlackText.plain(label));
    }
}
