package eu.virtualparadox.asciimatch.web.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Slack Block Kit layout block.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SlackBlock(String type,
                         SlackText text,
                         @JsonProperty("block_id") String blockId,
                         List<SlackElement> elements) {

    public static SlackBlock section(final SlackText text) {
        return new SlackBlock("section", text, null, null);
    }

    public static SlackBlock actions(final String blockId, final List<SlackElement> elements) {
        return new SlackBlock("actions", null, blockId, elements);
    }
}
