package eu.virtualparadox.asciimatch.web.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body returned to Slack for a slash command.
 *
 * @param responseType    {@code in_channel} to post publicly, absent for an ephemeral reply
 * @param replaceOriginal replace the message the action came from
 * @param deleteOriginal  delete the message the action came from
 * @param blocks          message layout
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SlackResponse(@JsonProperty("response_type") String responseType,
                            @JsonProperty("replace_original") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean replaceOriginal,
                            @JsonProperty("delete_original") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean deleteOriginal,
                            List<SlackBlock> blocks) {

    public static SlackResponse inChannel(final List<SlackBlock> blocks) {
        return new SlackResponse("in_channel", false, false, blocks);
    }

    public static SlackResponse ephemeral(final List<SlackBlock> blocks) {
        return new SlackResponse(null, false, false, blocks);
    }
}
