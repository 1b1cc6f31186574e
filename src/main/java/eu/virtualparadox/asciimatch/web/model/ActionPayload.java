package eu.virtualparadox.asciimatch.web.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The subset of a Slack {@code block_actions} interaction payload this service reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionPayload(String type,
                            @JsonProperty("response_url") String responseUrl,
                            List<Action> actions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Action(@JsonProperty("action_id") String actionId, String value) {
    }
}
