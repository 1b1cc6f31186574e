package eu.virtualparadox.asciimatch.web;

import eu.virtualparadox.asciimatch.web.model.SlackResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Sends follow-up messages to the {@code response_url} of a Slack interaction.
 */
@Service
@Slf4j
public class SlackResponder {

    private final RestClient restClient;

    public SlackResponder(final RestClient.Builder builder) {
        this.restClient = builder.build();
    }

    /**
     * @throws org.springframework.web.client.RestClientException if Slack rejects the message
     */
    public void respond(final String responseUrl, final SlackResponse response) {
        log.debug("Responding to {}", responseUrl);
        restClient.post()
                .uri(responseUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(response)
                .retrieve()
                .toBodilessEntity();
    }
}
