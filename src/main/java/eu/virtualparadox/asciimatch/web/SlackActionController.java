package eu.virtualparadox.asciimatch.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.asciimatch.application.config.ApplicationConfig;
import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.search.ArtSearchService;
import eu.virtualparadox.asciimatch.web.model.ActionPayload;
import eu.virtualparadox.asciimatch.web.model.SlackResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Handles the buttons of a preview message.
 * <ul>
 *   <li>{@code shuffle}: runs the query again and replaces the preview with the new pick</li>
 *   <li>{@code post_it}: posts the previewed item in channel and deletes the preview</li>
 * </ul>
 * Slack expects a quick empty acknowledgement; the actual message goes to the payload's
 * {@code response_url}, which must be an https URL on one of {@code asciimatch.slack.response-hosts}.
 */
@RestController
@RequestMapping("/ascii")
@Slf4j
@RequiredArgsConstructor
public class SlackActionController {

    private final ArtSearchService searchService;
    private final SlackResponder responder;
    private final ObjectMapper objectMapper;
    private final ApplicationConfig props;

    @PostMapping("/actions")
    public ResponseEntity<Void> action(@RequestParam("payload") final String payloadJson) {
        final ActionPayload payload = parse(payloadJson);
        if (payload.actions() == null || payload.actions().isEmpty()) {
            throw new IllegalArgumentException("payload has no actions");
        }
        if (payload.responseUrl() == null || payload.responseUrl().isBlank()) {
            throw new IllegalArgumentException("payload has no response_url");
        }
        checkResponseUrl(payload.responseUrl());

        final ActionPayload.Action action = payload.actions().get(0);
        final String value = action.value() == null ? "" : action.value();
        final SlackResponse response;
        if (SlackMessages.ACTION_SHUFFLE.equals(action.actionId())) {
            response = shuffle(value);
        } else if (SlackMessages.ACTION_POST_IT.equals(action.actionId())) {
            response = postIt(value);
        } else {
            throw new IllegalArgumentException("Unknown action: " + action.actionId());
        }

        responder.respond(payload.responseUrl(), response);
        return ResponseEntity.ok().build();
    }

    private SlackResponse shuffle(final String queryString) {
        return searchService.search(queryString)
                .map(art -> new SlackResponse(null, true, false, SlackMessages.preview(art, queryString)))
                .orElseGet(() -> new SlackResponse(null, true, false, SlackMessages.notFound()));
    }

    /**
     * @param value {@code "<id>/<query>"}
     */
    private SlackResponse postIt(final String value) {
        final int slash = value.indexOf('/');
        final String idPart = slash < 0 ? value : value.substring(0, slash);
        final int id;
        try {
            id = Integer.parseInt(idPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed post_it value: " + value, e);
        }

        final Optional<AsciiArt> art = searchService.findById(id);
        if (art.isEmpty()) {
            throw new IllegalArgumentException("No art with id " + id);
        }
        log.info("Posting art {} in channel", id);
        return new SlackResponse("in_channel", false, true, SlackMessages.art(art.get()));
    }

    private void checkResponseUrl(final String responseUrl) {
        final URI uri;
        try {
            uri = URI.create(responseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed response_url", e);
        }
        final String host = uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
        if (!"https".equalsIgnoreCase(uri.getScheme())
                || uri.getUserInfo() != null
                || host == null
                || !props.getSlack().getResponseHosts().contains(host)) {
            throw new IllegalArgumentException("response_url not allowed: " + responseUrl);
        }
    }

    private ActionPayload parse(final String json) {
        try {
            return objectMapper.readValue(json, ActionPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Slack payload", e);
        }
    }
}
