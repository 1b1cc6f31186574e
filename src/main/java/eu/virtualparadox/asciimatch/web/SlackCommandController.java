package eu.virtualparadox.asciimatch.web;

import eu.virtualparadox.asciimatch.application.config.ApplicationConfig;
import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.search.ArtSearchService;
import eu.virtualparadox.asciimatch.web.model.SlackResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Slack slash command endpoint.
 * <p>
 * {@code POST /ascii} with the form field {@code text} answers with one matching piece of art, posted
 * in channel, or with an ephemeral preview carrying buttons when {@code asciimatch.slack.preview} is on.
 * When nothing matches a fixed hint is returned instead.
 */
@RestController
@RequestMapping("/ascii")
@Slf4j
@RequiredArgsConstructor
public class SlackCommandController {

    private final ArtSearchService searchService;
    private final ApplicationConfig props;

    @PostMapping
    public SlackResponse ascii(@RequestParam(name = "text", defaultValue = "") final String text) {
        final Optional<AsciiArt> art = searchService.search(text);
        if (art.isEmpty()) {
            log.info("No match for '{}'", text);
            return SlackResponse.ephemeral(SlackMessages.notFound());
        }
        return render(art.get(), text);
    }

    /**
     * Any item, regardless of query.
     */
    @GetMapping("/random")
    public SlackResponse random() {
        return searchService.random()
                .map(art -> render(art, ""))
                .orElseGet(() -> SlackResponse.ephemeral(SlackMessages.notFound()));
    }

    private SlackResponse render(final AsciiArt art, final String text) {
        if (props.getSlack().isPreview()) {
            return SlackResponse.ephemeral(SlackMessages.preview(art, text));
        }
        return SlackResponse.inChannel(SlackMessages.art(art));
    }
}
