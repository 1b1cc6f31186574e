package eu.virtualparadox.asciimatch.web;

import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.web.model.SlackBlock;
import eu.virtualparadox.asciimatch.web.model.SlackElement;
import eu.virtualparadox.asciimatch.web.model.SlackText;

import java.util.List;

/**
 * Renders art and fixed messages as Slack blocks.
 */
public final class SlackMessages {

    public static final String NOT_FOUND =
            "couldnt find anything.... try something else or help me to add more ascii art";

    public static final String ACTION_POST_IT = "post_it";
    public static final String ACTION_SHUFFLE = "shuffle";

    /** Slack rejects a message whose button {@code value} is longer than this. */
    static final int MAX_BUTTON_VALUE = 2000;

    private static final String ACTIONS_BLOCK_ID = "art_actions";

    private SlackMessages() {
        // prevent instantiation
    }

    /**
     * The art inside a code fence, leading and trailing newlines removed.
     */
    public static List<SlackBlock> art(final AsciiArt art) {
        return List.of(codeBlock(trimNewlines(art.blob())));
    }

    /**
     * The art followed by "Post it!" and "Shuffle!" buttons.
     *
     * @param art         the previewed item
     * @param queryString the query that produced it, carried in the button values and cut to fit
     */
    public static List<SlackBlock> preview(final AsciiArt art, final String queryString) {
        final String idPrefix = art.id() + "/";
        return List.of(
                codeBlock(trimNewlines(art.blob())),
                SlackBlock.actions(ACTIONS_BLOCK_ID, List.of(
                        SlackElement.button("Post it!", "primary", ACTION_POST_IT,
                                idPrefix + truncate(queryString, MAX_BUTTON_VALUE - idPrefix.length())),
                        SlackElement.button("Shuffle!", null, ACTION_SHUFFLE,
                                truncate(queryString, MAX_BUTTON_VALUE)))));
    }

    public static List<SlackBlock> notFound() {
        return List.of(codeBlock(NOT_FOUND));
    }

    private static SlackBlock codeBlock(final String body) {
        return SlackBlock.section(SlackText.markdown("```\n" + body + "\n```"));
    }

    /**
     * Cuts {@code s} to at most {@code max} chars without splitting a surrogate pair.
     */
    static String truncate(final String s, final int max) {
        if (s.length() <= max) {
            return s;
        }
        int end = max;
        if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    static String trimNewlines(final String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '\n') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '\n') {
            end--;
        }
        return s.substring(start, end);
    }
}
