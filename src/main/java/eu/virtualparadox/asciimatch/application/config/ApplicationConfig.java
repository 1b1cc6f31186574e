package eu.virtualparadox.asciimatch.application.config;

import eu.virtualparadox.asciimatch.select.SelectionMode;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "asciimatch")
@Getter @Setter
public class ApplicationConfig {

    /** Directory walked for corpus files. */
    private Path root = Path.of("./art");

    /** Files larger than this many bytes are skipped. */
    private int maxBlobBytes = 3500;

    private String fileSuffix = ".txt";

    /** DisMax tie breaker between the tags and blob fields, in [0, 1]. */
    private float tieBreaker = 0.1f;

    private int shingleWidth = 2;

    /** Literal replacements applied during normalization, before non-alphanumerics are dropped. */
    private Map<String, String> substitutions = new LinkedHashMap<>(Map.of("#", " "));

    private SelectionMode selectionMode = SelectionMode.RANDOM;

    /** Threads used to analyze the corpus; {@code 0} means one per available processor. */
    private int indexThreads = 0;

    private Slack slack = new Slack();

    @Getter @Setter
    public static class Slack {
        /** Answer slash commands ephemerally with "Post it!" and "Shuffle!" buttons. */
        private boolean preview = false;

        /** Hosts that interaction {@code response_url}s may point to; only https is accepted. */
        private List<String> responseHosts = new ArrayList<>(List.of("hooks.slack.com"));
    }

    @PostConstruct
    public void validate() {
        if (root == null) {
            throw new IllegalArgumentException("asciimatch.root must be set");
        }
        if (maxBlobBytes <= 0) {
            throw new IllegalArgumentException("asciimatch.max-blob-bytes must be positive");
        }
        if (Float.isNaN(tieBreaker) || tieBreaker < 0f || tieBreaker > 1f) {
            throw new IllegalArgumentException("asciimatch.tie-breaker must be in [0, 1], got " + tieBreaker);
        }
        if (shingleWidth < 1) {
            throw new IllegalArgumentException("asciimatch.shingle-width must be >= 1, got " + shingleWidth);
        }
        if (selectionMode == null) {
            throw new IllegalArgumentException("asciimatch.selection-mode must be set");
        }
        if (slack == null) {
            slack = new Slack();
        }
        if (slack.getResponseHosts() == null || slack.getResponseHosts().isEmpty()) {
            throw new IllegalArgumentException("asciimatch.slack.response-hosts must not be empty");
        }
        if (indexThreads < 0) {
            throw new IllegalArgumentException("asciimatch.index-threads must be >= 0");
        }
    }

    public int effectiveIndexThreads() {
        return indexThreads == 0 ? Runtime.getRuntime().availableProcessors() : indexThreads;
    }
}
