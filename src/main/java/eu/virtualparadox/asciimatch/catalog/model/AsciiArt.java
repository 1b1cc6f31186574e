package eu.virtualparadox.asciimatch.catalog.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static eu.virtualparadox.asciimatch.util.FieldNames.*;

/**
 * One piece of ASCII art loaded from the corpus directory.
 *
 * @param id   sequential identifier, 0-based
 * @param blob raw file contents
 * @param tags short labels, currently the file name
 */
public record AsciiArt(int id, String blob, List<String> tags) implements IndexableDocument {

    public AsciiArt {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got " + id);
        }
        Objects.requireNonNull(blob, "blob");
        tags = List.copyOf(Objects.requireNonNull(tags, "tags"));
    }

    @Override
    public Map<String, List<String>> indexableFields() {
        return Map.of(
                BLOB, List.of(blob),
                TAGS, tags,
                MATCH_ALL, List.of(MATCH_ALL_VALUE));
    }
}
