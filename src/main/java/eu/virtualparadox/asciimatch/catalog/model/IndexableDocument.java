package eu.virtualparadox.asciimatch.catalog.model;

import java.util.List;
import java.util.Map;

/**
 * A corpus item that exposes its field values for indexing.
 * <p>Identifiers are assigned sequentially from {@code 0} when the corpus is loaded and are never reused.</p>
 */
public interface IndexableDocument {

    int id();

    /**
     * @return field name to the ordered raw values of that field; never {@code null}
     */
    Map<String, List<String>> indexableFields();

}
