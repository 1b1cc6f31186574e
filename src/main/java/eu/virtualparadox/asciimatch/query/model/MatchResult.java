package eu.virtualparadox.asciimatch.query.model;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;

/**
 * A single match streamed out of query evaluation. Only valid for the duration of that query.
 *
 * @param docId    document identifier
 * @param score    relevance score of the document under the evaluated query
 * @param document the matched document, referenced from the index
 */
public record MatchResult(int docId, float score, IndexableDocument document) {

}
