package eu.virtualparadox.asciimatch.index.model;

/**
 * @param docId     identifier of the document containing the term
 * @param frequency number of times the term occurs in the field of that document ({@code >= 1})
 */
public record Posting(int docId, int frequency) {

}
