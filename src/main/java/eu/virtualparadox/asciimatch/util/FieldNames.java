package eu.virtualparadox.asciimatch.util;

public class FieldNames {
    public static final String BLOB = "blob";
    public static final String TAGS = "tags";
    public static final String MATCH_ALL = "match_all";
    public static final String MATCH_ALL_VALUE = "true";

    private FieldNames() {
        // prevent instantiation
    }
}
