package net.findmybook.googlebooks.query;

/**
 * Field-scoped search keywords understood by the Google Books {@code q} parameter.
 * Each constant owns its prefix so a new field cannot be added without its keyword.
 */
public enum VolumeQueryField {
    ISBN("isbn"),
    TITLE("intitle"),
    AUTHOR("inauthor"),
    PUBLISHER("inpublisher"),
    SUBJECT("subject"),
    LCCN("lccn"),
    OCLC("oclc");

    private final String prefix;

    VolumeQueryField(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Renders {@code <prefix>:<value>} without touching the value.
     */
    public String predicate(String value) {
        return prefix + ":" + value;
    }
}
