package net.findmybook.googlebooks.query;

/**
 * Content-category filter for volume searches.
 */
public enum PrintType {
    /** All content types (service default). */
    ALL("all"),
    BOOKS("books"),
    MAGAZINES("magazines");

    private final String wireValue;

    PrintType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
