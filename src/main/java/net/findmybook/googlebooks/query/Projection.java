package net.findmybook.googlebooks.query;

/**
 * Amount of volume metadata requested from Google Books.
 */
public enum Projection {
    /** All volume metadata (service default). */
    FULL("full"),
    /** Essential metadata and access information only. */
    LITE("lite");

    private final String wireValue;

    Projection(String wireValue) {
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
