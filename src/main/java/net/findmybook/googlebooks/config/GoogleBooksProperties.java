package net.findmybook.googlebooks.config;

import net.findmybook.googlebooks.query.VolumeUrlBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the Google Books client, bound from {@code google.books.api.*}.
 */
@ConfigurationProperties(prefix = "google.books.api")
public class GoogleBooksProperties {

    private String baseUrl = VolumeUrlBuilder.DEFAULT_BASE_URL;
    private String key;
    private int connectTimeout = 5000;
    private int readTimeout = 5000;
    private int maxInMemorySize = 16 * 1024 * 1024;
    private String userAgent = "findmybook-google-books-client";

    /**
     * Service root, without the {@code /books/v1} path.
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Optional API key sent as the {@code key} query parameter.
     */
    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    /**
     * Connect timeout in milliseconds.
     */
    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    /**
     * Read and response timeout in milliseconds.
     */
    public int getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    /**
     * Largest response body buffered in memory, in bytes.
     */
    public int getMaxInMemorySize() {
        return maxInMemorySize;
    }

    public void setMaxInMemorySize(int maxInMemorySize) {
        this.maxInMemorySize = maxInMemorySize;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
