package de.mirkosertic.mcp.travelserver.catalog;

/**
 * Thrown when the catalog document does not have the expected structure,
 * or when a destination record lacks a required field.
 */
public class CatalogFormatException extends RuntimeException {

    public CatalogFormatException(final String message) {
        super(message);
    }

    public CatalogFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
