package com.example.AssessRec.exception;

/**
 * Raised when the catalog index is queried before it has been built.
 */
public class CatalogIndexNotBuiltException extends AssessRecException {

    public CatalogIndexNotBuiltException(String indexName) {
        super("Catalog index '" + indexName + "' has not been built. Build the catalog index first.");
    }
}
