package com.doctrace.core.asset;

/**
 * Thrown when the docs root cannot be walked or a documentation file cannot be read.
 */
public class AssetCollectionException extends RuntimeException {

    public AssetCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
