package org.smileyface.linkmeta.store;

/**
 * The link store could not be read or written.
 */
public class LinkStoreException extends RuntimeException {

    public LinkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
