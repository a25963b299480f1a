package org.frugal.ls.api;

/**
 * Thrown when a rename request cannot be carried out, e.g. because the new name is
 * not a valid identifier, the symbol is a builtin, or nothing renameable is found at
 * the requested position. The message is meant to be shown to the user as is.
 */
public class RenameException extends Exception {

    /**
     * Constructs a new rename exception with the specified detail message.
     * @param message The detail message.
     */
    public RenameException(String message) {
        super(message, null);
    }
}
