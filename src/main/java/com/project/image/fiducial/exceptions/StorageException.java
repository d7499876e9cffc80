package com.project.image.fiducial.exceptions;

/** Failure to store an upload or a result image. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
