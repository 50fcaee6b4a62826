package com.lucidchart.imgdiff;

/** Thrown when an alignment search can not complete, because a worker failed or the search was interrupted. */
public class AlignmentSearchException extends RuntimeException {

    public AlignmentSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
