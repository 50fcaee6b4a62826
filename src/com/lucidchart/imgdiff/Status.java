package com.lucidchart.imgdiff;

/** Possible outcomes of an image diff */
public enum Status {

    PASSED ("Passed", 0),
    FAILED ("Failed", 1);

    public final String text;

    /** Process exit status reported by the command line tool when asked to fail on differences */
    public final int exitCode;

    Status(String text, int exitCode) {
        this.text = text;
        this.exitCode = exitCode;
    }
}
