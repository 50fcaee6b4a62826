package com.lucidchart.imgdiff;

/** Scala-like argument checks. */
final class Require {

    private Require() {}

    static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
