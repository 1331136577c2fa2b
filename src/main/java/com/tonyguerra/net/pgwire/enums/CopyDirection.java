package com.tonyguerra.net.pgwire.enums;

public enum CopyDirection {
    /** COPY ... FROM STDIN */
    IN,

    /** COPY ... TO STDOUT */
    OUT;
}
