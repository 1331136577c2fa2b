package com.tonyguerra.net.pgwire.configurations;

public final class Globals {
    private static volatile int defaultCopyBufferSize = 8192;
    private static volatile String defaultApplicationName = "pg-wire";

    private Globals() {
    }

    public static int getDefaultCopyBufferSize() {
        return defaultCopyBufferSize;
    }

    public static void setDefaultCopyBufferSize(int size) {
        if (size <= 0)
            throw new IllegalArgumentException("size must be > 0");
        defaultCopyBufferSize = size;
    }

    public static String getDefaultApplicationName() {
        return defaultApplicationName;
    }

    public static void setDefaultApplicationName(String name) {
        defaultApplicationName = name;
    }
}
