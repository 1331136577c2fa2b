package com.tonyguerra.net.pgwire.handlers;

import java.lang.reflect.Method;

public record HandlerDefinition(
        String channel,
        Class<?> ownerClass,
        Method method) {
}
