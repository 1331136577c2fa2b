package com.tonyguerra.net.pgwire.handlers;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotificationHandlerScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(NotificationHandlerScanner.class);

    private static final String DEFAULTS_PACKAGE = "com.tonyguerra.net.pgwire.standard";

    private NotificationHandlerScanner() {
    }

    private static Reflections createReflections(String basePackage) {
        return new Reflections(new ConfigurationBuilder()
                .setUrls(ClasspathHelper.forPackage(basePackage))
                .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                .addScanners(Scanners.MethodsAnnotated));
    }

    public static Map<String, HandlerDefinition> scanDefaults() {
        return scan(DEFAULTS_PACKAGE);
    }

    /**
     * Finds every {@link NotificationHandler} method declared under {@code basePackage}.
     * When two methods claim the same channel, the last one found wins.
     */
    public static Map<String, HandlerDefinition> scanUserHandlers(String basePackage) {
        if (basePackage == null || basePackage.isBlank())
            throw new IllegalArgumentException("basePackage must not be null/blank");
        if (basePackage.startsWith(DEFAULTS_PACKAGE))
            throw new IllegalArgumentException("basePackage must not be the library defaults package");

        return scan(basePackage);
    }

    private static Map<String, HandlerDefinition> scan(String basePackage) {
        final Map<String, HandlerDefinition> map = new HashMap<>();

        final Reflections reflections = createReflections(basePackage);

        for (Method method : reflections.getMethodsAnnotatedWith(NotificationHandler.class)) {
            final NotificationHandler ann = method.getAnnotation(NotificationHandler.class);
            final Class<?> owner = method.getDeclaringClass();

            final var previous = map.put(ann.channel(), new HandlerDefinition(ann.channel(), owner, method));
            if (previous != null) {
                LOGGER.warn("⚠️ Channel '{}' handled by both {}#{} and {}#{}", ann.channel(),
                        previous.ownerClass().getName(), previous.method().getName(),
                        owner.getName(), method.getName());
            }
        }

        return Map.copyOf(map);
    }
}
