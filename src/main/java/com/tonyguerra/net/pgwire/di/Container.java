package com.tonyguerra.net.pgwire.di;

import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates notification handler owners, resolving their dependencies from registered
 * instances (the owning {@code Connector} is always registered).
 */
public final class Container {
    private final Map<Class<?>, Object> singletons;

    public Container() {
        singletons = new ConcurrentHashMap<>();
    }

    public <T> void registerInstance(Class<T> type, T instance) {
        Objects.requireNonNull(type);
        Objects.requireNonNull(instance);
        singletons.put(type, instance);
    }

    public <T> T get(Class<T> type) {
        Objects.requireNonNull(type);

        final var existing = singletons.get(type);
        if (existing != null) {
            return type.cast(existing);
        }

        final var created = create(type);

        if (type.isAnnotationPresent(Singleton.class)) {
            final var raced = singletons.putIfAbsent(type, created);
            if (raced != null) {
                return type.cast(raced);
            }
        }

        return created;
    }

    private <T> T create(Class<T> type) {
        try {
            final Constructor<T> ctor = pickConstructor(type);
            final var paramTypes = ctor.getParameterTypes();
            final var args = new Object[paramTypes.length];

            for (int i = 0; i < paramTypes.length; i++) {
                args[i] = get(paramTypes[i]);
            }

            ctor.setAccessible(true);
            final var instance = ctor.newInstance(args);

            injectFields(instance);
            return instance;
        } catch (ReflectiveOperationException | RuntimeException ex) {
            throw new IllegalStateException("Failed to create handler owner: " + type.getName(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Constructor<T> pickConstructor(Class<T> type) throws NoSuchMethodException {
        for (final var c : type.getDeclaredConstructors()) {
            if (c.isAnnotationPresent(Inject.class)) {
                return (Constructor<T>) c;
            }
        }

        return type.getDeclaredConstructor();
    }

    private void injectFields(Object instance) throws IllegalAccessException {
        var t = instance.getClass();
        while (t != null && t != Object.class) {
            for (final var f : t.getDeclaredFields()) {
                if (!f.isAnnotationPresent(Inject.class)) {
                    continue;
                }
                f.setAccessible(true);
                f.set(instance, get(f.getType()));
            }

            t = t.getSuperclass();
        }
    }
}
