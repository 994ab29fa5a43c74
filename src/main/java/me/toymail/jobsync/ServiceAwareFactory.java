package me.toymail.jobsync;

import me.toymail.jobsync.service.ServiceContext;
import picocli.CommandLine;

import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picocli factory for the jobsync commands. A class with a one-argument constructor accepting
 * the {@link ServiceContext} gets the shared context; mixins, converters and anything else go
 * to picocli's default factory.
 */
public final class ServiceAwareFactory implements CommandLine.IFactory {
    private final ServiceContext context;
    private final CommandLine.IFactory fallback = CommandLine.defaultFactory();
    private final Map<Class<?>, Optional<Constructor<?>>> constructors = new ConcurrentHashMap<>();

    public ServiceAwareFactory(ServiceContext context) {
        this.context = context;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        Optional<Constructor<?>> ctor = constructors.computeIfAbsent(cls, ServiceAwareFactory::contextConstructor);
        if (ctor.isEmpty()) return fallback.create(cls);
        return cls.cast(ctor.get().newInstance(context));
    }

    private static Optional<Constructor<?>> contextConstructor(Class<?> cls) {
        for (Constructor<?> c : cls.getDeclaredConstructors()) {
            Class<?>[] params = c.getParameterTypes();
            if (params.length == 1 && params[0].isAssignableFrom(ServiceContext.class)) {
                c.setAccessible(true);
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
