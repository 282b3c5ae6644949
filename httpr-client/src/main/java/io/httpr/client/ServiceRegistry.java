package io.httpr.client;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named {@link Service} instances.
 *
 * <p>Whether the registry may be shared between threads is decided when it is created:
 * {@link #create()} is backed by a plain map for single-threaded setup code,
 * {@link #concurrent()} by a {@link ConcurrentHashMap}.
 */
public final class ServiceRegistry {

    private final Map<String, Service> services;

    private ServiceRegistry(Map<String, Service> services) {
        this.services = services;
    }

    public static ServiceRegistry create() {
        return new ServiceRegistry(new HashMap<>());
    }

    public static ServiceRegistry concurrent() {
        return new ServiceRegistry(new ConcurrentHashMap<>());
    }

    public ServiceRegistry store(String name, Service service) {
        services.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(service, "service"));
        return this;
    }

    public Optional<Service> load(String name) {
        return Optional.ofNullable(services.get(Objects.requireNonNull(name, "name")));
    }

    public boolean remove(String name) {
        return services.remove(Objects.requireNonNull(name, "name")) != null;
    }
}
