package io.github.reugn.tsdef4j.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The process-wide, append-only list of {@link TypeDefinitionProvider}s.
 *
 * <p>Providers add themselves from initialization code (the generated
 * {@code TsDefinitions.register()}), or are discovered through {@link ServiceLoader}. The list
 * is read once, when output is assembled, by {@link #toRegistry()}.
 *
 * <p>Registration is thread-safe. Registering the same provider instance twice is a no-op.
 */
public final class TypeRegistrations {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistrations.class);

    private static final CopyOnWriteArrayList<TypeDefinitionProvider> PROVIDERS = new CopyOnWriteArrayList<>();

    private TypeRegistrations() {
    }

    /**
     * Appends a provider.
     *
     * @param provider the provider
     * @return {@code true} if the provider was added, {@code false} if it was already present
     */
    public static boolean register(TypeDefinitionProvider provider) {
        boolean added = PROVIDERS.addIfAbsent(provider);
        if (added) {
            log.debug("Registered type definition provider {}", provider.getClass().getName());
        }
        return added;
    }

    /**
     * Appends every provider discovered by {@link ServiceLoader} on the given class loader whose
     * class is not registered yet.
     *
     * @param classLoader the class loader to search
     * @return the number of providers added
     */
    public static int discover(ClassLoader classLoader) {
        int added = 0;
        for (TypeDefinitionProvider provider : ServiceLoader.load(TypeDefinitionProvider.class, classLoader)) {
            boolean known = PROVIDERS.stream().anyMatch(p -> p.getClass().equals(provider.getClass()));
            if (!known && register(provider)) {
                added++;
            }
        }
        log.debug("Discovered {} type definition provider(s)", added);
        return added;
    }

    /**
     * Returns a snapshot of the registered providers in registration order.
     */
    public static List<TypeDefinitionProvider> providers() {
        return List.copyOf(PROVIDERS);
    }

    /**
     * Builds a fresh registry from every registered provider, in registration order.
     */
    public static TypeRegistry toRegistry() {
        TypeRegistry registry = new TypeRegistry();
        for (TypeDefinitionProvider provider : PROVIDERS) {
            registry.addAll(provider.typeDefinitions());
        }
        return registry;
    }
}
