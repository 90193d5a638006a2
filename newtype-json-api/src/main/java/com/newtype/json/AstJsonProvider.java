package com.newtype.json;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * A JSON binding for the Newtype AST, discovered with {@link ServiceLoader}.
 *
 * <p>Putting {@code newtype-jackson} on the classpath registers the Jackson binding:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program parsed = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /** Short name used to select this provider, e.g. "Jackson". */
    String getName();

    /** Every provider registered on the classpath, in discovery order. */
    static List<AstJsonProvider> providers() {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .collect(Collectors.toList());
    }

    /**
     * @throws AstJsonException if no provider is registered
     */
    static AstJsonProvider getProvider() {
        List<AstJsonProvider> found = providers();
        if (found.isEmpty()) {
            throw new AstJsonException("No AstJsonProvider on the classpath; add newtype-jackson to the dependencies");
        }
        return found.get(0);
    }

    /**
     * Looks a provider up by {@link #getName()}, ignoring case.
     *
     * @throws AstJsonException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : providers()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new AstJsonException("No AstJsonProvider named '" + name + "'");
    }
}
