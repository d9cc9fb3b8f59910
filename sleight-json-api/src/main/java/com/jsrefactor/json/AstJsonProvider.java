package com.jsrefactor.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for the AST and the refactoring configuration.
 * Implementations are discovered with {@link ServiceLoader}.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(Parser.parse(code));
 * RefactoringConfig config = provider.getConfigReader().read(settings);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    RefactoringConfigReader getConfigReader();

    /**
     * @return a short name such as "Jackson", matched case-insensitively by {@link #getProvider(String)}
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add sleight-jackson (or another provider) to your dependencies."
        );
    }

    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
