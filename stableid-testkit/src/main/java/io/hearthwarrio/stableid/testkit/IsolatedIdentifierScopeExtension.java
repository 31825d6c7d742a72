package io.hearthwarrio.stableid.testkit;

import io.hearthwarrio.stableid.core.ConfigStore;
import io.hearthwarrio.stableid.core.IdentifierConfig;
import io.hearthwarrio.stableid.core.IdentifierScope;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * Gives every test case its own identifier configuration and run state.
 * <p>
 * Before each test a fresh {@link IdentifierConfig#forTesting()} is installed as the scoped override of
 * {@link ConfigStore#global()} on the test thread, and a new {@link IdentifierScope} is created on top of it.
 * Both can be injected as test method parameters. After the test the override is removed, so tests running
 * in parallel on different threads never see each other's configuration.
 * <pre>{@code
 * @ExtendWith(IsolatedIdentifierScopeExtension.class)
 * class CheckoutTest {
 *     @Test
 *     void ids(IdentifierScope scope) { ... }
 * }
 * }</pre>
 */
public final class IsolatedIdentifierScopeExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(IsolatedIdentifierScopeExtension.class);

    private static final String SCOPE_KEY = "scope";
    private static final String OVERRIDE_KEY = "override";

    @Override
    public void beforeEach(ExtensionContext context) {
        IdentifierConfig config = IdentifierConfig.forTesting();
        ConfigStore.Scope override = ConfigStore.global().install(config);

        ExtensionContext.Store store = context.getStore(NAMESPACE);
        store.put(OVERRIDE_KEY, override);
        store.put(SCOPE_KEY, new IdentifierScope(ConfigStore.global()));
    }

    @Override
    public void afterEach(ExtensionContext context) {
        ExtensionContext.Store store = context.getStore(NAMESPACE);
        ConfigStore.Scope override = store.remove(OVERRIDE_KEY, ConfigStore.Scope.class);
        store.remove(SCOPE_KEY, IdentifierScope.class);
        if (override != null) {
            override.close();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return type == IdentifierScope.class || type == IdentifierConfig.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        IdentifierScope scope = scope(extensionContext);
        Class<?> type = parameterContext.getParameter().getType();
        return type == IdentifierConfig.class ? scope.config() : scope;
    }

    /**
     * Scope of the currently running test.
     */
    public static IdentifierScope scope(ExtensionContext context) {
        IdentifierScope scope = context.getStore(NAMESPACE).get(SCOPE_KEY, IdentifierScope.class);
        if (scope == null) {
            throw new ParameterResolutionException(
                    "No identifier scope for " + context.getDisplayName() + "; parameters resolve only in test methods"
            );
        }
        return scope;
    }
}
