package dev.fumaz.locator.module;

import org.jetbrains.annotations.NotNull;

/**
 * Declares the bindings of a {@link Module}.
 * <p>
 * A declaration is replayed every time a module that includes it is built, so it should
 * only register bindings and must not keep state of its own.
 */
@FunctionalInterface
public interface ModuleDeclaration {

    void declare(@NotNull ModuleBuilder builder);

}
