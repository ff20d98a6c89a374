package io.github.reugn.tsdef4j.registry;

import io.github.reugn.tsdef4j.ir.TypeDef;

import java.util.List;

/**
 * A source of type declarations, typically a generated {@code TsDefinitions} class.
 *
 * <p>Implementations are registered with {@link TypeRegistrations#register(TypeDefinitionProvider)}
 * or listed in {@code META-INF/services/io.github.reugn.tsdef4j.registry.TypeDefinitionProvider}.
 */
@FunctionalInterface
public interface TypeDefinitionProvider {

    /**
     * Returns the root types this provider contributes, in declaration order.
     */
    List<TypeDef> typeDefinitions();
}
