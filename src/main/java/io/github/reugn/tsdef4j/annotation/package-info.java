/**
 * Annotations that declare TypeScript types for Java types.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.tsdef4j.annotation.TypeScript} - Declare a TypeScript type for a record, class, enum or sealed type</li>
 *   <li>{@link io.github.reugn.tsdef4j.annotation.TsField} - Customize a record component or field</li>
 *   <li>{@link io.github.reugn.tsdef4j.annotation.TsVariant} - Customize a variant of a sealed type or enum</li>
 * </ul>
 * <p>
 * All annotations are processed by {@link io.github.reugn.tsdef4j.processor.TypeScriptProcessor},
 * which writes the TypeScript output and a {@code TsDefinitions} provider class per package.
 *
 * @see io.github.reugn.tsdef4j.processor.TypeScriptProcessor
 */
package io.github.reugn.tsdef4j.annotation;
