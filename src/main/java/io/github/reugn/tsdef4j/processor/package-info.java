/**
 * Annotation processor implementation for tsdef4j.
 * <p>
 * This package contains the compile-time processor that converts
 * {@link io.github.reugn.tsdef4j.annotation.TypeScript} types to TypeScript declarations.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * TypeScriptProcessor (entry point)
 *     ├── MirrorTypeResolver ── DescriptorReader
 *     │         └── TypeConverter (convert package)
 *     ├── TypeScriptGenerator (render package)
 *     └── DefinitionsClassGenerator ── TypeDefCodeEmitter
 *
 * Support utilities:
 *     ├── ProcessorOptions - -A option parsing
 *     ├── MirrorMemberType - Type mirror wrapper
 *     └── ErrorReporter    - Error reporting interface
 * </pre>
 *
 * <p><b>Components:</b>
 * <ul>
 *   <li><b>TypeScriptProcessor</b> - Main annotation processor entry point</li>
 *   <li><b>DescriptorReader</b> - Reads annotated elements into source descriptors</li>
 *   <li><b>MirrorTypeResolver</b> - Maps Java types to the type IR</li>
 *   <li><b>DefinitionsClassGenerator</b> - Generates the per-package provider classes</li>
 *   <li><b>TypeDefCodeEmitter</b> - Emits Java expressions that rebuild IR trees</li>
 * </ul>
 *
 * @see io.github.reugn.tsdef4j.annotation
 */
package io.github.reugn.tsdef4j.processor;
