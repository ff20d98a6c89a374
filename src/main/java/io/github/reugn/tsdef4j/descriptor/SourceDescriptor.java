package io.github.reugn.tsdef4j.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes one declared source type: its name, namespace, kind, generic parameters, members
 * and conversion attributes.
 *
 * <p>Descriptors are produced by a reflection adapter (the annotation processor) or built by
 * hand through {@link #builder(String, DescriptorKind)}. They carry no behavior; the converter
 * interprets them.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SourceDescriptor user = SourceDescriptor.builder("User", DescriptorKind.RECORD)
 *         .member(MemberDescriptor.named("user_id", MemberType.of(TypeDef.string())))
 *         .attributes(ContainerAttributes.builder().renameAll("camelCase").build())
 *         .build();
 * }</pre>
 *
 * @param name         the source type name
 * @param namespace    the TypeScript namespace path; empty for top-level declarations
 * @param originModule the module the type was declared in, or {@code null}
 * @param kind         the declaration kind
 * @param typeParams   generic parameter names
 * @param members      members of a record or the single member of an alias
 * @param variants     variants of a variant set
 * @param attributes   container-level conversion attributes
 */
public record SourceDescriptor(String name, List<String> namespace, String originModule, DescriptorKind kind,
                               List<String> typeParams, List<MemberDescriptor> members,
                               List<VariantDescriptor> variants, ContainerAttributes attributes) {

    public SourceDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        namespace = List.copyOf(namespace);
        typeParams = List.copyOf(typeParams);
        members = List.copyOf(members);
        variants = List.copyOf(variants);
        attributes = attributes == null ? ContainerAttributes.none() : attributes;
    }

    public static Builder builder(String name, DescriptorKind kind) {
        return new Builder(name, kind);
    }

    /**
     * Fluent builder for {@link SourceDescriptor}.
     */
    public static final class Builder {
        private final String name;
        private final DescriptorKind kind;
        private List<String> namespace = List.of();
        private String originModule;
        private final List<String> typeParams = new ArrayList<>();
        private final List<MemberDescriptor> members = new ArrayList<>();
        private final List<VariantDescriptor> variants = new ArrayList<>();
        private ContainerAttributes attributes = ContainerAttributes.none();

        private Builder(String name, DescriptorKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder namespace(List<String> path) {
            this.namespace = path;
            return this;
        }

        public Builder originModule(String module) {
            this.originModule = module;
            return this;
        }

        public Builder typeParam(String param) {
            this.typeParams.add(param);
            return this;
        }

        public Builder typeParams(List<String> params) {
            this.typeParams.addAll(params);
            return this;
        }

        public Builder member(MemberDescriptor member) {
            this.members.add(member);
            return this;
        }

        public Builder members(List<MemberDescriptor> list) {
            this.members.addAll(list);
            return this;
        }

        public Builder variant(VariantDescriptor variant) {
            this.variants.add(variant);
            return this;
        }

        public Builder variants(List<VariantDescriptor> list) {
            this.variants.addAll(list);
            return this;
        }

        public Builder attributes(ContainerAttributes containerAttributes) {
            this.attributes = containerAttributes;
            return this;
        }

        public SourceDescriptor build() {
            return new SourceDescriptor(name, namespace, originModule, kind, typeParams, members, variants,
                    attributes);
        }
    }
}
