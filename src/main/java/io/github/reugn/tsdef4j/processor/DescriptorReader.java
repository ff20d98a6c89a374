package io.github.reugn.tsdef4j.processor;

import io.github.reugn.tsdef4j.annotation.TsField;
import io.github.reugn.tsdef4j.annotation.TsVariant;
import io.github.reugn.tsdef4j.annotation.TypeScript;
import io.github.reugn.tsdef4j.convert.ConversionException;
import io.github.reugn.tsdef4j.descriptor.ContainerAttributes;
import io.github.reugn.tsdef4j.descriptor.DescriptorKind;
import io.github.reugn.tsdef4j.descriptor.FieldAttributes;
import io.github.reugn.tsdef4j.descriptor.MemberDescriptor;
import io.github.reugn.tsdef4j.descriptor.SourceDescriptor;
import io.github.reugn.tsdef4j.descriptor.VariantAttributes;
import io.github.reugn.tsdef4j.descriptor.VariantDescriptor;
import io.github.reugn.tsdef4j.descriptor.VariantShape;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.TypeParameterElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads annotated type elements into {@link SourceDescriptor}s.
 *
 * <p><b>Element Kinds:</b>
 * <table border="1">
 *   <caption>How Java declarations are described</caption>
 *   <tr><th>Kind</th><th>Descriptor</th></tr>
 *   <tr><td>record</td><td>RECORD, one member per component</td></tr>
 *   <tr><td>class</td><td>RECORD, one member per instance field</td></tr>
 *   <tr><td>enum</td><td>VARIANT_SET of unit variants</td></tr>
 *   <tr><td>sealed interface / sealed abstract class</td><td>VARIANT_SET over the permitted
 *       subclasses</td></tr>
 * </table>
 *
 * <p>A permitted subclass is a RECORD variant if it has components (or instance fields), a
 * TUPLE variant if it is also annotated {@code @TsVariant(tuple = true)}, and a UNIT variant
 * otherwise.
 */
final class DescriptorReader {

    private final Elements elementUtils;

    DescriptorReader(Elements elementUtils) {
        this.elementUtils = elementUtils;
    }

    /**
     * Describes an annotated type.
     *
     * @throws ConversionException with {@code UNSUPPORTED_TARGET} for non-sealed interfaces,
     *                             annotation types and other unsupported declarations
     */
    SourceDescriptor read(TypeElement element) {
        TypeScript annotation = element.getAnnotation(TypeScript.class);
        DescriptorKind kind = kindOf(element);
        SourceDescriptor.Builder builder = SourceDescriptor.builder(element.getSimpleName().toString(), kind)
                .namespace(namespace(annotation))
                .originModule(module(element, annotation))
                .attributes(containerAttributes(annotation));
        for (TypeParameterElement param : element.getTypeParameters()) {
            builder.typeParam(param.getSimpleName().toString());
        }

        if (kind == DescriptorKind.RECORD) {
            builder.members(namedMembers(element));
        } else {
            builder.variants(element.getKind() == ElementKind.ENUM ? enumVariants(element) : sealedVariants(element));
        }
        return builder.build();
    }

    /**
     * Returns the qualified TypeScript name an annotated type is declared under.
     */
    String declaredName(TypeElement element) {
        TypeScript annotation = element.getAnnotation(TypeScript.class);
        String name = annotation != null && !annotation.rename().isEmpty()
                ? annotation.rename()
                : element.getSimpleName().toString();
        List<String> namespace = namespace(annotation);
        return namespace.isEmpty() ? name : String.join(".", namespace) + "." + name;
    }

    // ==================== KINDS ====================

    private DescriptorKind kindOf(TypeElement element) {
        switch (element.getKind()) {
            case RECORD:
                return DescriptorKind.RECORD;
            case ENUM:
                return DescriptorKind.VARIANT_SET;
            case CLASS:
                return isSealed(element) ? DescriptorKind.VARIANT_SET : DescriptorKind.RECORD;
            case INTERFACE:
                if (isSealed(element)) {
                    return DescriptorKind.VARIANT_SET;
                }
                throw new ConversionException(ConversionException.ErrorKind.UNSUPPORTED_TARGET,
                        "interface '" + element.getSimpleName() + "' must be sealed");
            default:
                throw new ConversionException(ConversionException.ErrorKind.UNSUPPORTED_TARGET,
                        element.getKind().toString().toLowerCase(Locale.ROOT) + " '" + element.getSimpleName()
                                + "' cannot be converted; use a record, class, enum or sealed type");
        }
    }

    private static boolean isSealed(TypeElement element) {
        return element.getModifiers().contains(Modifier.SEALED);
    }

    // ==================== MEMBERS ====================

    private List<MemberDescriptor> namedMembers(TypeElement element) {
        List<MemberDescriptor> members = new ArrayList<>();
        if (element.getKind() == ElementKind.RECORD) {
            for (RecordComponentElement component : element.getRecordComponents()) {
                members.add(member(component, component.asType()));
            }
            return members;
        }
        for (Element enclosed : element.getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.FIELD && !enclosed.getModifiers().contains(Modifier.STATIC)) {
                members.add(member(enclosed, enclosed.asType()));
            }
        }
        return members;
    }

    private MemberDescriptor member(Element element, TypeMirror type) {
        return MemberDescriptor.named(element.getSimpleName().toString(), new MirrorMemberType(type),
                fieldAttributes(element.getAnnotation(TsField.class)));
    }

    private List<VariantDescriptor> enumVariants(TypeElement element) {
        List<VariantDescriptor> variants = new ArrayList<>();
        for (Element enclosed : element.getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.ENUM_CONSTANT) {
                variants.add(VariantDescriptor.unit(enclosed.getSimpleName().toString())
                        .withAttributes(variantAttributes(enclosed.getAnnotation(TsVariant.class))));
            }
        }
        return variants;
    }

    private List<VariantDescriptor> sealedVariants(TypeElement element) {
        List<VariantDescriptor> variants = new ArrayList<>();
        for (TypeMirror permitted : element.getPermittedSubclasses()) {
            if (permitted.getKind() != TypeKind.DECLARED) {
                continue;
            }
            TypeElement subclass = (TypeElement) ((DeclaredType) permitted).asElement();
            TsVariant annotation = subclass.getAnnotation(TsVariant.class);
            String name = subclass.getSimpleName().toString();
            List<MemberDescriptor> members = subclass.getKind() == ElementKind.RECORD
                    || subclass.getKind() == ElementKind.CLASS
                    ? namedMembers(subclass)
                    : List.of();

            VariantShape shape;
            if (members.isEmpty()) {
                shape = VariantShape.UNIT;
            } else if (annotation != null && annotation.tuple()) {
                shape = VariantShape.TUPLE;
                members = members.stream()
                        .map(m -> new MemberDescriptor(null, m.type(), m.attributes()))
                        .toList();
            } else {
                shape = VariantShape.RECORD;
            }
            variants.add(new VariantDescriptor(name, shape, members, variantAttributes(annotation)));
        }
        return variants;
    }

    // ==================== ATTRIBUTES ====================

    private static List<String> namespace(TypeScript annotation) {
        if (annotation == null || annotation.namespace().isEmpty()) {
            return List.of();
        }
        return Arrays.stream(annotation.namespace().split("\\."))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    private String module(TypeElement element, TypeScript annotation) {
        if (annotation != null && !annotation.module().isEmpty()) {
            return annotation.module();
        }
        PackageElement pkg = elementUtils.getPackageOf(element);
        return pkg.isUnnamed() ? null : pkg.getQualifiedName().toString();
    }

    private static ContainerAttributes containerAttributes(TypeScript annotation) {
        if (annotation == null) {
            return ContainerAttributes.none();
        }
        return ContainerAttributes.builder()
                .rename(annotation.rename())
                .renameAll(annotation.renameAll())
                .tag(annotation.tag())
                .content(annotation.content())
                .untagged(annotation.untagged())
                .transparent(annotation.transparent())
                .wrapper(annotation.wrapper())
                .extendsTypes(List.of(annotation.extendsTypes()))
                .build();
    }

    private static FieldAttributes fieldAttributes(TsField annotation) {
        if (annotation == null) {
            return FieldAttributes.none();
        }
        return FieldAttributes.builder()
                .rename(annotation.rename())
                .skip(annotation.skip())
                .flatten(annotation.flatten())
                .optional(annotation.optional())
                .defaulted(annotation.defaulted())
                .inline(annotation.inline())
                .typeOverride(annotation.type())
                .index(annotation.index())
                .key(annotation.key())
                .pattern(annotation.pattern())
                .readonly(annotation.readonly())
                .build();
    }

    private static VariantAttributes variantAttributes(TsVariant annotation) {
        if (annotation == null) {
            return VariantAttributes.none();
        }
        return new VariantAttributes(annotation.rename(), annotation.skip(), annotation.renameAll());
    }
}
