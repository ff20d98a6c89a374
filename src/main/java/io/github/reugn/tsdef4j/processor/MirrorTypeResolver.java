package io.github.reugn.tsdef4j.processor;

import io.github.reugn.tsdef4j.annotation.TypeScript;
import io.github.reugn.tsdef4j.convert.ConversionException;
import io.github.reugn.tsdef4j.convert.TypeConverter;
import io.github.reugn.tsdef4j.descriptor.MemberType;
import io.github.reugn.tsdef4j.descriptor.MemberTypeResolver;
import io.github.reugn.tsdef4j.ir.Primitive;
import io.github.reugn.tsdef4j.ir.TypeDef;

import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.TypeVariable;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves Java type mirrors to the type IR.
 *
 * <p><b>Type Mapping:</b>
 * <table border="1">
 *   <caption>Java types and their TypeScript counterparts</caption>
 *   <tr><th>Java</th><th>TypeScript</th></tr>
 *   <tr><td>{@code boolean}, {@code Boolean}</td><td>{@code boolean}</td></tr>
 *   <tr><td>numeric primitives and boxes, {@code Number}, {@code BigDecimal}</td><td>{@code number}</td></tr>
 *   <tr><td>{@code BigInteger}</td><td>{@code bigint}</td></tr>
 *   <tr><td>{@code char}, {@code String}, {@code CharSequence}, {@code UUID}, {@code URI},
 *       {@code URL}, {@code Date}, {@code java.time.*}</td><td>{@code string}</td></tr>
 *   <tr><td>{@code Object}</td><td>{@code unknown}</td></tr>
 *   <tr><td>arrays, {@code Iterable} subtypes</td><td>{@code T[]}</td></tr>
 *   <tr><td>{@code Map} subtypes</td><td>{@code Record<K, V>}</td></tr>
 *   <tr><td>{@code Optional<T>}</td><td>{@code T | null}</td></tr>
 *   <tr><td>{@code OptionalInt}, {@code OptionalLong}, {@code OptionalDouble}</td><td>{@code number | null}</td></tr>
 *   <tr><td>type variables</td><td>the variable name</td></tr>
 *   <tr><td>{@code @TypeScript} types</td><td>the declared type, {@code Name<A>} when parameterized</td></tr>
 *   <tr><td>anything else</td><td>a reference to the simple name</td></tr>
 * </table>
 *
 * <p>{@code @TypeScript} types are converted on first use and cached. A type referenced
 * while its own conversion is in progress resolves to a reference, which makes recursive
 * types possible. Conversion failures are cached and rethrown by {@link #declare(TypeElement)};
 * a member whose type failed to convert resolves to a reference, so the error is reported once,
 * on the failing type.
 */
final class MirrorTypeResolver implements MemberTypeResolver {

    private static final Set<String> NUMBER_TYPES = Set.of(
            "java.lang.Byte", "java.lang.Short", "java.lang.Integer", "java.lang.Long", "java.lang.Float",
            "java.lang.Double", "java.lang.Number", "java.math.BigDecimal",
            "java.util.concurrent.atomic.AtomicInteger", "java.util.concurrent.atomic.AtomicLong");

    private static final Set<String> STRING_TYPES = Set.of(
            "java.lang.String", "java.lang.Character", "java.lang.CharSequence", "java.util.UUID",
            "java.net.URI", "java.net.URL", "java.util.Date");

    private static final Set<String> OPTIONAL_NUMBER_TYPES = Set.of(
            "java.util.OptionalInt", "java.util.OptionalLong", "java.util.OptionalDouble");

    private final Types typeUtils;
    private final Elements elementUtils;
    private final DescriptorReader reader;

    private final Map<String, TypeDef> converted = new HashMap<>();
    private final Map<String, ConversionException> failures = new HashMap<>();
    private final Map<String, TypeDef.Named> declarations = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    MirrorTypeResolver(Types typeUtils, Elements elementUtils, DescriptorReader reader) {
        this.typeUtils = typeUtils;
        this.elementUtils = elementUtils;
        this.reader = reader;
    }

    /**
     * Converts an annotated type, or returns its cached conversion.
     *
     * @param element a {@code @TypeScript} type
     * @return the declared type (the inner type for transparent records)
     * @throws ConversionException if the type cannot be converted
     */
    TypeDef declare(TypeElement element) {
        String key = element.getQualifiedName().toString();
        ConversionException failure = failures.get(key);
        if (failure != null) {
            throw failure;
        }
        TypeDef cached = converted.get(key);
        if (cached != null) {
            return cached;
        }

        inProgress.add(key);
        try {
            TypeDef type = TypeConverter.convert(reader.read(element), this);
            converted.put(key, type);
            if (type instanceof TypeDef.Named named) {
                declarations.put(named.qualifiedName(), named);
            }
            return type;
        } catch (ConversionException e) {
            failures.put(key, e);
            throw e;
        } finally {
            inProgress.remove(key);
        }
    }

    @Override
    public TypeDef resolve(MemberType type) {
        if (type instanceof MirrorMemberType mirror) {
            return resolve(mirror.mirror());
        }
        return MemberTypeResolver.direct().resolve(type);
    }

    @Override
    public Optional<TypeDef.Named> lookup(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    TypeDef resolve(TypeMirror type) {
        switch (type.getKind()) {
            case BOOLEAN:
                return TypeDef.bool();
            case BYTE:
            case SHORT:
            case INT:
            case LONG:
            case FLOAT:
            case DOUBLE:
                return TypeDef.number();
            case CHAR:
                return TypeDef.string();
            case VOID:
                return TypeDef.primitive(Primitive.VOID);
            case ARRAY:
                return TypeDef.array(resolve(((ArrayType) type).getComponentType()));
            case TYPEVAR:
                return TypeDef.ref(((TypeVariable) type).asElement().getSimpleName().toString());
            case WILDCARD:
                TypeMirror bound = ((WildcardType) type).getExtendsBound();
                return bound != null ? resolve(bound) : TypeDef.primitive(Primitive.UNKNOWN);
            case DECLARED:
                return resolveDeclared((DeclaredType) type);
            default:
                return TypeDef.primitive(Primitive.UNKNOWN);
        }
    }

    // ==================== DECLARED TYPES ====================

    private TypeDef resolveDeclared(DeclaredType type) {
        TypeElement element = (TypeElement) type.asElement();
        String name = element.getQualifiedName().toString();

        if (name.equals("java.lang.Boolean")) {
            return TypeDef.bool();
        }
        if (NUMBER_TYPES.contains(name)) {
            return TypeDef.number();
        }
        if (name.equals("java.math.BigInteger")) {
            return TypeDef.primitive(Primitive.BIGINT);
        }
        if (STRING_TYPES.contains(name) || name.startsWith("java.time.")) {
            return TypeDef.string();
        }
        if (name.equals("java.lang.Object")) {
            return TypeDef.primitive(Primitive.UNKNOWN);
        }
        if (name.equals("java.lang.Void")) {
            return TypeDef.primitive(Primitive.VOID);
        }
        if (name.equals("java.util.Optional")) {
            return TypeDef.union(argument(type.getTypeArguments(), 0), TypeDef.nullType());
        }
        if (OPTIONAL_NUMBER_TYPES.contains(name)) {
            return TypeDef.union(TypeDef.number(), TypeDef.nullType());
        }

        if (element.getAnnotation(TypeScript.class) != null) {
            return resolveAnnotated(type, element);
        }

        List<? extends TypeMirror> mapArgs = supertypeArguments(type, "java.util.Map");
        if (mapArgs != null) {
            return TypeDef.record(argument(mapArgs, 0, TypeDef.string()), argument(mapArgs, 1));
        }
        List<? extends TypeMirror> iterableArgs = supertypeArguments(type, "java.lang.Iterable");
        if (iterableArgs != null) {
            return TypeDef.array(argument(iterableArgs, 0));
        }
        return TypeDef.ref(element.getSimpleName().toString());
    }

    private TypeDef resolveAnnotated(DeclaredType type, TypeElement element) {
        String key = element.getQualifiedName().toString();
        String declaredName = reader.declaredName(element);
        if (inProgress.contains(key)) {
            return genericOrRef(declaredName, type);
        }

        TypeDef declared;
        try {
            declared = declare(element);
        } catch (ConversionException e) {
            return genericOrRef(declaredName, type);
        }
        if (declared instanceof TypeDef.Named named && named.isGeneric()) {
            return genericOrRef(named.qualifiedName(), type);
        }
        return declared;
    }

    private TypeDef genericOrRef(String name, DeclaredType type) {
        if (type.getTypeArguments().isEmpty()) {
            return TypeDef.ref(name);
        }
        List<TypeDef> args = new ArrayList<>();
        for (TypeMirror arg : type.getTypeArguments()) {
            args.add(resolve(arg));
        }
        return new TypeDef.GenericType(name, args);
    }

    /**
     * Finds {@code target} among the supertypes of {@code type} and returns its type arguments
     * as seen from {@code type}, or {@code null} if {@code type} is not a subtype of it.
     */
    private List<? extends TypeMirror> supertypeArguments(DeclaredType type, String target) {
        TypeElement targetElement = elementUtils.getTypeElement(target);
        if (targetElement == null) {
            return null;
        }
        TypeMirror targetErasure = typeUtils.erasure(targetElement.asType());
        if (!typeUtils.isAssignable(typeUtils.erasure(type), targetErasure)) {
            return null;
        }
        return findSupertype(type, targetErasure);
    }

    private List<? extends TypeMirror> findSupertype(TypeMirror type, TypeMirror targetErasure) {
        if (typeUtils.isSameType(typeUtils.erasure(type), targetErasure)) {
            return ((DeclaredType) type).getTypeArguments();
        }
        for (TypeMirror supertype : typeUtils.directSupertypes(type)) {
            if (typeUtils.isAssignable(typeUtils.erasure(supertype), targetErasure)) {
                List<? extends TypeMirror> found = findSupertype(supertype, targetErasure);
                if (found != null) {
                    return found;
                }
            }
        }
        return List.of();
    }

    private TypeDef argument(List<? extends TypeMirror> args, int index) {
        return argument(args, index, TypeDef.primitive(Primitive.UNKNOWN));
    }

    private TypeDef argument(List<? extends TypeMirror> args, int index, TypeDef fallback) {
        return index < args.size() ? resolve(args.get(index)) : fallback;
    }
}
