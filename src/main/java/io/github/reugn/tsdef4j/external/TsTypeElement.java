package io.github.reugn.tsdef4j.external;

/**
 * A member of an interface body or type literal.
 */
public sealed interface TsTypeElement permits TsPropertySignature, TsTypeElement.Other {

    /**
     * A member that is not a property signature: a method, call, construct or index signature.
     *
     * @param kind a short description of the member, used for diagnostics
     */
    record Other(String kind) implements TsTypeElement {
    }
}
