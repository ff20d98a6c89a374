package io.github.reugn.tsdef4j.processor;

import io.github.reugn.tsdef4j.descriptor.MemberType;

import javax.lang.model.type.TypeMirror;
import java.util.Objects;

/**
 * A member type backed by a compiler type mirror.
 *
 * @param mirror the declared type of the record component or field
 */
record MirrorMemberType(TypeMirror mirror) implements MemberType {

    MirrorMemberType {
        Objects.requireNonNull(mirror, "mirror");
    }

    @Override
    public String describe() {
        return mirror.toString();
    }
}
