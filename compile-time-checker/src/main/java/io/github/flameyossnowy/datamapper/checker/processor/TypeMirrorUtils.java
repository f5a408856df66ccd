package io.github.flameyossnowy.datamapper.checker.processor;

import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;

public final class TypeMirrorUtils {
    private TypeMirrorUtils() {}

    /** The erased qualified name, or {@code null} for anything but a declared type. */
    public static String rawName(TypeMirror mirror) {
        if (mirror instanceof DeclaredType dt) {
            return ((TypeElement) dt.asElement()).getQualifiedName().toString();
        }
        return null;
    }

    public static boolean isGeneric(TypeMirror mirror) {
        return mirror instanceof DeclaredType dt && !dt.getTypeArguments().isEmpty();
    }

    public static boolean isAssignableFrom(
        Types types,
        Elements elements,
        TypeMirror mirror,
        String className
    ) {
        if (mirror == null) return false;
        TypeElement target = elements.getTypeElement(className);
        if (target == null) {
            return false;
        }

        TypeMirror erasedMirror = types.erasure(mirror);
        TypeMirror erasedTarget = types.erasure(target.asType());

        return types.isAssignable(erasedMirror, erasedTarget);
    }
}
