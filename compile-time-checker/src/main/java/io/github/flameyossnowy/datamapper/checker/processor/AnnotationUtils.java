package io.github.flameyossnowy.datamapper.checker.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads annotations through their mirrors, since annotation values that name classes
 * cannot be loaded while the sources are still being compiled.
 */
public final class AnnotationUtils {
    private AnnotationUtils() {}

    public static boolean hasAnnotation(Element e, String fqcn) {
        return getAnnotationMirror(e, fqcn) != null;
    }

    public static AnnotationMirror getAnnotationMirror(Element element, String fqcn) {
        for (AnnotationMirror am : element.getAnnotationMirrors()) {
            TypeElement ann = (TypeElement) am.getAnnotationType().asElement();
            if (ann.getQualifiedName().contentEquals(fqcn)) {
                return am;
            }
        }
        return null;
    }

    public static TypeMirror getClassValue(AnnotationMirror am, String name) {
        Object value = getValue(am, name);
        return value instanceof TypeMirror mirror ? mirror : null;
    }

    public static String getStringValue(AnnotationMirror am, String name) {
        Object value = getValue(am, name);
        return value == null ? null : value.toString();
    }

    public static Integer getIntValue(AnnotationMirror am, String name) {
        Object value = getValue(am, name);
        return value instanceof Integer number ? number : null;
    }

    public static String getEnumValueName(AnnotationMirror am, String name) {
        Object value = getValue(am, name);
        if (value == null) {
            return null;
        }
        String s = value.toString();
        int lastDot = s.lastIndexOf('.');
        return lastDot == -1 ? s : s.substring(lastDot + 1);
    }

    /**
     * The string array member {@code name}, empty when it is absent or left at its default.
     */
    public static List<String> getStringArrayValue(AnnotationMirror am, String name) {
        List<String> out = new ArrayList<>(4);
        Object value = getValue(am, name);
        if (value instanceof List<?> values) {
            for (Object v : values) {
                out.add(((AnnotationValue) v).getValue().toString());
            }
        }
        return out;
    }

    private static Object getValue(AnnotationMirror am, String name) {
        if (am == null) {
            return null;
        }
        for (var e : am.getElementValues().entrySet()) {
            if (e.getKey().getSimpleName().contentEquals(name)) {
                return e.getValue().getValue();
            }
        }
        return null;
    }
}
