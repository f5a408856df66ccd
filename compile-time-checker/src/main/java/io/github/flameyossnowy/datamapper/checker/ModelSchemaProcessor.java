package io.github.flameyossnowy.datamapper.checker;

import com.squareup.javapoet.CodeBlock;
import io.github.flameyossnowy.datamapper.api.model.NamingConvention;
import io.github.flameyossnowy.datamapper.checker.generator.ResourceClassGenerator;
import io.github.flameyossnowy.datamapper.checker.processor.AnnotationUtils;
import io.github.flameyossnowy.datamapper.checker.processor.TypeMirrorUtils;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Filer;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.PrimitiveType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates {@code @Model} schema interfaces and generates their resource classes.
 * Every problem is reported against the offending element; a schema with any error
 * generates nothing.
 */
@SupportedAnnotationTypes(ModelSchemaProcessor.MODEL)
public class ModelSchemaProcessor extends AbstractProcessor {
    static final String ANNOTATIONS = "io.github.flameyossnowy.datamapper.api.annotations.";
    static final String MODEL = ANNOTATIONS + "Model";

    private static final String KEY = ANNOTATIONS + "Key";
    private static final String SERIAL = ANNOTATIONS + "Serial";
    private static final String NON_NULL = ANNOTATIONS + "NonNull";
    private static final String NULLABLE = ANNOTATIONS + "Nullable";
    private static final String UNIQUE = ANNOTATIONS + "Unique";
    private static final String INDEX = ANNOTATIONS + "Index";
    private static final String UNIQUE_INDEX = ANNOTATIONS + "UniqueIndex";
    private static final String LAZY = ANNOTATIONS + "Lazy";
    private static final String LENGTH = ANNOTATIONS + "Length";
    private static final String PRECISION = ANNOTATIONS + "Precision";
    private static final String NAMED = ANNOTATIONS + "Named";
    private static final String DEFAULT_VALUE = ANNOTATIONS + "DefaultValue";
    private static final String DEFAULT_VALUE_PROVIDER = ANNOTATIONS + "DefaultValueProvider";
    private static final String TEXT = ANNOTATIONS + "Text";
    private static final String JSON = ANNOTATIONS + "Json";
    private static final String RESOLVE_WITH = ANNOTATIONS + "ResolveWith";
    private static final String ACCESSOR = ANNOTATIONS + "Accessor";

    private static final String FIELD_TYPE = "io.github.flameyossnowy.datamapper.api.types.FieldType";

    private static final Map<String, String> BUILT_IN_TYPES = Map.of(
        "java.lang.String", "STRING",
        "java.lang.Integer", "INTEGER",
        "java.lang.Long", "LONG",
        "java.lang.Boolean", "BOOLEAN",
        "java.math.BigDecimal", "DECIMAL",
        "java.lang.Double", "FLOAT",
        "java.time.LocalDateTime", "TIMESTAMP",
        "java.time.LocalDate", "DATE"
    );

    private Types types;
    private Elements elements;
    private Messager messager;
    private Filer filer;

    private final Set<String> generated = new HashSet<>(16);

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.types = processingEnv.getTypeUtils();
        this.elements = processingEnv.getElementUtils();
        this.messager = processingEnv.getMessager();
        this.filer = processingEnv.getFiler();
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        TypeElement modelAnnotation = elements.getTypeElement(MODEL);
        if (modelAnnotation == null) return false;

        for (Element element : roundEnv.getElementsAnnotatedWith(modelAnnotation)) {
            if (element.getKind() != ElementKind.INTERFACE) {
                error(element, "@Model can only be placed on interfaces");
                continue;
            }

            TypeElement schema = (TypeElement) element;
            SchemaModel model = readSchema(schema);
            if (model == null || !generated.add(model.packageName() + '.' + model.className())) continue;

            try {
                ResourceClassGenerator.generate(model, types).writeTo(filer);
            } catch (IOException e) {
                error(schema, "Failed to write " + model.className() + ": " + e.getMessage());
            }
        }
        return true;
    }

    private SchemaModel readSchema(TypeElement schema) {
        AnnotationMirror modelMirror = AnnotationUtils.getAnnotationMirror(schema, MODEL);
        String schemaName = schema.getSimpleName().toString();

        String className = AnnotationUtils.getStringValue(modelMirror, "name");
        if (className == null || className.isEmpty()) {
            if (!schemaName.endsWith("Schema") || schemaName.length() == "Schema".length()) {
                error(schema, "@Model needs a name, or the schema interface name must end with 'Schema'");
                return null;
            }
            className = schemaName.substring(0, schemaName.length() - "Schema".length());
        }
        if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            error(schema, "'" + className + "' is not a valid class name");
            return null;
        }

        String storageName = AnnotationUtils.getStringValue(modelMirror, "storageName");
        if (storageName != null && storageName.isEmpty()) storageName = null;
        String repository = AnnotationUtils.getStringValue(modelMirror, "repository");
        if (repository == null) repository = "default";
        if (repository.isBlank()) {
            error(schema, "@Model repository must not be blank");
            return null;
        }

        boolean valid = true;
        List<PropertyModel> properties = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ExecutableElement method : ElementFilter.methodsIn(schema.getEnclosedElements())) {
            if (method.getModifiers().contains(Modifier.DEFAULT) || method.getModifiers().contains(Modifier.STATIC)) {
                continue;
            }
            PropertyModel property = readProperty(method);
            if (property == null) {
                valid = false;
                continue;
            }
            if (!names.add(property.name())) {
                error(method, "Duplicate property '" + property.name() + "' in " + schemaName);
                valid = false;
                continue;
            }
            if (property.name().equals("model")) {
                error(method, "'model' is reserved and cannot be used as a property name");
                valid = false;
                continue;
            }
            properties.add(property);
        }

        if (valid && properties.isEmpty()) {
            error(schema, schemaName + " declares no properties");
            valid = false;
        }
        if (valid && properties.stream().noneMatch(PropertyModel::key)) {
            messager.printMessage(Diagnostic.Kind.WARNING,
                schemaName + " has no @Key property; its resources cannot be updated, destroyed or lazily loaded", schema);
        }
        if (!valid) return null;

        PackageElement packageElement = elements.getPackageOf(schema);
        String packageName = packageElement.isUnnamed() ? "" : packageElement.getQualifiedName().toString();
        return new SchemaModel(schema, packageName, className, className, storageName, repository, properties);
    }

    private PropertyModel readProperty(ExecutableElement method) {
        String methodName = method.getSimpleName().toString();
        if (!method.getParameters().isEmpty()) {
            error(method, "Property method " + methodName + " must not take parameters");
            return null;
        }
        if (!method.getTypeParameters().isEmpty()) {
            error(method, "Property method " + methodName + " must not be generic");
            return null;
        }

        TypeMirror valueType = method.getReturnType();
        if (valueType.getKind() == TypeKind.VOID) {
            error(method, "Property method " + methodName + " must return the property type");
            return null;
        }
        if (valueType.getKind().isPrimitive()) {
            error(method, "Property " + methodName + " must use the boxed type "
                + types.boxedClass((PrimitiveType) valueType).getSimpleName()
                + " instead of " + valueType);
            return null;
        }
        if (valueType.getKind() != TypeKind.DECLARED) {
            error(method, "Property " + methodName + " has unsupported type " + valueType);
            return null;
        }

        boolean valid = true;
        String rawName = TypeMirrorUtils.rawName(valueType);
        boolean key = AnnotationUtils.hasAnnotation(method, KEY);
        boolean serial = AnnotationUtils.hasAnnotation(method, SERIAL);
        boolean text = AnnotationUtils.hasAnnotation(method, TEXT);
        boolean json = AnnotationUtils.hasAnnotation(method, JSON);
        AnnotationMirror resolveWith = AnnotationUtils.getAnnotationMirror(method, RESOLVE_WITH);

        PropertyModel.TypeSource typeSource;
        String typeReference = null;
        TypeMirror resolver = null;
        if ((serial ? 1 : 0) + (text ? 1 : 0) + (json ? 1 : 0) + (resolveWith != null ? 1 : 0) > 1) {
            error(method, "Only one of @Serial, @Text, @Json and @ResolveWith may be used on " + methodName);
            return null;
        }
        if (serial) {
            if (!"java.lang.Long".equals(rawName)) {
                error(method, "@Serial requires Long, " + methodName + " is " + valueType);
                return null;
            }
            typeSource = PropertyModel.TypeSource.BUILT_IN;
            typeReference = "SERIAL";
        } else if (text) {
            if (!"java.lang.String".equals(rawName)) {
                error(method, "@Text requires String, " + methodName + " is " + valueType);
                return null;
            }
            typeSource = PropertyModel.TypeSource.BUILT_IN;
            typeReference = "TEXT";
        } else if (json) {
            if (TypeMirrorUtils.isGeneric(valueType)) {
                error(method, "@Json needs a non-generic type, " + methodName + " is " + valueType
                    + "; use @ResolveWith with a dedicated type instead");
                return null;
            }
            typeSource = PropertyModel.TypeSource.JSON;
        } else if (resolveWith != null) {
            resolver = AnnotationUtils.getClassValue(resolveWith, "value");
            if (resolver == null || !TypeMirrorUtils.isAssignableFrom(types, elements, resolver, FIELD_TYPE)) {
                error(method, "@ResolveWith on " + methodName + " must name a FieldType");
                return null;
            }
            typeSource = PropertyModel.TypeSource.RESOLVE_WITH;
        } else if (BUILT_IN_TYPES.containsKey(rawName)) {
            typeSource = PropertyModel.TypeSource.BUILT_IN;
            typeReference = BUILT_IN_TYPES.get(rawName);
        } else {
            error(method, "Property " + methodName + " has type " + valueType
                + ", which has no built-in field type; use @Json or @ResolveWith");
            return null;
        }

        boolean nonNull = AnnotationUtils.hasAnnotation(method, NON_NULL);
        boolean nullableMark = AnnotationUtils.hasAnnotation(method, NULLABLE);
        Boolean nullable = null;
        if (nonNull && nullableMark) {
            error(method, methodName + " cannot be both @NonNull and @Nullable");
            valid = false;
        } else if (nonNull) {
            nullable = false;
        } else if (nullableMark) {
            if (key) {
                error(method, "Key property " + methodName + " cannot be @Nullable");
                valid = false;
            }
            nullable = true;
        }

        AnnotationMirror lazyMirror = AnnotationUtils.getAnnotationMirror(method, LAZY);
        List<String> lazyContexts = lazyMirror == null ? null : AnnotationUtils.getStringArrayValue(lazyMirror, "value");
        if (key && lazyMirror != null) {
            error(method, "Key property " + methodName + " cannot be @Lazy");
            valid = false;
        }

        AnnotationMirror indexMirror = AnnotationUtils.getAnnotationMirror(method, INDEX);
        AnnotationMirror uniqueIndexMirror = AnnotationUtils.getAnnotationMirror(method, UNIQUE_INDEX);

        Integer length = AnnotationUtils.getIntValue(AnnotationUtils.getAnnotationMirror(method, LENGTH), "value");
        if (length != null) {
            if (!"java.lang.String".equals(rawName) || text) {
                error(method, "@Length only applies to String properties, " + methodName + " is not one");
                valid = false;
            } else if (length <= 0) {
                error(method, "@Length on " + methodName + " must be greater than 0, got " + length);
                valid = false;
            }
        }

        AnnotationMirror precisionMirror = AnnotationUtils.getAnnotationMirror(method, PRECISION);
        Integer precision = null;
        Integer scale = null;
        if (precisionMirror != null) {
            precision = AnnotationUtils.getIntValue(precisionMirror, "value");
            Integer declaredScale = AnnotationUtils.getIntValue(precisionMirror, "scale");
            scale = declaredScale == null || declaredScale < 0 ? null : declaredScale;
            if (!"java.math.BigDecimal".equals(rawName) && !"java.lang.Double".equals(rawName)) {
                error(method, "@Precision only applies to BigDecimal and Double properties, " + methodName + " is " + valueType);
                valid = false;
            } else if (precision == null || precision <= 0) {
                error(method, "@Precision on " + methodName + " must be greater than 0");
                valid = false;
            } else if (scale != null && scale > precision) {
                error(method, "@Precision on " + methodName + " has scale " + scale + " greater than precision " + precision);
                valid = false;
            }
        }

        String field = AnnotationUtils.getStringValue(AnnotationUtils.getAnnotationMirror(method, NAMED), "value");
        if (field != null && field.isBlank()) {
            error(method, "@Named on " + methodName + " must not be blank");
            valid = false;
        }

        AnnotationMirror defaultMirror = AnnotationUtils.getAnnotationMirror(method, DEFAULT_VALUE);
        AnnotationMirror providerMirror = AnnotationUtils.getAnnotationMirror(method, DEFAULT_VALUE_PROVIDER);
        CodeBlock defaultValue = null;
        TypeMirror defaultProvider = null;
        if (defaultMirror != null && providerMirror != null) {
            error(method, methodName + " cannot have both @DefaultValue and @DefaultValueProvider");
            valid = false;
        } else if (defaultMirror != null) {
            if (typeSource == PropertyModel.TypeSource.JSON || typeSource == PropertyModel.TypeSource.RESOLVE_WITH) {
                error(method, "@DefaultValue cannot be parsed for custom type of " + methodName + "; use @DefaultValueProvider");
                valid = false;
            } else {
                defaultValue = parseDefault(method, valueType, AnnotationUtils.getStringValue(defaultMirror, "value"));
                if (defaultValue == null) valid = false;
            }
        } else if (providerMirror != null) {
            defaultProvider = AnnotationUtils.getClassValue(providerMirror, "value");
            if (defaultProvider == null) {
                error(method, "@DefaultValueProvider on " + methodName + " must name a class");
                valid = false;
            }
        }

        AnnotationMirror accessor = AnnotationUtils.getAnnotationMirror(method, ACCESSOR);
        String reader = AnnotationUtils.getEnumValueName(accessor, "reader");
        String writer = AnnotationUtils.getEnumValueName(accessor, "writer");

        if (!valid) return null;

        return new PropertyModel(
            method,
            NamingConvention.underscore(methodName),
            Character.toUpperCase(methodName.charAt(0)) + methodName.substring(1),
            valueType,
            typeSource,
            typeReference,
            resolver,
            key,
            nullable,
            AnnotationUtils.hasAnnotation(method, UNIQUE),
            indexMirror == null ? null : AnnotationUtils.getStringArrayValue(indexMirror, "value"),
            uniqueIndexMirror == null ? null : AnnotationUtils.getStringArrayValue(uniqueIndexMirror, "value"),
            lazyContexts,
            length,
            precision,
            scale,
            field,
            defaultValue,
            defaultProvider,
            reader == null ? "PUBLIC" : reader,
            writer == null ? "PUBLIC" : writer
        );
    }

    /**
     * Renders a {@code @DefaultValue} literal as code of the property type, or reports why it cannot be.
     */
    private CodeBlock parseDefault(ExecutableElement method, TypeMirror valueType, String literal) {
        String rawName = TypeMirrorUtils.rawName(valueType);
        String methodName = method.getSimpleName().toString();
        try {
            switch (rawName) {
                case "java.lang.String":
                    return CodeBlock.of("$S", literal);
                case "java.lang.Integer":
                    return CodeBlock.of("$L", Integer.parseInt(literal.trim()));
                case "java.lang.Long":
                    return CodeBlock.of("$LL", Long.parseLong(literal.trim()));
                case "java.lang.Boolean":
                    if (!literal.equalsIgnoreCase("true") && !literal.equalsIgnoreCase("false")) {
                        error(method, "Default of " + methodName + " must be true or false, got '" + literal + "'");
                        return null;
                    }
                    return CodeBlock.of("$L", Boolean.parseBoolean(literal));
                case "java.lang.Double": {
                    double value = Double.parseDouble(literal.trim());
                    if (!Double.isFinite(value)) {
                        error(method, "Default of " + methodName + " must be finite, got '" + literal + "'");
                        return null;
                    }
                    return CodeBlock.of("$Ld", value);
                }
                case "java.math.BigDecimal":
                    return CodeBlock.of("new $T($S)", BigDecimal.class, new BigDecimal(literal.trim()).toString());
                case "java.time.LocalDate":
                    LocalDate.parse(literal.trim());
                    return CodeBlock.of("$T.parse($S)", LocalDate.class, literal.trim());
                case "java.time.LocalDateTime":
                    LocalDateTime.parse(literal.trim());
                    return CodeBlock.of("$T.parse($S)", LocalDateTime.class, literal.trim());
                default:
                    break;
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            error(method, "Default of " + methodName + " cannot be read as " + valueType + ": '" + literal + "'");
            return null;
        }

        error(method, "@DefaultValue is not supported for " + valueType + "; use @DefaultValueProvider");
        return null;
    }

    private void error(Element element, String message) {
        messager.printMessage(Diagnostic.Kind.ERROR, message, element);
    }
}
