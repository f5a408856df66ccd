package io.github.flameyossnowy.datamapper.checker.generator;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.flameyossnowy.datamapper.api.property.Visibility;
import io.github.flameyossnowy.datamapper.checker.PropertyModel;
import io.github.flameyossnowy.datamapper.checker.SchemaModel;

import javax.lang.model.element.Modifier;
import javax.lang.model.util.Types;
import java.util.List;

/**
 * Writes the resource class for a schema: a static {@code MODEL}, one {@code Property}
 * constant per schema method, and typed accessors delegating to those constants.
 */
public final class ResourceClassGenerator {
    private static final String API = "io.github.flameyossnowy.datamapper.api";

    private static final ClassName RESOURCE = ClassName.get(API + ".resource", "Resource");
    private static final ClassName MODEL = ClassName.get(API + ".model", "Model");
    private static final ClassName PROPERTY = ClassName.get(API + ".property", "Property");
    private static final ClassName PROPERTY_OPTIONS = ClassName.get(API + ".property", "PropertyOptions");
    private static final ClassName VISIBILITY = ClassName.get(Visibility.class);
    private static final ClassName FIELD_TYPE = ClassName.get(API + ".types", "FieldType");
    private static final ClassName JSON_TYPE = ClassName.get(API + ".types", "JsonType");
    private static final ClassName GENERATED = ClassName.get("javax.annotation.processing", "Generated");

    private static final String PROCESSOR = "io.github.flameyossnowy.datamapper.checker.ModelSchemaProcessor";

    private ResourceClassGenerator() {}

    public static JavaFile generate(SchemaModel schema, Types types) {
        ClassName resource = ClassName.get(schema.packageName(), schema.className());

        TypeSpec.Builder type = TypeSpec.classBuilder(resource)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .superclass(RESOURCE)
            .addAnnotation(AnnotationSpec.builder(GENERATED).addMember("value", "$S", PROCESSOR).build())
            .addJavadoc("Resource generated from {@link $T}.\n", ClassName.get(schema.schema()))
            .addField(modelField(schema, resource));

        for (PropertyModel property : schema.properties()) {
            type.addField(propertyField(property, resource, types));
        }

        type.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC).build());
        type.addMethod(MethodSpec.methodBuilder("model")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ParameterizedTypeName.get(MODEL, resource))
            .addStatement("return MODEL")
            .build());

        for (PropertyModel property : schema.properties()) {
            TypeName valueType = TypeName.get(property.valueType());
            type.addMethod(MethodSpec.methodBuilder((property.isBoolean() ? "is" : "get") + property.accessorName())
                .addModifiers(modifiers(property.readerVisibility()))
                .returns(valueType)
                .addStatement("return $N.get(this)", property.constantName())
                .build());
            type.addMethod(MethodSpec.methodBuilder("set" + property.accessorName())
                .addModifiers(modifiers(property.writerVisibility()))
                .addParameter(valueType, "value")
                .addStatement("$N.set(this, value)", property.constantName())
                .build());
        }

        return JavaFile.builder(schema.packageName(), type.build())
            .skipJavaLangImports(true)
            .indent("    ")
            .build();
    }

    private static FieldSpec modelField(SchemaModel schema, ClassName resource) {
        CodeBlock.Builder initializer = CodeBlock.builder()
            .add("$T.builder($T.class, $T::new)", MODEL, resource, resource)
            .add(".name($S)", schema.modelName())
            .add(".repository($S)", schema.repository());
        if (schema.storageName() != null) {
            initializer.add(".storageName($S)", schema.storageName());
        }
        initializer.add(".build()");

        return FieldSpec.builder(ParameterizedTypeName.get(MODEL, resource), "MODEL",
                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer(initializer.build())
            .build();
    }

    private static FieldSpec propertyField(PropertyModel property, ClassName resource, Types types) {
        TypeName valueType = TypeName.get(property.valueType());
        CodeBlock options = options(property);

        CodeBlock.Builder initializer = CodeBlock.builder()
            .add("MODEL.property($S, ", property.name())
            .add(fieldType(property, types));
        if (!options.isEmpty()) {
            initializer.add(",\n$>$T.<$T, $T>options()$L$<", PROPERTY_OPTIONS, resource, valueType, options);
        }
        initializer.add(")");

        return FieldSpec.builder(ParameterizedTypeName.get(PROPERTY, resource, valueType), property.constantName(),
                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer(initializer.build())
            .build();
    }

    private static CodeBlock fieldType(PropertyModel property, Types types) {
        return switch (property.typeSource()) {
            case BUILT_IN -> CodeBlock.of("$T.$L", FIELD_TYPE, property.typeReference());
            case JSON -> CodeBlock.of("new $T<>($T.class)", JSON_TYPE, TypeName.get(types.erasure(property.valueType())));
            case RESOLVE_WITH -> CodeBlock.of("new $T()", TypeName.get(property.resolver()));
        };
    }

    private static CodeBlock options(PropertyModel property) {
        CodeBlock.Builder chain = CodeBlock.builder();
        if (property.key()) chain.add(".key()");
        if (property.nullable() != null) {
            chain.add(property.nullable() ? ".nullable(true)" : ".required()");
        }
        if (property.unique()) chain.add(".unique()");
        if (property.index() != null) chain.add(".index($L)", names(property.index()));
        if (property.uniqueIndex() != null) chain.add(".uniqueIndex($L)", names(property.uniqueIndex()));
        if (property.lazyContexts() != null) {
            if (property.lazyContexts().isEmpty()) {
                chain.add(".lazy(true)");
            } else {
                chain.add(".lazy($L)", names(property.lazyContexts()));
            }
        }
        if (property.length() != null) chain.add(".length($L)", property.length());
        if (property.precision() != null) {
            if (property.scale() == null) {
                chain.add(".precision($L)", property.precision());
            } else {
                chain.add(".precision($L, $L)", property.precision(), property.scale());
            }
        }
        if (property.field() != null) chain.add(".field($S)", property.field());
        if (property.defaultValue() != null) chain.add(".defaultValue($L)", property.defaultValue());
        if (property.defaultProvider() != null) {
            chain.add(".defaultValue(new $T())", TypeName.get(property.defaultProvider()));
        }
        if (!"PUBLIC".equals(property.readerVisibility())) {
            chain.add(".reader($T.$L)", VISIBILITY, property.readerVisibility());
        }
        if (!"PUBLIC".equals(property.writerVisibility())) {
            chain.add(".writer($T.$L)", VISIBILITY, property.writerVisibility());
        }
        return chain.build();
    }

    private static CodeBlock names(List<String> names) {
        CodeBlock.Builder block = CodeBlock.builder();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) block.add(", ");
            block.add("$S", names.get(i));
        }
        return block.build();
    }

    private static Modifier[] modifiers(String visibility) {
        Modifier modifier = Visibility.valueOf(visibility).modifier();
        return modifier == null ? new Modifier[0] : new Modifier[] {modifier};
    }
}
