package io.github.flameyossnowy.datamapper.checker;

import javax.lang.model.element.TypeElement;
import java.util.List;

/**
 * A validated {@code @Model} schema interface, ready for generation.
 *
 * @param className    simple name of the generated resource class
 * @param storageName  explicit storage name, or {@code null} for the naming convention
 */
public record SchemaModel(
    TypeElement schema,
    String packageName,
    String className,
    String modelName,
    String storageName,
    String repository,
    List<PropertyModel> properties
) {
    public String schemaQualifiedName() {
        return schema.getQualifiedName().toString();
    }
}
