package io.github.flameyossnowy.datamapper.api.exceptions;

/**
 * Raised while a model is being declared, when a property is configured with an
 * invalid option value. The declaration that triggered it must be treated as failed.
 */
public class PropertyDefinitionException extends IllegalArgumentException {
    private final String modelName;
    private final String propertyName;

    public PropertyDefinitionException(String modelName, String propertyName, String message) {
        super(modelName + '#' + propertyName + ": " + message);
        this.modelName = modelName;
        this.propertyName = propertyName;
    }

    public String getModelName() {
        return modelName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
