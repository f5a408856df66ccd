package io.github.flameyossnowy.datamapper.checker;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.StandardLocation;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ModelSchemaProcessorTest {
    private static final String HEADER = "package zoo;\n"
        + "import io.github.flameyossnowy.datamapper.api.annotations.*;\n"
        + "import io.github.flameyossnowy.datamapper.api.property.Visibility;\n";

    @TempDir
    Path temp;

    @Test
    void generates_a_resource_class_for_a_valid_schema() throws Exception {
        Compilation compilation = compile(source("HeffalumpSchema",
            "@Model(storageName = \"heffalumps\")\n"
                + "public interface HeffalumpSchema {\n"
                + "    @Key @Serial Long id();\n"
                + "    @Length(20) @Index String color();\n"
                + "    Integer numSpots();\n"
                + "    @DefaultValue(\"false\") Boolean striped();\n"
                + "    @Text String notes();\n"
                + "}\n"));

        assertTrue(compilation.errors().isEmpty(), compilation.errors().toString());
        String generated = compilation.generatedSource("zoo/Heffalump.java");
        assertTrue(generated.contains("public final class Heffalump extends Resource"), generated);
        assertTrue(generated.contains("public static final Property<Heffalump, Long> ID = MODEL.property(\"id\", FieldType.SERIAL"), generated);
        assertTrue(generated.contains(".key()"), generated);
        assertTrue(generated.contains(".length(20)"), generated);
        assertTrue(generated.contains("public Boolean isStriped()"), generated);
        assertTrue(generated.contains("public void setNumSpots(Integer value)"), generated);
        assertTrue(generated.contains(".storageName(\"heffalumps\")"), generated);
    }

    @Test
    void generated_class_exposes_a_working_model() throws Exception {
        Compilation compilation = compile(source("TreeSchema",
            "@Model\n"
                + "public interface TreeSchema {\n"
                + "    @Key @Serial Long id();\n"
                + "    @NonNull @Named(\"species_name\") String species();\n"
                + "    @DefaultValue(\"3\") Integer height();\n"
                + "    @Lazy({\"details\"}) String description();\n"
                + "}\n"));
        assertTrue(compilation.errors().isEmpty(), compilation.errors().toString());

        try (URLClassLoader loader = new URLClassLoader(new URL[] {compilation.classes().toUri().toURL()}, getClass().getClassLoader())) {
            Class<?> tree = loader.loadClass("zoo.Tree");
            Model<?> model = (Model<?>) tree.getField("MODEL").get(null);
            assertEquals("Tree", model.name());
            assertEquals("trees", model.storageName());
            assertEquals(List.of("id", "species", "height", "description"),
                model.properties().asList().stream().map(Property::name).collect(Collectors.toList()));

            Property<?, ?> species = (Property<?, ?>) tree.getField("SPECIES").get(null);
            assertEquals("species_name", species.field());
            assertFalse(species.isNullable());

            Property<?, ?> description = (Property<?, ?>) tree.getField("DESCRIPTION").get(null);
            assertTrue(description.isLazy());
            assertEquals(List.of("details"), description.lazyContexts());

            Resource instance = (Resource) tree.getConstructor().newInstance();
            assertSame(model, instance.model());
            tree.getMethod("setSpecies", String.class).invoke(instance, "oak");
            assertEquals("oak", tree.getMethod("getSpecies").invoke(instance));
            assertTrue(instance.isDirty());
        }
    }

    @Test
    void accessor_visibility_controls_generated_modifiers() throws Exception {
        Compilation compilation = compile(source("VaultSchema",
            "@Model\n"
                + "public interface VaultSchema {\n"
                + "    @Key @Serial Long id();\n"
                + "    @Accessor(reader = Visibility.PRIVATE, writer = Visibility.PACKAGE_PRIVATE) String secret();\n"
                + "}\n"));

        assertTrue(compilation.errors().isEmpty(), compilation.errors().toString());
        String generated = compilation.generatedSource("zoo/Vault.java");
        assertTrue(generated.contains("private String getSecret()"), generated);
        assertTrue(generated.contains("    void setSecret(String value)"), generated);
        assertTrue(generated.contains(".reader(Visibility.PRIVATE)"), generated);
    }

    @Test
    void primitive_return_types_are_rejected() throws Exception {
        Compilation compilation = compile(source("CounterSchema",
            "@Model\npublic interface CounterSchema {\n    @Key @Serial Long id();\n    int count();\n}\n"));

        assertHasError(compilation, "must use the boxed type Integer");
        assertFalse(compilation.hasGenerated("zoo/Counter.java"));
    }

    @Test
    void serial_requires_a_long() throws Exception {
        Compilation compilation = compile(source("TicketSchema",
            "@Model\npublic interface TicketSchema {\n    @Key @Serial String id();\n}\n"));

        assertHasError(compilation, "@Serial requires Long");
    }

    @Test
    void unsupported_types_need_a_custom_field_type() throws Exception {
        Compilation compilation = compile(source("BasketSchema",
            "@Model\npublic interface BasketSchema {\n    @Key @Serial Long id();\n    java.util.List<String> items();\n}\n"));

        assertHasError(compilation, "use @Json or @ResolveWith");
    }

    @Test
    void default_literals_are_checked_against_the_property_type() throws Exception {
        Compilation compilation = compile(source("GaugeSchema",
            "@Model\npublic interface GaugeSchema {\n    @Key @Serial Long id();\n    @DefaultValue(\"lots\") Integer level();\n}\n"));

        assertHasError(compilation, "cannot be read as java.lang.Integer");
    }

    @Test
    void conflicting_nullability_is_rejected() throws Exception {
        Compilation compilation = compile(source("NoteSchema",
            "@Model\npublic interface NoteSchema {\n    @Key @Serial Long id();\n    @NonNull @Nullable String body();\n}\n"));

        assertHasError(compilation, "cannot be both @NonNull and @Nullable");
    }

    @Test
    void schema_without_name_or_suffix_is_rejected() throws Exception {
        Compilation compilation = compile(source("Lamp",
            "@Model\npublic interface Lamp {\n    @Key @Serial Long id();\n}\n"));

        assertHasError(compilation, "must end with 'Schema'");
    }

    @Test
    void model_on_a_class_is_rejected() throws Exception {
        Compilation compilation = compile(source("ChairSchema",
            "@Model\npublic class ChairSchema {\n}\n"));

        assertHasError(compilation, "@Model can only be placed on interfaces");
    }

    @Test
    void keyless_schema_compiles_with_a_warning() throws Exception {
        Compilation compilation = compile(source("LogLineSchema",
            "@Model\npublic interface LogLineSchema {\n    String message();\n}\n"));

        assertTrue(compilation.errors().isEmpty(), compilation.errors().toString());
        assertTrue(compilation.warnings().stream().anyMatch(w -> w.contains("has no @Key property")), compilation.warnings().toString());
    }

    private static void assertHasError(Compilation compilation, String fragment) {
        assertTrue(compilation.errors().stream().anyMatch(e -> e.contains(fragment)),
            "expected an error containing '" + fragment + "' but got " + compilation.errors());
    }

    private static JavaFileObject source(String simpleName, String body) {
        String code = HEADER + body;
        return new SimpleJavaFileObject(URI.create("string:///zoo/" + simpleName + ".java"), JavaFileObject.Kind.SOURCE) {
            @Override
            public CharSequence getCharContent(boolean ignoreEncodingErrors) {
                return code;
            }
        };
    }

    private Compilation compile(JavaFileObject source) throws Exception {
        Path classes = Files.createDirectories(temp.resolve("classes"));
        Path sources = Files.createDirectories(temp.resolve("generated"));

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            fileManager.setLocation(StandardLocation.CLASS_OUTPUT, List.of(classes.toFile()));
            fileManager.setLocation(StandardLocation.SOURCE_OUTPUT, List.of(sources.toFile()));
            fileManager.setLocation(StandardLocation.CLASS_PATH, List.of(coreLocation()));

            JavaCompiler.CompilationTask task = compiler.getTask(null, fileManager, diagnostics,
                List.of(), null, List.of(source));
            task.setProcessors(List.of(new ModelSchemaProcessor()));
            task.call();
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics.getDiagnostics()) {
            String message = diagnostic.getMessage(Locale.ROOT);
            if (diagnostic.getKind() == Diagnostic.Kind.ERROR) errors.add(message);
            else if (diagnostic.getKind() == Diagnostic.Kind.WARNING || diagnostic.getKind() == Diagnostic.Kind.MANDATORY_WARNING) warnings.add(message);
        }
        return new Compilation(classes, sources, errors, warnings);
    }

    private static File coreLocation() throws Exception {
        return new File(Resource.class.getProtectionDomain().getCodeSource().getLocation().toURI());
    }

    private record Compilation(Path classes, Path sources, List<String> errors, List<String> warnings) {
        boolean hasGenerated(String path) {
            return Files.exists(sources.resolve(path));
        }

        String generatedSource(String path) throws IOException {
            return Files.readString(sources.resolve(path));
        }
    }
}
