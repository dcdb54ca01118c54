package co.strata.generators.java;

import co.strata.core.FieldType;
import co.strata.core.model.EntityDefinition;
import co.strata.core.schema.FieldDescriptor;
import co.strata.core.schema.RelationshipDescriptor;
import co.strata.core.schema.SchemaBuilder;
import co.strata.core.schema.SchemaCatalog;
import co.strata.core.schema.SchemaModel;
import com.squareup.javapoet.*;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Java code generator for the strata mapper runtime.
 *
 * Definitions are compiled with {@link SchemaBuilder} first, so generation only ever runs on
 * definitions that also map at runtime. Field names become Java identifiers directly when they
 * are valid, otherwise through camel-case conversion; the accessor keeps using the definition
 * name, so the mapper sees the same names either way.
 *
 * <h3>Field types</h3>
 * <ul>
 *   <li>{@code string}            → {@code String}</li>
 *   <li>{@code number.int}        → {@code Integer}</li>
 *   <li>{@code number.long}       → {@code Long}</li>
 *   <li>{@code number.float}      → {@code Float}</li>
 *   <li>{@code number.double}     → {@code Double}</li>
 *   <li>{@code number.decimal}    → {@code BigDecimal}</li>
 *   <li>{@code boolean}           → {@code Boolean}</li>
 *   <li>{@code binary}            → {@code byte[]}</li>
 *   <li>{@code timestamp}         → {@code OffsetDateTime}</li>
 *   <li>{@code timestamp.epoch}   → {@code Instant}</li>
 *   <li>{@code timestamp.date}    → {@code LocalDate}</li>
 *   <li>{@code enum}              → generated {@code {Entity}{Field}} enum</li>
 *   <li>{@code map}               → {@code Map<String, Object>}</li>
 *   <li>{@code list}              → {@code List<element type>}, {@code List<Object>} without items</li>
 *   <li>{@code stringSet}, {@code numberSet.*}, {@code binarySet} → {@code Set} of the element type</li>
 * </ul>
 *
 * Generates, per entity:
 * - Plain domain class with constructors, builder, equals/hashCode/toString
 * - One enum per {@code enum} field
 * - {Entity}Accessor: reflection-free {@code EntityAccessor} with switch-based get/set
 * - {Entity}Keys: table, key attribute and index name constants, plus a key record factory
 *
 * And per table:
 * - {Table}Mapping: registers every accessor with a {@code MappingContext} and creates
 *   {@code EntityTable}s
 */
public class JavaGenerator {

    private static final Pattern VALID_JAVA_IDENTIFIER = Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*$");

    // Mapper runtime class names
    private static final ClassName ENTITY_ACCESSOR = ClassName.get("co.strata.mapper", "EntityAccessor");
    private static final ClassName MAPPING_CONTEXT = ClassName.get("co.strata.mapper", "MappingContext");
    private static final ClassName MAPPING_CONTEXT_BUILDER = MAPPING_CONTEXT.nestedClass("Builder");
    private static final ClassName ENTITY_TABLE = ClassName.get("co.strata.mapper", "EntityTable");
    private static final ClassName RECORD_SOURCE = ClassName.get("co.strata.mapper", "RecordSource");
    private static final ClassName RECORD_SINK = ClassName.get("co.strata.mapper", "RecordSink");
    private static final ClassName RAW_RECORD = ClassName.get("co.strata.mapper", "RawRecord");
    private static final ClassName SCHEMA_CATALOG = ClassName.get(SchemaCatalog.class);

    /**
     * Per-field descriptor used when generating plain-Java boilerplate
     * (constructors, setters, Builder, equals/hashCode/toString).
     */
    private record PlainField(String codeName, TypeName type) {}

    /**
     * A member of the generated domain class: a definition field or a relationship target.
     * {@code name} is the name the mapper uses, {@code codeName} the Java identifier.
     */
    private record Member(String name, String codeName, TypeName type, String enumName) {
        boolean isEnum() {
            return enumName != null;
        }
    }

    /**
     * Generate code for every table of a compiled catalog.
     *
     * @param definitions the definitions the catalog was built from; they carry the descriptions
     */
    public void generate(List<EntityDefinition> definitions, String pkg, Path outDir) throws IOException {
        Map<String, List<EntityDefinition>> byTable = new LinkedHashMap<>();
        for (EntityDefinition d : definitions) {
            byTable.computeIfAbsent(d.tableName, k -> new ArrayList<>()).add(d);
        }
        SchemaCatalog catalog = SchemaBuilder.build(definitions);
        for (List<EntityDefinition> table : byTable.values()) {
            writeTable(table, catalog, pkg, outDir);
        }
    }

    /**
     * Generate code for multiple entities sharing the same table.
     *
     * @param definitions entity definitions of one table
     * @param pkg Java package name for generated code
     * @param outDir Output directory
     * @throws co.strata.core.schema.SchemaBuildException if the definitions do not compile
     * @throws IllegalArgumentException if the definitions span several tables or two names
     *                                  resolve to the same Java identifier
     */
    public void generateForTable(List<EntityDefinition> definitions, String pkg, Path outDir) throws IOException {
        Set<String> tables = definitions.stream().map(d -> d.tableName).collect(Collectors.toCollection(LinkedHashSet::new));
        if (tables.size() != 1) {
            throw new IllegalArgumentException("Definitions must share one table, found " + tables);
        }
        writeTable(definitions, SchemaBuilder.build(definitions), pkg, outDir);
    }

    private void writeTable(List<EntityDefinition> definitions, SchemaCatalog catalog, String pkg, Path outDir)
            throws IOException {
        // Validate all definitions for name collisions before generating any code
        for (EntityDefinition d : definitions) {
            detectCollisions(d);
        }

        List<SchemaModel> models = new ArrayList<>();
        for (EntityDefinition d : definitions) {
            SchemaModel model = catalog.require(d.entityName);
            models.add(model);
            List<Member> members = resolveMembers(model, pkg);
            generateEnums(d, model, members, pkg, outDir);
            generateEntity(d, model, members, pkg, outDir);
            generateAccessor(model, members, pkg, outDir);
            generateEntityKeys(model, pkg, outDir);
        }
        generateTableMapping(models, pkg, outDir);
    }

    // =========================================================================
    // Name Resolution
    // =========================================================================

    /**
     * Resolve the Java code name for a definition field name.
     * Valid identifiers are kept, anything else is converted to camelCase.
     */
    static String resolveCodeName(String name) {
        String codeName = VALID_JAVA_IDENTIFIER.matcher(name).matches() ? name : toJavaCamelCase(name);
        if (SourceVersion.isKeyword(codeName)) {
            return codeName + "_";
        }
        return codeName;
    }

    static String resolveCodeName(EntityDefinition.Field field) {
        return resolveCodeName(field.name);
    }

    /**
     * Convert a definition field name to a valid Java camelCase identifier.
     */
    static String toJavaCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        // Handle all-caps: TTL -> ttl, ABC -> abc
        if (name.equals(name.toUpperCase()) && name.length() > 1 && !name.contains("-") && !name.contains("_")) {
            String result = name.toLowerCase();
            if (Character.isDigit(result.charAt(0))) {
                result = "_" + result;
            }
            return result;
        }

        // Split on hyphens, underscores, dots and spaces
        String[] parts = name.split("[-_. ]");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.isEmpty()) {
                sb.append(part.substring(0, 1).toLowerCase());
            } else {
                sb.append(part.substring(0, 1).toUpperCase());
            }
            if (part.length() > 1) {
                sb.append(part.substring(1));
            }
        }

        String result = sb.toString().replaceAll("[^a-zA-Z0-9_$]", "");
        if (result.isEmpty()) {
            return "_";
        }
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return result;
    }

    /**
     * Detect collisions in resolved code names across the fields and relationships of one
     * entity.
     */
    static void detectCollisions(EntityDefinition definition) {
        Map<String, List<String>> codeNameToOriginals = new LinkedHashMap<>();
        for (EntityDefinition.Field field : definition.fields) {
            codeNameToOriginals.computeIfAbsent(resolveCodeName(field), k -> new ArrayList<>()).add(field.name);
        }
        if (definition.relationships != null) {
            for (EntityDefinition.Relationship r : definition.relationships) {
                codeNameToOriginals.computeIfAbsent(resolveCodeName(r.field), k -> new ArrayList<>()).add(r.field);
            }
        }

        for (Map.Entry<String, List<String>> entry : codeNameToOriginals.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new IllegalArgumentException(
                    "Name collision in " + definition.entityName + ": fields " + entry.getValue()
                        + " all resolve to Java identifier '" + entry.getKey()
                        + "'. Rename one of the conflicting fields."
                );
            }
        }
    }

    private List<Member> resolveMembers(SchemaModel model, String pkg) {
        List<Member> members = new ArrayList<>();
        for (FieldDescriptor f : model.fields()) {
            String codeName = resolveCodeName(f.sourceName());
            if (f.type() == FieldType.ENUM) {
                String enumName = model.entityId() + cap(codeName);
                members.add(new Member(f.sourceName(), codeName, ClassName.get(pkg, enumName), enumName));
            } else {
                members.add(new Member(f.sourceName(), codeName, mapFieldType(f), null));
            }
        }
        for (RelationshipDescriptor r : model.relationships()) {
            ClassName target = ClassName.get(pkg, r.targetEntity());
            TypeName type = r.collection()
                ? ParameterizedTypeName.get(ClassName.get(List.class), target)
                : target;
            members.add(new Member(r.targetFieldName(), resolveCodeName(r.targetFieldName()), type, null));
        }
        return members;
    }

    // =========================================================================
    // Entity Generation
    // =========================================================================

    /**
     * Generate a standalone enum file for every {@code enum} field.
     */
    private void generateEnums(EntityDefinition d, SchemaModel model, List<Member> members, String pkg, Path outDir)
            throws IOException {
        for (Member m : members) {
            if (!m.isEnum()) continue;
            FieldDescriptor f = model.field(m.name()).orElseThrow();
            TypeSpec.Builder eb = TypeSpec.enumBuilder(m.enumName())
                .addModifiers(Modifier.PUBLIC);
            String description = descriptionOf(d, m.name());
            if (description != null) {
                eb.addJavadoc("$L\n", description);
            }
            for (String v : f.enumValues()) {
                eb.addEnumConstant(v);
            }
            JavaFile.builder(pkg, eb.build())
                .skipJavaLangImports(true)
                .build()
                .writeTo(outDir);
        }
    }

    /**
     * Generate the plain domain class.
     */
    private void generateEntity(EntityDefinition d, SchemaModel model, List<Member> members, String pkg, Path outDir)
            throws IOException {
        String entityName = model.entityId();
        TypeSpec.Builder tb = TypeSpec.classBuilder(entityName)
            .addModifiers(Modifier.PUBLIC);
        if (d.description != null && !d.description.isEmpty()) {
            tb.addJavadoc("$L\n", d.description);
        }

        List<PlainField> plainFields = new ArrayList<>();
        for (Member m : members) {
            FieldSpec.Builder fieldBuilder = FieldSpec.builder(m.type(), m.codeName(), Modifier.PRIVATE);
            String description = descriptionOf(d, m.name());
            if (description != null) {
                fieldBuilder.addJavadoc("$L\n", description);
            }
            model.field(m.name()).ifPresent(f -> addFieldNotes(fieldBuilder, f, m));
            tb.addField(fieldBuilder.build());
            plainFields.add(new PlainField(m.codeName(), m.type()));
        }

        addConstructors(tb, entityName, plainFields);
        for (PlainField f : plainFields) {
            tb.addMethod(MethodSpec.methodBuilder("get" + cap(f.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type())
                .addStatement("return $L", f.codeName())
                .build());
        }
        addSetters(tb, plainFields);
        addBuilderClass(tb, entityName, plainFields);
        addEqualsHashCodeToString(tb, entityName, plainFields);

        JavaFile.builder(pkg, tb.build())
            .skipJavaLangImports(true)
            .build()
            .writeTo(outDir);
    }

    private static void addFieldNotes(FieldSpec.Builder fieldBuilder, FieldDescriptor f, Member m) {
        if (!f.storedName().equals(m.codeName())) {
            fieldBuilder.addJavadoc("Stored as {@code $L}.\n", f.storedName());
        }
        if (f.isDerived()) {
            fieldBuilder.addJavadoc("Derived from $L before every write.\n", f.derivedFrom().sources());
        }
        if (f.isExtracted()) {
            fieldBuilder.addJavadoc("Component $L of {@code $L}; not stored.\n",
                f.extractedFrom().index(), f.extractedFrom().source());
        }
        if (f.nullable()) {
            fieldBuilder.addJavadoc("Nullable: explicitly allows null values.\n");
        }
    }

    // =========================================================================
    // Accessor Generation
    // =========================================================================

    /**
     * Generate the {@code EntityAccessor} implementation. Enum members are exposed as enum
     * constants and accept their name on set, which is what the mapper decodes them to.
     */
    private void generateAccessor(SchemaModel model, List<Member> members, String pkg, Path outDir) throws IOException {
        String entityName = model.entityId();
        String accessorName = entityName + "Accessor";
        ClassName entityClass = ClassName.get(pkg, entityName);
        ClassName accessorClass = ClassName.get(pkg, accessorName);

        TypeSpec.Builder tb = TypeSpec.classBuilder(accessorName)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addSuperinterface(ParameterizedTypeName.get(ENTITY_ACCESSOR, entityClass))
            .addJavadoc("Reflection-free accessor for {@link $T}.\n", entityClass);

        tb.addField(FieldSpec.builder(accessorClass, "INSTANCE", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("new $T()", accessorClass)
            .build());
        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("newInstance")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(entityClass)
            .addStatement("return new $T()", entityClass)
            .build());

        CodeBlock.Builder getBody = CodeBlock.builder().beginControlFlow("switch (field)");
        for (Member m : members) {
            getBody.add("case $S:\n", m.name()).indent()
                .addStatement("return entity.get$L()", cap(m.codeName()))
                .unindent();
        }
        getBody.add("default:\n").indent()
            .addStatement("throw new $T($S + field)", IllegalArgumentException.class, entityName + " has no field ")
            .unindent()
            .endControlFlow();
        tb.addMethod(MethodSpec.methodBuilder("get")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(Object.class)
            .addParameter(entityClass, "entity")
            .addParameter(String.class, "field")
            .addCode(getBody.build())
            .build());

        boolean unchecked = false;
        CodeBlock.Builder setBody = CodeBlock.builder().beginControlFlow("switch (field)");
        for (Member m : members) {
            setBody.add("case $S:\n", m.name()).indent();
            String setter = "set" + cap(m.codeName());
            if (m.isEnum()) {
                setBody.addStatement("entity.$L(value == null ? null : $T.valueOf(value.toString()))", setter, m.type());
            } else {
                unchecked |= m.type() instanceof ParameterizedTypeName;
                setBody.addStatement("entity.$L(($T) value)", setter, m.type());
            }
            setBody.addStatement("break").unindent();
        }
        setBody.add("default:\n").indent()
            .addStatement("throw new $T($S + field)", IllegalArgumentException.class, entityName + " has no field ")
            .unindent()
            .endControlFlow();
        MethodSpec.Builder set = MethodSpec.methodBuilder("set")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .addParameter(entityClass, "entity")
            .addParameter(String.class, "field")
            .addParameter(Object.class, "value")
            .addCode(setBody.build());
        if (unchecked) {
            set.addAnnotation(AnnotationSpec.builder(SuppressWarnings.class)
                .addMember("value", "$S", "unchecked")
                .build());
        }
        tb.addMethod(set.build());

        JavaFile.builder(pkg, tb.build())
            .skipJavaLangImports(true)
            .build()
            .writeTo(outDir);
    }

    // =========================================================================
    // Keys Helper Generation
    // =========================================================================

    /**
     * Generate key constants helper.
     */
    private void generateEntityKeys(SchemaModel model, String pkg, Path outDir) throws IOException {
        String entityName = model.entityId();
        String keysClassName = entityName + "Keys";
        FieldDescriptor pk = model.partitionKey();
        FieldDescriptor sk = model.sortKey().orElse(null);

        TypeSpec.Builder tb = TypeSpec.classBuilder(keysClassName)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Key constants for $L entity.\n", entityName)
            .addJavadoc("Partition key: $L\n", pk.storedName());
        if (sk != null) {
            tb.addJavadoc("Sort key: $L\n", sk.storedName());
        } else {
            tb.addJavadoc("No sort key defined.\n");
        }

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        tb.addField(constant("ENTITY_ID", entityName, null));
        tb.addField(constant("TABLE_NAME", model.tableName(), null));
        tb.addField(constant("PARTITION_KEY_ATTRIBUTE", pk.storedName(),
            "The attribute name used as partition key."));
        if (sk != null) {
            tb.addField(constant("SORT_KEY_ATTRIBUTE", sk.storedName(), "The attribute name used as sort key."));
        }

        Set<String> indexNames = new LinkedHashSet<>();
        for (FieldDescriptor f : model.fields()) {
            if (f.keyRole().isIndexKey() && f.indexName() != null) {
                indexNames.add(f.indexName());
            }
        }
        for (String indexName : indexNames) {
            tb.addField(constant("INDEX_" + toConstantCase(indexName), indexName, "GSI index name: " + indexName));
        }

        Map<String, String> attributeConstants = new HashMap<>();
        for (FieldDescriptor f : model.storedFields()) {
            String constName = "ATTR_" + toConstantCase(resolveCodeName(f.sourceName()));
            if (attributeConstants.putIfAbsent(constName, f.storedName()) == null) {
                tb.addField(constant(constName, f.storedName(), null));
            }
        }

        if (isKeyLiteral(pk) && (sk == null || isKeyLiteral(sk))) {
            tb.addMethod(keyFactory(pk, sk));
        }

        JavaFile.builder(pkg + ".keys", tb.build())
            .skipJavaLangImports(true)
            .build()
            .writeTo(outDir);
    }

    private static FieldSpec constant(String name, String value, String javadoc) {
        FieldSpec.Builder fb = FieldSpec.builder(String.class, name, Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("$S", value);
        if (javadoc != null) {
            fb.addJavadoc("$L\n", javadoc);
        }
        return fb.build();
    }

    /** Keys that can be written as plain S or N attributes without the codec. */
    private static boolean isKeyLiteral(FieldDescriptor f) {
        return f.format() == null && (f.type() == FieldType.STRING || f.type() == FieldType.INT
            || f.type() == FieldType.LONG || f.type() == FieldType.DECIMAL);
    }

    private static MethodSpec keyFactory(FieldDescriptor pk, FieldDescriptor sk) {
        String pkParam = resolveCodeName(pk.sourceName());
        MethodSpec.Builder key = MethodSpec.methodBuilder("key")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Build the primary key record for get operations.\n")
            .addJavadoc("@param $L partition key value, as stored\n", pkParam)
            .addParameter(mapFieldType(pk), pkParam)
            .returns(RAW_RECORD);
        CodeBlock.Builder statement = CodeBlock.builder()
            .add("return $T.builder()\n", RAW_RECORD)
            .add(".$L(PARTITION_KEY_ATTRIBUTE, $L)\n", keyPut(pk), pkParam);
        if (sk != null) {
            String skParam = resolveCodeName(sk.sourceName());
            key.addJavadoc("@param $L sort key value, as stored\n", skParam)
                .addParameter(mapFieldType(sk), skParam);
            statement.add(".$L(SORT_KEY_ATTRIBUTE, $L)\n", keyPut(sk), skParam);
        }
        statement.add(".build()");
        return key.addStatement(statement.build()).build();
    }

    private static String keyPut(FieldDescriptor f) {
        return f.type() == FieldType.STRING ? "s" : "n";
    }

    // =========================================================================
    // Table Mapping Generation
    // =========================================================================

    /**
     * Generate the per-table mapping class: accessor registration and table factories.
     */
    private void generateTableMapping(List<SchemaModel> models, String pkg, Path outDir) throws IOException {
        String tableName = models.get(0).tableName();
        String className = cap(toJavaCamelCase(tableName)) + "Mapping";

        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Mapping setup for table $L.\n", tableName);

        tb.addField(constant("TABLE_NAME", tableName, null));
        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        MethodSpec.Builder register = MethodSpec.methodBuilder("register")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Register the generated accessor of every entity stored in $L.\n", tableName)
            .addParameter(MAPPING_CONTEXT_BUILDER, "builder")
            .returns(MAPPING_CONTEXT_BUILDER);
        CodeBlock.Builder chain = CodeBlock.builder().add("return builder");
        for (SchemaModel model : models) {
            chain.add("\n.register($S, $T.INSTANCE)", model.entityId(),
                ClassName.get(pkg, model.entityId() + "Accessor"));
        }
        register.addStatement(chain.build());
        tb.addMethod(register.build());

        tb.addMethod(MethodSpec.methodBuilder("context")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Mapping context over {@code catalog} with every accessor of $L registered.\n", tableName)
            .addParameter(SCHEMA_CATALOG, "catalog")
            .returns(MAPPING_CONTEXT)
            .addStatement("return register($T.builder(catalog)).build()", MAPPING_CONTEXT)
            .build());

        for (SchemaModel model : models) {
            ClassName entityClass = ClassName.get(pkg, model.entityId());
            tb.addMethod(MethodSpec.methodBuilder(uncap(model.entityId()) + "Table")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addParameter(MAPPING_CONTEXT, "context")
                .addParameter(RECORD_SOURCE, "source")
                .addParameter(RECORD_SINK, "sink")
                .returns(ParameterizedTypeName.get(ENTITY_TABLE, entityClass))
                .addStatement("return new $T<>(context, $S, source, sink)", ENTITY_TABLE, model.entityId())
                .build());
        }

        JavaFile.builder(pkg, tb.build())
            .skipJavaLangImports(true)
            .build()
            .writeTo(outDir);
    }

    // =========================================================================
    // Plain-Java Boilerplate Helpers
    // =========================================================================

    private static void addConstructors(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Default no-arg constructor (used by the generated accessor).\n")
            .build());

        if (!fields.isEmpty()) {
            MethodSpec.Builder allArgs = MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc("All-args constructor.\n");
            for (PlainField f : fields) {
                allArgs.addParameter(f.type(), f.codeName());
            }
            for (PlainField f : fields) {
                allArgs.addStatement("this.$L = $L", f.codeName(), f.codeName());
            }
            tb.addMethod(allArgs.build());
        }
    }

    private static void addSetters(TypeSpec.Builder tb, List<PlainField> fields) {
        for (PlainField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("set" + cap(f.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type(), f.codeName())
                .addStatement("this.$L = $L", f.codeName(), f.codeName())
                .build());
        }
    }

    /**
     * Emit a static {@code Builder} inner class and a {@code builder()} factory method.
     */
    private static void addBuilderClass(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName builderRef = ClassName.bestGuess("Builder");
        ClassName entityRef = ClassName.bestGuess(className);

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(builderRef)
            .addStatement("return new Builder()")
            .build());

        TypeSpec.Builder builderTb = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC);

        for (PlainField f : fields) {
            builderTb.addField(FieldSpec.builder(f.type(), f.codeName(), Modifier.PRIVATE).build());
        }

        for (PlainField f : fields) {
            builderTb.addMethod(MethodSpec.methodBuilder(f.codeName())
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type(), f.codeName())
                .returns(builderRef)
                .addStatement("this.$L = $L", f.codeName(), f.codeName())
                .addStatement("return this")
                .build());
        }

        MethodSpec.Builder buildMethod = MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(entityRef);
        if (fields.isEmpty()) {
            buildMethod.addStatement("return new $T()", entityRef);
        } else {
            String argList = fields.stream().map(PlainField::codeName).collect(Collectors.joining(", "));
            buildMethod.addStatement("return new $T($L)", entityRef, argList);
        }
        builderTb.addMethod(buildMethod.build());

        tb.addType(builderTb.build());
    }

    private static void addEqualsHashCodeToString(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName objectsClass = ClassName.get("java.util", "Objects");
        ClassName arraysClass = ClassName.get("java.util", "Arrays");
        ClassName entityRef = ClassName.bestGuess(className);

        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.get(Object.class), "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", entityRef);
        equalsMethod.addStatement("$T that = ($T) o", entityRef, entityRef);
        if (fields.isEmpty()) {
            equalsMethod.addStatement("return true");
        } else {
            StringBuilder condExpr = new StringBuilder("return ");
            List<Object> condArgs = new ArrayList<>();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) condExpr.append("\n    && ");
                condExpr.append("$T.equals($L, that.$L)");
                condArgs.add(isArray(fields.get(i)) ? arraysClass : objectsClass);
                condArgs.add(fields.get(i).codeName());
                condArgs.add(fields.get(i).codeName());
            }
            equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        }
        tb.addMethod(equalsMethod.build());

        MethodSpec.Builder hashCodeMethod = MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class);
        if (fields.isEmpty()) {
            hashCodeMethod.addStatement("return 0");
        } else {
            List<CodeBlock> hashArgs = new ArrayList<>();
            for (PlainField f : fields) {
                hashArgs.add(isArray(f)
                    ? CodeBlock.of("$T.hashCode($L)", arraysClass, f.codeName())
                    : CodeBlock.of("$L", f.codeName()));
            }
            hashCodeMethod.addStatement("return $T.hash($L)", objectsClass, CodeBlock.join(hashArgs, ", "));
        }
        tb.addMethod(hashCodeMethod.build());

        MethodSpec.Builder toStringMethod = MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class));
        if (fields.isEmpty()) {
            toStringMethod.addStatement("return $S", className + "{}");
        } else {
            StringBuilder tsExpr = new StringBuilder("return $S");
            List<Object> tsArgs = new ArrayList<>();
            tsArgs.add(className + "{" + fields.get(0).codeName() + "=");
            tsExpr.append(" + $L");
            tsArgs.add(fields.get(0).codeName());
            for (int i = 1; i < fields.size(); i++) {
                tsExpr.append(" + $S + $L");
                tsArgs.add(", " + fields.get(i).codeName() + "=");
                tsArgs.add(fields.get(i).codeName());
            }
            tsExpr.append(" + $S");
            tsArgs.add("}");
            toStringMethod.addStatement(tsExpr.toString(), tsArgs.toArray());
        }
        tb.addMethod(toStringMethod.build());
    }

    private static boolean isArray(PlainField f) {
        return f.type() instanceof ArrayTypeName;
    }

    // =========================================================================
    // Type Mapping
    // =========================================================================

    /**
     * Map a compiled field to the Java type the mapper runtime reads and writes for it.
     */
    static TypeName mapFieldType(FieldDescriptor field) {
        FieldType type = field.type();
        if (type == FieldType.LIST) {
            TypeName element = field.elementType() == null
                ? ClassName.get(Object.class)
                : mapScalarType(field.elementType());
            return ParameterizedTypeName.get(ClassName.get(List.class), element);
        }
        if (type.isSet()) {
            TypeName element = type == FieldType.BINARY_SET
                ? ClassName.get(ByteBuffer.class)
                : mapScalarType(type.elementType());
            return ParameterizedTypeName.get(ClassName.get(Set.class), element);
        }
        if (type == FieldType.MAP) {
            return ParameterizedTypeName.get(ClassName.get(Map.class), ClassName.get(String.class),
                ClassName.get(Object.class));
        }
        return mapScalarType(type);
    }

    private static TypeName mapScalarType(FieldType type) {
        return switch (type) {
            case STRING, ENUM -> ClassName.get(String.class);
            case INT -> ClassName.get(Integer.class);
            case LONG -> ClassName.get(Long.class);
            case FLOAT -> ClassName.get(Float.class);
            case DOUBLE -> ClassName.get(Double.class);
            case DECIMAL -> ClassName.get(BigDecimal.class);
            case BOOLEAN -> ClassName.get(Boolean.class);
            case BINARY -> ArrayTypeName.of(TypeName.BYTE);
            case TIMESTAMP -> ClassName.get(OffsetDateTime.class);
            case EPOCH -> ClassName.get(Instant.class);
            case DATE -> ClassName.get(LocalDate.class);
            case MAP -> ParameterizedTypeName.get(ClassName.get(Map.class), ClassName.get(String.class),
                ClassName.get(Object.class));
            default -> ClassName.get(Object.class);
        };
    }

    // =========================================================================
    // Utility Methods
    // =========================================================================

    private static String descriptionOf(EntityDefinition d, String fieldName) {
        for (EntityDefinition.Field f : d.fields) {
            if (fieldName.equals(f.name) && f.description != null && !f.description.isEmpty()) {
                return f.description;
            }
        }
        return null;
    }

    /**
     * Convert a string to UPPER_SNAKE_CASE for constant names.
     */
    static String toConstantCase(String name) {
        if (name == null || name.isEmpty()) return name;
        String result = name.replace("-", "_");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < result.length(); i++) {
            char c = result.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(result.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase();
    }

    private static String cap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase() + s.substring(1);
    }

    private static String uncap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toLowerCase() + s.substring(1);
    }
}
