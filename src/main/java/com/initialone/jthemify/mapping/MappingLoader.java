package com.initialone.jthemify.mapping;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.ThemeConvention;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Reads a {@link MappingTable} from YAML ({@code .yaml}, {@code .yml}) or JSON (anything else).
 * Keys are snake_case; unknown keys are ignored so mapping files can carry extra notes.
 */
public class MappingLoader {

    public MappingTable load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Mapping file not found");
        }
        MappingTable table = read(mapperFor(file), Files.readString(file), file.toString());
        System.out.println("[map] loaded " + file.getFileName()
                + ": strict=" + table.strictMappings.size()
                + " extension groups=" + table.extensions.size()
                + " preserved=" + table.preserved.size());
        return table;
    }

    public MappingTable parseYaml(String content) throws IOException {
        return read(yamlMapper(), content, "<yaml>");
    }

    public MappingTable parseJson(String content) throws IOException {
        return read(jsonMapper(), content, "<json>");
    }

    private static MappingTable read(ObjectMapper om, String content, String source) throws IOException {
        JsonNode root = om.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IOException("Invalid mapping configuration in " + source + ": root must be a map");
        }
        return normalize(om.treeToValue(root, MappingTable.class));
    }

    /** 文件里显式写 null 的字段补成空集合/默认约定 */
    private static MappingTable normalize(MappingTable t) {
        if (t.version == null) t.version = "1.0";
        if (t.namespaces == null) t.namespaces = new ArrayList<>();
        if (t.strictMappings == null) t.strictMappings = new LinkedHashMap<>();
        if (t.extensions == null) t.extensions = new LinkedHashMap<>();
        if (t.preserved == null) t.preserved = new ArrayList<>();
        ThemeConvention d = ThemeConvention.defaults();
        if (t.convention == null) {
            t.convention = d;
        } else {
            ThemeConvention c = t.convention;
            if (c.handleType == null) c.handleType = d.handleType;
            if (c.handleName == null) c.handleName = d.handleName;
            if (c.accessorType == null) c.accessorType = d.accessorType;
            if (c.accessorMethod == null) c.accessorMethod = d.accessorMethod;
            if (c.accessorImport == null) c.accessorImport = d.accessorImport;
            if (c.renderMethod == null) c.renderMethod = d.renderMethod;
            if (c.uiTypeMarker == null) c.uiTypeMarker = d.uiTypeMarker;
            if (c.extensionLookup == null) c.extensionLookup = d.extensionLookup;
        }
        return t;
    }

    static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper() : jsonMapper();
    }

    private static ObjectMapper yamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper jsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper om) {
        return om.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
