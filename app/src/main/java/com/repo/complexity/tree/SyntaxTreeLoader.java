package com.repo.complexity.tree;

import com.repo.complexity.core.Location;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a syntax tree from a YAML (or JSON) document.
 *
 * Each node is a mapping with a required {@code type}, optional {@code loc}
 * and {@code children}; every other key becomes an attribute. {@code loc} is
 * either {@code {start: 1, end: 4}} or the ESTree form
 * {@code {start: {line: 1}, end: {line: 4}}}.
 *
 * Keys with a null value are dropped, so a flag such as ESTree's
 * {@code test: null} must be written as {@code test: false} to survive.
 */
public class SyntaxTreeLoader {

    private static final String TYPE = "type";
    private static final String LOC = "loc";
    private static final String CHILDREN = "children";

    public SyntaxNode load(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            return fromDocument(new Yaml().load(is));
        }
    }

    public SyntaxNode parse(String document) {
        return fromDocument(new Yaml().load(document));
    }

    private SyntaxNode fromDocument(Object document) {
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Syntax tree document must be a mapping");
        }
        return toNode((Map<?, ?>) document);
    }

    private SyntaxNode toNode(Map<?, ?> data) {
        Object type = data.get(TYPE);
        if (type == null) {
            throw new IllegalArgumentException("Syntax tree node without a type: " + data.keySet());
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!key.equals(TYPE) && !key.equals(LOC) && !key.equals(CHILDREN) && entry.getValue() != null) {
                attributes.put(key, entry.getValue());
            }
        }

        List<SyntaxNode> children = new ArrayList<>();
        Object rawChildren = data.get(CHILDREN);
        if (rawChildren instanceof List) {
            for (Object child : (List<?>) rawChildren) {
                if (!(child instanceof Map)) {
                    throw new IllegalArgumentException("Child of " + type + " is not a node: " + child);
                }
                children.add(toNode((Map<?, ?>) child));
            }
        } else if (rawChildren != null) {
            throw new IllegalArgumentException("children of " + type + " must be a list");
        }

        return new SyntaxNode(type.toString(), attributes, children, toLocation(data.get(LOC)));
    }

    private Location toLocation(Object loc) {
        if (!(loc instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) loc;
        Integer start = lineOf(map.get("start"));
        Integer end = lineOf(map.get("end"));
        if (start == null || end == null) {
            return null;
        }
        return new Location(start, end);
    }

    private Integer lineOf(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof Map) {
            Object line = ((Map<?, ?>) value).get("line");
            if (line instanceof Number) {
                return ((Number) line).intValue();
            }
        }
        return null;
    }
}
