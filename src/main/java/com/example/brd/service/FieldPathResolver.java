package com.example.brd.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Service;

/**
 * Resolves dotted field paths such as {@code requirement.story.asA} against a requirement.
 * <p>
 * Absent values are reported as {@link MissingNode}, which is distinct from an explicit
 * JSON {@code null} ({@code NullNode}) or {@code false} stored at the path.
 */
@Service
public class FieldPathResolver {

    private static final String ROOT = "requirement";
    private static final String ROOT_PREFIX = ROOT + ".";

    /**
     * @param record      requirement object
     * @param dottedPath  path relative to the requirement, optionally prefixed with "requirement."
     * @return the value at the path, or {@link MissingNode} when any step is missing or not an object
     */
    public JsonNode resolve(JsonNode record, String dottedPath) {
        if (record == null || dottedPath == null || dottedPath.isBlank()) {
            return MissingNode.getInstance();
        }

        String path = dottedPath.strip();
        if (path.equals(ROOT)) {
            return record;
        }
        if (path.startsWith(ROOT_PREFIX)) {
            path = path.substring(ROOT_PREFIX.length());
        }

        JsonNode current = record;
        for (String key : path.split("\\.", -1)) {
            if (!current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.path(key);
        }
        return current;
    }
}
