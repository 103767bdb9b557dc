package io.swarmhive.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.swarmhive.model.Cell;
import io.swarmhive.model.Comment;
import io.swarmhive.model.Dependency;
import io.swarmhive.util.Hashing;
import io.swarmhive.util.Jsons;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Line format of the export file, plus the canonical form used for content hashing.
 */
public final class JsonlCodec {
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private JsonlCodec() {
    }

    public static CellExport toExport(Cell cell, List<Dependency> dependencies, List<String> labels, List<Comment> comments) {
        List<CellExport.DependencyExport> deps = new ArrayList<>(dependencies.size());
        for (Dependency d : dependencies) {
            deps.add(new CellExport.DependencyExport(d.dependsOnId(), d.relationship().wire()));
        }
        List<CellExport.CommentExport> notes = new ArrayList<>(comments.size());
        for (Comment c : comments) {
            notes.add(new CellExport.CommentExport(c.author(), c.body()));
        }
        return new CellExport(
                cell.id(),
                cell.title(),
                blankToNull(cell.description()),
                cell.isDeleted() ? CellExport.TOMBSTONE : cell.status().wire(),
                cell.priority(),
                cell.type().wire(),
                formatTimestamp(cell.createdAtMs()),
                formatTimestamp(cell.updatedAtMs()),
                cell.closedAtMs() == null ? null : formatTimestamp(cell.closedAtMs()),
                blankToNull(cell.assignee()),
                blankToNull(cell.parentId()),
                deps,
                labels,
                notes
        );
    }

    public static String toLine(CellExport export) {
        return Jsons.toCompactJson(export);
    }

    public static CellExport parseLine(String line) throws JsonProcessingException {
        CellExport export = Jsons.compact().readValue(line, CellExport.class);
        if (export.id() == null || export.id().isBlank()) {
            throw new IllegalArgumentException("missing id");
        }
        return export;
    }

    /**
     * Id of a raw line, or null when the line is not a JSON object with a string id.
     */
    public static String idOf(String line) {
        try {
            JsonNode node = Jsons.compact().readTree(line);
            JsonNode id = node == null ? null : node.get("id");
            return id != null && id.isTextual() ? id.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * SHA-256 over the export with keys sorted, so field order never changes the hash.
     */
    public static String contentHash(CellExport export) {
        try {
            JsonNode tree = Jsons.compact().valueToTree(export);
            Object sorted = CANONICAL.treeToValue(tree, Object.class);
            return Hashing.sha256Hex(CANONICAL.writeValueAsString(sorted));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to hash cell " + export.id(), e);
        }
    }

    public static String formatTimestamp(long epochMs) {
        return ISO_MILLIS.format(Instant.ofEpochMilli(epochMs));
    }

    public static long parseTimestamp(String iso, long fallback) {
        if (iso == null || iso.isBlank()) {
            return fallback;
        }
        return Instant.parse(iso.trim()).toEpochMilli();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
