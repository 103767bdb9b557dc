package io.swarmhive.export;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One line of the portable {@code issues.jsonl} file. Soft-deleted cells carry status
 * {@value #TOMBSTONE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CellExport(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("issue_type") String issueType,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("closed_at") String closedAt,
        @JsonProperty("assignee") String assignee,
        @JsonProperty("parent_id") String parentId,
        @JsonProperty("dependencies") List<DependencyExport> dependencies,
        @JsonProperty("labels") List<String> labels,
        @JsonProperty("comments") List<CommentExport> comments
) {
    public static final String TOMBSTONE = "tombstone";

    public CellExport {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        labels = labels == null ? List.of() : List.copyOf(labels);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    @JsonIgnore
    public boolean isTombstone() {
        return TOMBSTONE.equals(status);
    }

    public record DependencyExport(
            @JsonProperty("depends_on_id") String dependsOnId,
            @JsonProperty("type") String type
    ) {
    }

    public record CommentExport(
            @JsonProperty("author") String author,
            @JsonProperty("text") String text
    ) {
    }
}
