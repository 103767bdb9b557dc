package io.swarmhive.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmhive.util.Jsons;

import java.util.List;

/**
 * Typed operations of the coordination relay, all routed through {@link ResilientRelayClient#call}.
 */
public final class RelayClient {
    private final ResilientRelayClient client;
    private final String projectKey;

    public RelayClient(ResilientRelayClient client, String projectKey) {
        this.client = client;
        this.projectKey = projectKey;
    }

    public JsonNode register(String agentName, String program, String model, String taskDescription) {
        ObjectNode args = base();
        args.put("name", agentName);
        args.put("program", program);
        args.put("model", model);
        putIfPresent(args, "task_description", taskDescription);
        return client.call("register_agent", args);
    }

    public JsonNode send(String sender, List<String> to, String subject, String body, String threadId, String importance) {
        ObjectNode args = base();
        args.put("sender_name", sender);
        strings(args.putArray("to"), to);
        args.put("subject", subject);
        args.put("body_md", body);
        putIfPresent(args, "thread_id", threadId);
        putIfPresent(args, "importance", importance);
        return client.call("send_message", args);
    }

    public JsonNode fetchInbox(String agentName, int limit, boolean includeBodies) {
        ObjectNode args = base();
        args.put("agent_name", agentName);
        args.put("limit", Math.max(1, limit));
        args.put("include_bodies", includeBodies);
        return client.call("fetch_inbox", args);
    }

    public JsonNode acknowledge(String agentName, long messageId) {
        ObjectNode args = base();
        args.put("agent_name", agentName);
        args.put("message_id", messageId);
        return client.call("acknowledge_message", args);
    }

    public JsonNode reserve(String agentName, List<String> paths, long ttlSeconds, boolean exclusive, String reason) {
        ObjectNode args = base();
        args.put("agent_name", agentName);
        strings(args.putArray("paths"), paths);
        args.put("ttl_seconds", ttlSeconds);
        args.put("exclusive", exclusive);
        putIfPresent(args, "reason", reason);
        return client.call("file_reservation_paths", args);
    }

    public JsonNode release(String agentName, List<String> paths) {
        ObjectNode args = base();
        args.put("agent_name", agentName);
        if (paths != null && !paths.isEmpty()) {
            strings(args.putArray("paths"), paths);
        }
        return client.call("release_file_reservations", args);
    }

    public JsonNode summarizeThread(String threadId, boolean includeExamples) {
        ObjectNode args = base();
        args.put("thread_id", threadId);
        args.put("include_examples", includeExamples);
        return client.call("summarize_thread", args);
    }

    private ObjectNode base() {
        ObjectNode args = Jsons.compact().createObjectNode();
        args.put("project_key", projectKey);
        return args;
    }

    private static void putIfPresent(ObjectNode args, String field, String value) {
        if (value != null && !value.isBlank()) {
            args.put(field, value);
        }
    }

    private static void strings(ArrayNode array, List<String> values) {
        for (String value : values) {
            array.add(value);
        }
    }
}
