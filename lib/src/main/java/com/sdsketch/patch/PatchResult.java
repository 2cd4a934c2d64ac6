package com.sdsketch.patch;

import com.sdsketch.loader.LoaderMessage;
import java.util.List;
import java.util.Map;

/** Patched text plus what was assigned along the way. */
public final class PatchResult {
    private final String text;
    private final Map<String, Integer> variableIds;
    private final List<Integer> connectionIds;
    private final Map<String, String> renames;
    private final List<LoaderMessage> messages;

    public PatchResult(
            String text,
            Map<String, Integer> variableIds,
            List<Integer> connectionIds,
            Map<String, String> renames,
            List<LoaderMessage> messages) {
        this.text = text;
        this.variableIds = Map.copyOf(variableIds);
        this.connectionIds = List.copyOf(connectionIds);
        this.renames = Map.copyOf(renames);
        this.messages = List.copyOf(messages);
    }

    public String getText() {
        return text;
    }

    /** Id of each added variable, keyed by its final (possibly renamed) name. */
    public Map<String, Integer> getVariableIds() {
        return variableIds;
    }

    /** Ids of the added connections, in request order of those that were written. */
    public List<Integer> getConnectionIds() {
        return connectionIds;
    }

    /** Requested name to final name, for variables renamed to avoid a collision. */
    public Map<String, String> getRenames() {
        return renames;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
