package com.example.cuneiform.pipeline.cdl;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

/**
 * Opaque cross-reference payload.
 */
public record LinkbaseNode(JsonElement payload) implements CdlNode {

    public LinkbaseNode {
        payload = payload == null ? JsonNull.INSTANCE : payload.deepCopy();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINKBASE;
    }
}
