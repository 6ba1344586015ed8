package com.example.cuneiform.pipeline.cdl;

import com.google.gson.JsonArray;

/**
 * Alternative lemma choices. Kept opaque: the choices never contribute text.
 */
public record LinkGroup(String id, JsonArray choices) implements CdlNode {

    public LinkGroup {
        id = id == null ? "" : id;
        choices = choices == null ? new JsonArray() : choices.deepCopy();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINK_GROUP;
    }
}
