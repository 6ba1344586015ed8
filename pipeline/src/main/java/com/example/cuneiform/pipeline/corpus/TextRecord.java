package com.example.cuneiform.pipeline.corpus;

import com.example.cuneiform.pipeline.cdl.CdlNode;

import java.util.List;
import java.util.Objects;

/**
 * A parsed text document: its identifier and top-level CDL nodes.
 */
public record TextRecord(String id, List<CdlNode> nodes) {

    public TextRecord {
        Objects.requireNonNull(id, "id");
        nodes = List.copyOf(nodes);
    }
}
