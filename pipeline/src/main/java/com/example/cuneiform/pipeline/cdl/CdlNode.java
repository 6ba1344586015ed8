package com.example.cuneiform.pipeline.cdl;

/**
 * A node of a CDL annotation tree. Exactly one {@link NodeKind} applies to every node and callers
 * dispatch on it rather than on the runtime class.
 */
public interface CdlNode {

    NodeKind kind();
}
