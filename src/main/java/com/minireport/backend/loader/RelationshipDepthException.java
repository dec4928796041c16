package com.minireport.backend.loader;

public class RelationshipDepthException extends IllegalArgumentException {

    private final int actualDepth;
    private final int maxDepth;

    public RelationshipDepthException(int actualDepth, int maxDepth) {
        super("Relationship depth " + actualDepth + " exceeds maximum allowed depth " + maxDepth);
        this.actualDepth = actualDepth;
        this.maxDepth = maxDepth;
    }

    public int getActualDepth() {
        return actualDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
