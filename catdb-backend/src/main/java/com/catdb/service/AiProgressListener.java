package com.catdb.service;

/**
 * Receives partial output while a generation request streams.
 */
@FunctionalInterface
public interface AiProgressListener {

    /**
     * Kind of a streamed piece.
     */
    enum ChunkKind {
        REASONING,
        CONTENT,
        USAGE,
        PREVIEW
    }

    /**
     * @param kind kind of piece
     * @param text piece text; usage arrives as JSON text
     */
    void onChunk(ChunkKind kind, String text);
}
