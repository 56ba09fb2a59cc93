package org.pragmatica.latex.chunk;

/**
 * A region of the document body between two consecutive boundaries.
 *
 * @param startLine   1-based line where the chunk starts
 * @param endLine     last line of the chunk, taken as the 0-based line of the next boundary
 * @param startOffset offset of the first character, in code points
 * @param length      number of code points
 */
public record Chunk(int startLine, int endLine, int startOffset, int length) {

    public int endOffset() {
        return startOffset + length;
    }

    /**
     * Listing line: {@code lines S E chars O N}.
     */
    public String describe() {
        return "lines " + startLine + " " + endLine + " chars " + startOffset + " " + length;
    }
}
