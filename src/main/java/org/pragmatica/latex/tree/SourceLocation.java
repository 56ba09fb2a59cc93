package org.pragmatica.latex.tree;

/**
 * A position in source text. Offset counts Unicode code points, line and column are 0-based.
 */
public record SourceLocation(int offset, int line, int column) {

    public static final SourceLocation START = new SourceLocation(0, 0, 0);

    public static SourceLocation at(int offset, int line, int column) {
        return new SourceLocation(offset, line, column);
    }

    /**
     * Location reached after consuming {@code text} from this location.
     */
    public SourceLocation advance(String text) {
        int o = offset;
        int l = line;
        int c = column;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            o++;
            if (cp == '\n') {
                l++;
                c = 0;
            } else {
                c++;
            }
        }
        return new SourceLocation(o, l, c);
    }

    @Override
    public String toString() {
        return (line + 1) + ":" + (column + 1);
    }
}
