package org.pragmatica.latex.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLocationTest {

    @Test
    void advance_plainText_movesColumn() {
        var location = SourceLocation.START.advance("abc");

        assertThat(location).isEqualTo(SourceLocation.at(3, 0, 3));
    }

    @Test
    void advance_newline_resetsColumnAndCountsLine() {
        var location = SourceLocation.START.advance("ab\ncd");

        assertThat(location.offset()).isEqualTo(5);
        assertThat(location.line()).isEqualTo(1);
        assertThat(location.column()).isEqualTo(2);
    }

    @Test
    void advance_trailingNewline_endsAtColumnZero() {
        var location = SourceLocation.at(10, 2, 4).advance("x\n\n");

        assertThat(location).isEqualTo(SourceLocation.at(13, 4, 0));
    }

    @Test
    void advance_supplementaryCharacter_countsOneCodePoint() {
        var location = SourceLocation.START.advance("é\uD83D\uDE00x");

        assertThat(location.offset()).isEqualTo(3);
        assertThat(location.column()).isEqualTo(3);
    }

    @Test
    void advance_emptyText_returnsSameLocation() {
        var location = SourceLocation.at(7, 1, 2);

        assertThat(location.advance("")).isEqualTo(location);
    }

    @Test
    void toString_showsOneBasedLineAndColumn() {
        assertThat(SourceLocation.at(5, 0, 4).toString()).isEqualTo("1:5");
    }
}
