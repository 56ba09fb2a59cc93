package org.pragmatica.latex.util;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.error.LatexError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    void map_success_transformsValue() {
        var result = Result.success(20).map(v -> v + 1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.unwrap()).isEqualTo(21);
    }

    @Test
    void flatMap_failure_keepsCause() {
        Result<Integer> failed = Result.failure(new LatexError.DocumentMarkerMissing("\\begin{document}"));

        var result = failed.flatMap(v -> Result.success(v * 2));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.<Object>fold(cause -> cause, v -> null))
            .isEqualTo(new LatexError.DocumentMarkerMissing("\\begin{document}"));
    }

    @Test
    void unwrap_failure_throwsWithMessage() {
        Result<String> failed = Result.failure(new LatexError.InvalidSelectorSyntax("oops"));

        assertThatThrownBy(failed::unwrap)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Invalid selector oops");
    }

    @Test
    void allOf_returnsFirstFailure() {
        var result = Result.allOf(List.of(Result.success("a"),
                                          Result.<String>failure(new LatexError.InvalidSelectorSyntax("x")),
                                          Result.<String>failure(new LatexError.InvalidSelectorSyntax("y"))));

        assertThat(result.<Object>fold(cause -> cause, v -> null))
            .isEqualTo(new LatexError.InvalidSelectorSyntax("x"));
    }

    @Test
    void allOf_allSuccessful_collectsInOrder() {
        var result = Result.allOf(List.of(Result.success(1), Result.success(2)));

        assertThat(result.unwrap()).containsExactly(1, 2);
    }
}
