package org.pragmatica.latex.symbols;

import java.util.List;

/**
 * Distinct, sorted names found in a tree.
 *
 * @param commands   command names including the backslash
 * @param labels     keys of {@code \label{...}}
 * @param references keys of {@code \ref{...}}
 */
public record DocumentSymbols(List<String> commands, List<String> labels, List<String> references) {
    public DocumentSymbols {
        commands = List.copyOf(commands);
        labels = List.copyOf(labels);
        references = List.copyOf(references);
    }
}
