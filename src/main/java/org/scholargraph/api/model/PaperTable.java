package org.scholargraph.api.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The filtered papers of one lookback window, together with what produced them.
 *
 * @param lookbackYears The lookback window.
 * @param signature     Signature of the filter criteria.
 * @param papers        The papers, in store order.
 */
public record PaperTable(int lookbackYears, String signature, List<Paper> papers) {

    public PaperTable {
        papers = List.copyOf(papers);
    }

    public static PaperTable empty(int lookbackYears, String signature) {
        return new PaperTable(lookbackYears, signature, List.of());
    }

    public boolean isEmpty() {
        return papers.isEmpty();
    }

    public int size() {
        return papers.size();
    }

    public Set<String> paperIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Paper paper : papers) {
            ids.add(paper.id());
        }
        return ids;
    }

    public OptionalInt minYear() {
        return papers.stream().mapToInt(Paper::year).min();
    }
}
