package model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * References found in one formula.
 * <ul>
 *   <li>directRefs: single cells, order of first appearance, no duplicates</li>
 *   <li>rangeRefs: ranges, same ordering rules</li>
 *   <li>rangeMembers: member cell -> ranges (in discovery order) that contain it</li>
 * </ul>
 * Sheets are exactly as written in the formula; unqualified references are not resolved here.
 */
public final class ExtractedReferences {

    private static final ExtractedReferences EMPTY =
            new ExtractedReferences(Collections.emptySet(), Collections.emptySet(), Collections.emptyMap());

    private final Set<CellAddress> directRefs;
    private final Set<RangeAddress> rangeRefs;
    private final Map<CellAddress, Set<RangeAddress>> rangeMembers;

    public ExtractedReferences(Set<CellAddress> directRefs,
                               Set<RangeAddress> rangeRefs,
                               Map<CellAddress, Set<RangeAddress>> rangeMembers) {
        this.directRefs = Collections.unmodifiableSet(new LinkedHashSet<>(directRefs));
        this.rangeRefs = Collections.unmodifiableSet(new LinkedHashSet<>(rangeRefs));

        Map<CellAddress, Set<RangeAddress>> copy = new LinkedHashMap<>();
        rangeMembers.forEach((cell, owners) ->
                copy.put(cell, Collections.unmodifiableSet(new LinkedHashSet<>(owners))));
        this.rangeMembers = Collections.unmodifiableMap(copy);
    }

    public static ExtractedReferences empty() {
        return EMPTY;
    }

    public Set<CellAddress> getDirectRefs() { return directRefs; }
    public Set<RangeAddress> getRangeRefs() { return rangeRefs; }
    public Map<CellAddress, Set<RangeAddress>> getRangeMembers() { return rangeMembers; }

    public boolean isEmpty() {
        return directRefs.isEmpty() && rangeRefs.isEmpty() && rangeMembers.isEmpty();
    }

    @Override
    public String toString() {
        return "direct=" + directRefs + " ranges=" + rangeRefs + " members=" + rangeMembers.size();
    }
}
