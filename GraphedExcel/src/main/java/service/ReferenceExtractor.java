package service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import model.AppConfig;
import model.CellAddress;
import model.ExtractedReferences;
import model.RangeAddress;
import model.Reference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns one formula into its direct cell references, range references and range members.
 * <p>
 * A cell covered by several ranges of the same formula keeps all of its owning ranges.
 * Ranges larger than the expansion limit are reported without members.
 */
public class ReferenceExtractor {

    private static final Logger log = LogManager.getLogger(ReferenceExtractor.class);

    private final ReferenceScanner scanner;
    private final long maxExpandedCells;

    public ReferenceExtractor(ReferenceScanner scanner, long maxExpandedCells) {
        if (maxExpandedCells < 1) throw new IllegalArgumentException("maxExpandedCells must be positive");
        this.scanner = scanner;
        this.maxExpandedCells = maxExpandedCells;
    }

    public ReferenceExtractor() {
        this(new ReferenceScanner(), AppConfig.DEFAULT_MAX_EXPANDED_CELLS);
    }

    public ExtractedReferences extract(String formula) {
        if (formula == null || formula.isEmpty()) return ExtractedReferences.empty();

        Set<CellAddress> direct = new LinkedHashSet<>();
        Set<RangeAddress> ranges = new LinkedHashSet<>();

        for (Reference ref : scanner.scan(formula)) {
            if (ref instanceof RangeAddress) {
                ranges.add((RangeAddress) ref);
            } else {
                direct.add((CellAddress) ref);
            }
        }

        Map<CellAddress, Set<RangeAddress>> members = new LinkedHashMap<>();
        for (RangeAddress range : ranges) {
            if (range.getCellCount() > maxExpandedCells) {
                log.warn("Range {} has {} cells (limit {}): members not expanded",
                        range, range.getCellCount(), maxExpandedCells);
                continue;
            }
            for (CellAddress cell : range.cells()) {
                members.computeIfAbsent(cell, k -> new LinkedHashSet<>()).add(range);
            }
        }

        if (direct.isEmpty() && ranges.isEmpty()) return ExtractedReferences.empty();
        return new ExtractedReferences(direct, ranges, members);
    }
}
