package service;

import java.util.Map;
import java.util.Set;

import model.AnalysisResult;
import model.CellAddress;
import model.DependencyGraph;
import model.ExtractedReferences;
import model.FunctionUsageTable;
import model.RangeAddress;
import model.SheetCell;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the dependency graph from the cells of a workbook.
 * <p>
 * For every formula cell {@code S!X}:
 * <ul>
 *   <li>{@code S!X -> ref} for each referenced cell</li>
 *   <li>{@code S!X -> range} for each referenced range</li>
 *   <li>{@code range -> member} for each cell inside a referenced range</li>
 * </ul>
 * References without a sheet belong to the sheet of the formula. Each call to
 * {@link #build(Iterable)} starts from an empty graph and an empty function table.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LogManager.getLogger(DependencyGraphBuilder.class);

    private final ReferenceExtractor extractor;
    private final FunctionUsageCounter counter;

    public DependencyGraphBuilder(ReferenceExtractor extractor, FunctionUsageCounter counter) {
        this.extractor = extractor;
        this.counter = counter;
    }

    public DependencyGraphBuilder() {
        this(new ReferenceExtractor(), new FunctionUsageCounter());
    }

    public AnalysisResult build(Iterable<SheetCell> cells) {
        DependencyGraph graph = new DependencyGraph();
        FunctionUsageTable usage = new FunctionUsageTable();
        int formulas = 0;

        String currentSheet = null;
        for (SheetCell cell : cells) {
            if (!cell.getSheetName().equals(currentSheet)) {
                currentSheet = cell.getSheetName();
                log.debug("-- Analyzing sheet: {} --", currentSheet);
            }
            if (!cell.isFormula()) continue;

            addFormula(graph, usage, cell.getSheetName(), cell.getCoordinate(), cell.getFormula());
            formulas++;
        }

        log.info("Formulas analysed: {} -> {} nodes, {} edges, {} distinct functions",
                formulas, graph.nodeCount(), graph.edgeCount(), usage.size());
        return new AnalysisResult(graph, usage, formulas);
    }

    /**
     * Adds one formula cell to {@code graph} and its function calls to {@code usage}.
     */
    public void addFormula(DependencyGraph graph, FunctionUsageTable usage,
                           String sheetName, String coordinate, String formula) {

        usage.merge(counter.count(formula));

        CellAddress current = CellAddress.parse(sheetName, coordinate);
        graph.addNode(current, sheetName);
        log.debug("Formula in {}: {}", current, formula);

        ExtractedReferences refs;
        try {
            refs = extractor.extract(formula);
        } catch (RuntimeException ex) {
            log.warn("Cannot extract references from {} ({}): cell kept without dependencies",
                    current, formula, ex);
            return;
        }
        if (refs.isEmpty()) {
            log.debug("  No references in {}", current);
            return;
        }

        for (CellAddress ref : refs.getDirectRefs()) {
            CellAddress resolved = ref.qualify(sheetName);
            graph.addNode(resolved, resolved.getSheet());
            if (graph.addEdge(current, resolved)) {
                log.debug("  Depends on: {}", resolved);
            }
        }

        for (RangeAddress range : refs.getRangeRefs()) {
            RangeAddress resolved = range.qualify(sheetName);
            graph.addNode(resolved, resolved.getSheet());
            if (graph.addEdge(current, resolved)) {
                log.debug("  Depends on range: {}", resolved);
            }
        }

        for (Map.Entry<CellAddress, Set<RangeAddress>> e : refs.getRangeMembers().entrySet()) {
            CellAddress member = e.getKey().qualify(sheetName);
            graph.addNode(member, member.getSheet());
            for (RangeAddress owner : e.getValue()) {
                RangeAddress resolvedOwner = owner.qualify(sheetName);
                graph.addNode(resolvedOwner, resolvedOwner.getSheet());
                graph.addEdge(resolvedOwner, member);
            }
        }
    }
}
