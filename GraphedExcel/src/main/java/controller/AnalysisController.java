package controller;

import java.io.File;
import java.io.PrintStream;

import model.AnalysisResult;
import model.AppConfig;
import model.AppModel;
import model.WorkbookContents;
import repository.ExcelRepository;
import repository.WorkbookLoadException;
import repository.WorkbookLoader;
import service.DependencyGraphBuilder;
import service.FunctionUsageCounter;
import service.ReferenceExtractor;
import service.ReferenceScanner;
import service.SummaryReporter;
import view.GraphImageRenderer;
import view.SpringLayout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One analysis run: load the workbook, build the graph, print the report, render the image.
 * Steps run in this order on the calling thread; a render failure never hides the report.
 */
public class AnalysisController {

    private static final Logger log = LogManager.getLogger(AnalysisController.class);

    private final AppModel model;
    private final AppConfig config;
    private final WorkbookLoader loader;
    private final DependencyGraphBuilder builder;
    private final SummaryReporter reporter;
    private final GraphImageRenderer renderer;
    private final PrintStream out;

    public AnalysisController(AppModel model, AppConfig config, WorkbookLoader loader,
                              DependencyGraphBuilder builder, SummaryReporter reporter,
                              GraphImageRenderer renderer, PrintStream out) {
        this.model = model;
        this.config = config;
        this.loader = loader;
        this.builder = builder;
        this.reporter = reporter;
        this.renderer = renderer;
        this.out = out;

        log.debug("AnalysisController initialised.");
    }

    /** Wires the default collaborators from {@code config}. */
    public static AnalysisController create(AppModel model, AppConfig config, PrintStream out) {
        ReferenceExtractor extractor = new ReferenceExtractor(new ReferenceScanner(), config.getMaxExpandedCells());
        DependencyGraphBuilder builder = new DependencyGraphBuilder(extractor, new FunctionUsageCounter());
        GraphImageRenderer renderer = new GraphImageRenderer(
                new SpringLayout(config.getLayoutIterations(), config.getLayoutSeed()),
                config.getImageWidth(), config.getImageHeight());

        return new AnalysisController(model, config, new ExcelRepository(), builder,
                new SummaryReporter(config.getTopNodes()), renderer, out);
    }

    /**
     * @throws WorkbookLoadException if the workbook cannot be read; nothing is printed then
     */
    public AnalysisResult run() throws WorkbookLoadException {
        File workbook = model.getWorkbookFile();
        log.info("Analysing workbook: {}", workbook);

        WorkbookContents contents = loader.load(workbook);
        AnalysisResult result = builder.build(contents.allCells());

        model.setGraph(result.getGraph());
        model.setFunctionUsage(result.getFunctionUsage());

        reporter.print(result.getGraph(), result.getFunctionUsage(), out);

        if (model.isVisualize()) {
            renderImage(workbook);
        } else {
            log.debug("Rendering skipped (--no-visualize).");
        }
        return result;
    }

    private void renderImage(File workbook) {
        File image = imageFileFor(workbook);

        out.println();
        out.println("Visualizing the graph of dependencies.");
        out.println("This might take a while...");
        out.flush();

        try {
            renderer.render(model.getGraph(), image, model.isKeepDirection());
            out.println("Graph image: " + image.getPath());
        } catch (Exception ex) {
            log.error("Graph rendering failed for {}", image.getPath(), ex);
        }
    }

    File imageFileFor(File workbook) {
        return new File(config.getImageDir(), workbook.getName() + ".png");
    }
}
