package com.trackforge;

import com.trackforge.controller.ExtractionController;
import com.trackforge.controller.MediaAnalysisController;
import com.trackforge.model.AnalysisResult;
import com.trackforge.model.AppSettings;
import com.trackforge.model.ExtractionState;
import com.trackforge.model.MediaTrack;
import com.trackforge.service.BridgeMediaWorkerApi;
import com.trackforge.service.MediaWorkerApi;
import com.trackforge.service.ProcessSupervisor;
import com.trackforge.service.ProgressChannel;
import com.trackforge.service.WorkerBridge;
import com.trackforge.service.WorkerLocator;
import com.trackforge.service.exception.CapabilityUnavailableException;
import com.trackforge.util.PathManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main Application Entry Point
 * TrackForge - extract audio, subtitle and video tracks from media files
 * <p>
 * Usage:
 * <pre>
 *   analyze &lt;file&gt;
 *   extract &lt;file&gt; &lt;outputDir&gt; [lang,lang...]
 *   batch &lt;outputDir&gt; &lt;path&gt; [path...]
 *   find &lt;path&gt; [path...]
 * </pre>
 */
public class MainApp {

    static {
        // Must be set before Logback initialises
        if (System.getProperty("trackforge.logs.dir") == null) {
            System.setProperty("trackforge.logs.dir", PathManager.getLogsDir().toString());
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(MainApp.class);
    private static final String VERSION = "1.0.0";

    private final ExecutorService uiExecutor;
    private final WorkerBridge bridge;
    private final ExtractionController extractionController;
    private final MediaAnalysisController analysisController;

    public MainApp(AppSettings settings) {
        this.uiExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "TrackForge-UI");
            t.setDaemon(true);
            return t;
        });

        this.bridge = new WorkerBridge(new ProcessSupervisor(), new ProgressChannel(), new WorkerLocator());
        MediaWorkerApi api = new BridgeMediaWorkerApi(bridge);

        this.analysisController = new MediaAnalysisController(api, uiExecutor);
        this.extractionController = new ExtractionController(api, uiExecutor);
        extractionController.applySettings(settings);
        extractionController.filePathProperty().bindBidirectional(analysisController.filePathProperty());
        extractionController.analysisProperty().bind(analysisController.analyzedProperty());

        extractionController.progressTextProperty().addListener((obs, oldVal, newVal) ->
            logger.info("[{}%] {}", extractionController.getProgressValue(), newVal));
    }

    public static void main(String[] args) {
        logger.info("Starting TrackForge v{}", VERSION);
        logger.info("Java version: {}", System.getProperty("java.version"));
        logger.info("OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));

        if (args.length == 0) {
            printUsage();
            System.exit(1);
            return;
        }

        MainApp app = new MainApp(AppSettings.load());
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "TrackForge-Shutdown"));

        int exitCode;
        try {
            exitCode = app.run(args) ? 0 : 1;
        } catch (CapabilityUnavailableException e) {
            logger.error("Worker runtime unavailable: {}", e.getMessage());
            exitCode = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted");
            exitCode = 1;
        } catch (ExecutionException e) {
            logger.error("Command failed", e.getCause());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    boolean run(String[] args) throws InterruptedException, ExecutionException {
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        switch (command) {
            case "analyze":
                return rest.size() == 1 && analyze(rest.get(0));
            case "extract":
                return rest.size() >= 2 && extract(rest.get(0), rest.get(1), rest.size() > 2 ? rest.get(2) : null);
            case "batch":
                return rest.size() >= 2 && batch(rest.get(0), rest.subList(1, rest.size()));
            case "find":
                return !rest.isEmpty() && find(rest);
            default:
                printUsage();
                return false;
        }
    }

    private boolean analyze(String file) throws InterruptedException, ExecutionException {
        analysisController.setFilePath(file);
        AnalysisResult result = analysisController.analyze().get();
        if (result == null) {
            logger.error(analysisController.getError());
            return false;
        }
        for (MediaTrack track : result.getTracks()) {
            logger.info("  {}", track);
        }
        logger.info("Languages: {}", result.availableLanguages());
        return true;
    }

    private boolean extract(String file, String outputDir, String languages) throws InterruptedException, ExecutionException {
        if (!analyze(file)) {
            return false;
        }
        extractionController.setOutputPath(outputDir);
        if (languages != null) {
            extractionController.setSelectedLanguages(Arrays.asList(languages.split(",")));
        }
        return report(extractionController.extract().get());
    }

    private boolean batch(String outputDir, List<String> inputs) throws InterruptedException, ExecutionException {
        extractionController.setBatchMode(true);
        extractionController.setOutputPath(outputDir);

        List<Path> paths = new ArrayList<>();
        for (String input : inputs) {
            paths.add(Paths.get(input));
        }
        if (paths.size() == 1) {
            extractionController.loadInputDirectory(paths.get(0)).get();
        } else {
            extractionController.setInputPaths(inputs);
        }
        return report(extractionController.extract().get());
    }

    private boolean find(List<String> inputs) throws InterruptedException, ExecutionException {
        for (String input : inputs) {
            List<String> files = extractionController.loadInputDirectory(Paths.get(input)).get();
            files.forEach(f -> logger.info("  {}", f));
        }
        return extractionController.getError() == null;
    }

    private boolean report(ExtractionState state) {
        if (state == ExtractionState.COMPLETED) {
            if (extractionController.isBatchMode()) {
                logger.info("{}", extractionController.batchResultProperty().get());
            } else {
                logger.info("{}", extractionController.extractionResultProperty().get());
            }
            return true;
        }
        logger.error("{}", extractionController.getError());
        return false;
    }

    /**
     * Kill running workers and stop background threads
     */
    public void shutdown() {
        logger.info("Shutting down TrackForge...");
        bridge.shutdown();
        uiExecutor.shutdownNow();
        logger.info("Application shutdown complete");
    }

    private static void printUsage() {
        System.err.println("Usage: trackforge <command> [args]");
        System.err.println("  analyze <file>");
        System.err.println("  extract <file> <outputDir> [lang,lang...]");
        System.err.println("  batch <outputDir> <directory | file file...>");
        System.err.println("  find <path> [path...]");
    }
}
