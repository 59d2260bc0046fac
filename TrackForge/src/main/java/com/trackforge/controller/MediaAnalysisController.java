package com.trackforge.controller;

import com.trackforge.model.AnalysisResult;
import com.trackforge.service.MediaWorkerApi;
import com.trackforge.service.exception.CapabilityUnavailableException;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Analyses the selected file and exposes its tracks and languages.
 * Changing the file discards the previous analysis.
 */
public class MediaAnalysisController {
    private static final Logger logger = LoggerFactory.getLogger(MediaAnalysisController.class);

    private final MediaWorkerApi api;
    private final Executor uiExecutor;

    private final StringProperty filePath = new SimpleStringProperty("");
    private final ObjectProperty<AnalysisResult> analyzed = new SimpleObjectProperty<>();
    private final BooleanProperty analyzing = new SimpleBooleanProperty(false);
    private final StringProperty error = new SimpleStringProperty();
    private final ObservableList<String> availableLanguages = FXCollections.observableArrayList();

    public MediaAnalysisController(MediaWorkerApi api, Executor uiExecutor) {
        this.api = api;
        this.uiExecutor = uiExecutor;

        filePath.addListener((obs, oldVal, newVal) -> {
            analyzed.set(null);
            error.set(null);
        });
    }

    /**
     * Analyse the current file
     * @return the analysis, or null when it failed
     */
    public CompletableFuture<AnalysisResult> analyze() {
        String path = filePath.get();
        if (path == null || path.trim().isEmpty()) {
            error.set("Please select a file first");
            return CompletableFuture.completedFuture(null);
        }

        analyzing.set(true);
        error.set(null);

        CompletableFuture<AnalysisResult> call;
        try {
            call = api.analyzeFile(Paths.get(path));
        } catch (CapabilityUnavailableException e) {
            error.set("Error analyzing file: " + e.getMessage());
            analyzing.set(false);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<AnalysisResult> done = new CompletableFuture<>();
        call.whenComplete((result, failure) -> uiExecutor.execute(() -> {
            AnalysisResult accepted = null;
            if (!path.equals(filePath.get())) {
                logger.debug("Discarding analysis of {}, file changed to {}", path, filePath.get());
            } else if (failure != null) {
                logger.error("Error analyzing file {}", path, failure);
                error.set("Error analyzing file: " + ExtractionController.messageOf(failure));
            } else if (!result.isSuccess()) {
                error.set(result.getError() != null ? result.getError() : "Analysis failed");
            } else {
                accepted = result;
                analyzed.set(result);
                availableLanguages.setAll(result.availableLanguages());
                logger.info("Analyzed {}: {} tracks, languages {}", path, result.getTracks().size(), availableLanguages);
            }
            analyzing.set(false);
            done.complete(accepted);
        }));
        return done;
    }

    public void resetAnalysis() {
        analyzed.set(null);
        analyzing.set(false);
        error.set(null);
        availableLanguages.clear();
    }

    public StringProperty filePathProperty() { return filePath; }
    public ObjectProperty<AnalysisResult> analyzedProperty() { return analyzed; }
    public BooleanProperty analyzingProperty() { return analyzing; }
    public StringProperty errorProperty() { return error; }
    public ObservableList<String> getAvailableLanguages() { return availableLanguages; }

    public String getFilePath() { return filePath.get(); }
    public void setFilePath(String path) { filePath.set(path); }
    public AnalysisResult getAnalyzed() { return analyzed.get(); }
    public boolean isAnalyzing() { return analyzing.get(); }
    public String getError() { return error.get(); }
}
