package com.trackforge.model;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.trackforge.util.PathManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User preferences persisted to settings.json in the application settings directory
 */
public class AppSettings {
    private static final Logger logger = LoggerFactory.getLogger(AppSettings.class);

    private String outputDirectory = "";
    private List<String> defaultLanguages = new ArrayList<>(Collections.singletonList("eng"));
    private int maxWorkers = 0;
    private boolean useOrgStructure = true;

    // Last used extraction flags
    private boolean audioOnly = false;
    private boolean subtitleOnly = false;
    private boolean videoOnly = false;
    private boolean includeVideo = false;
    private boolean removeLetterbox = false;

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public List<String> getDefaultLanguages() {
        return defaultLanguages != null ? defaultLanguages : new ArrayList<>();
    }
    public void setDefaultLanguages(List<String> defaultLanguages) { this.defaultLanguages = new ArrayList<>(defaultLanguages); }

    /** 0 means "derive from the host" */
    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

    public boolean isUseOrgStructure() { return useOrgStructure; }
    public void setUseOrgStructure(boolean useOrgStructure) { this.useOrgStructure = useOrgStructure; }

    public ExtractionOptions getExtractionOptions() {
        return ExtractionOptions.of(audioOnly, subtitleOnly, videoOnly, includeVideo, removeLetterbox);
    }

    public void setExtractionOptions(ExtractionOptions options) {
        this.audioOnly = options.isAudioOnly();
        this.subtitleOnly = options.isSubtitleOnly();
        this.videoOnly = options.isVideoOnly();
        this.includeVideo = options.isIncludeVideo();
        this.removeLetterbox = options.isRemoveLetterbox();
    }

    /**
     * Load settings from the default location
     */
    public static AppSettings load() {
        return load(PathManager.getSettingsFile());
    }

    /**
     * Load settings from disk
     * @return settings from the file, or defaults when it is missing or unreadable
     */
    public static AppSettings load(Path settingsFile) {
        if (Files.exists(settingsFile)) {
            try (Reader reader = Files.newBufferedReader(settingsFile, StandardCharsets.UTF_8)) {
                AppSettings settings = new Gson().fromJson(reader, AppSettings.class);
                if (settings != null) {
                    logger.info("Settings loaded from: {}", settingsFile);
                    return settings;
                }
                logger.warn("Settings file {} is empty, using defaults", settingsFile);
            } catch (IOException | JsonParseException e) {
                logger.error("Failed to load settings from file", e);
            }
        } else {
            logger.info("No settings file found, using defaults");
        }

        return new AppSettings();
    }

    public boolean save() {
        return save(PathManager.getSettingsFile());
    }

    /**
     * Save settings to disk
     * @return true if successful, false otherwise
     */
    public boolean save(Path settingsFile) {
        try {
            Path parent = settingsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            try (Writer writer = Files.newBufferedWriter(settingsFile, StandardCharsets.UTF_8)) {
                gson.toJson(this, writer);
            }
            logger.info("Settings saved to: {}", settingsFile);
            return true;
        } catch (IOException e) {
            logger.error("Failed to save settings to file", e);
            return false;
        }
    }
}
