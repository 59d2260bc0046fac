package com.trackforge.model;

import java.util.Objects;

/**
 * Immutable set of extraction flags.
 * <p>
 * {@code videoOnly} is exclusive with {@code audioOnly} and {@code subtitleOnly}: enabling
 * one side clears the other. {@code includeVideo} and {@code removeLetterbox} are independent.
 */
public final class ExtractionOptions {
    private final boolean audioOnly;
    private final boolean subtitleOnly;
    private final boolean videoOnly;
    private final boolean includeVideo;
    private final boolean removeLetterbox;

    public ExtractionOptions() {
        this(false, false, false, false, false);
    }

    private ExtractionOptions(boolean audioOnly, boolean subtitleOnly, boolean videoOnly,
                              boolean includeVideo, boolean removeLetterbox) {
        this.audioOnly = audioOnly;
        this.subtitleOnly = subtitleOnly;
        this.videoOnly = videoOnly;
        this.includeVideo = includeVideo;
        this.removeLetterbox = removeLetterbox;
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions();
    }

    /**
     * Build options from raw flags, e.g. a saved settings file.
     * A conflicting combination is resolved in favour of {@code videoOnly}, which clears
     * {@code audioOnly} and {@code subtitleOnly}.
     */
    public static ExtractionOptions of(boolean audioOnly, boolean subtitleOnly, boolean videoOnly,
                                       boolean includeVideo, boolean removeLetterbox) {
        if (videoOnly) {
            audioOnly = false;
            subtitleOnly = false;
        }
        return new ExtractionOptions(audioOnly, subtitleOnly, videoOnly, includeVideo, removeLetterbox);
    }

    /**
     * Flip one flag and re-apply the audio/subtitle vs video exclusion
     * @return a new options instance, this one is unchanged
     */
    public ExtractionOptions toggle(ExtractionOption option) {
        boolean audio = audioOnly;
        boolean subtitle = subtitleOnly;
        boolean video = videoOnly;
        boolean include = includeVideo;
        boolean letterbox = removeLetterbox;

        switch (option) {
            case AUDIO_ONLY:
                audio = !audio;
                if (audio) {
                    video = false;
                }
                break;
            case SUBTITLE_ONLY:
                subtitle = !subtitle;
                if (subtitle) {
                    video = false;
                }
                break;
            case VIDEO_ONLY:
                video = !video;
                if (video) {
                    audio = false;
                    subtitle = false;
                }
                break;
            case INCLUDE_VIDEO:
                include = !include;
                break;
            case REMOVE_LETTERBOX:
                letterbox = !letterbox;
                break;
            default:
                throw new IllegalArgumentException("Unknown option: " + option);
        }

        return new ExtractionOptions(audio, subtitle, video, include, letterbox);
    }

    public boolean isEnabled(ExtractionOption option) {
        switch (option) {
            case AUDIO_ONLY: return audioOnly;
            case SUBTITLE_ONLY: return subtitleOnly;
            case VIDEO_ONLY: return videoOnly;
            case INCLUDE_VIDEO: return includeVideo;
            case REMOVE_LETTERBOX: return removeLetterbox;
            default: throw new IllegalArgumentException("Unknown option: " + option);
        }
    }

    public boolean isAudioOnly() { return audioOnly; }
    public boolean isSubtitleOnly() { return subtitleOnly; }
    public boolean isVideoOnly() { return videoOnly; }
    public boolean isIncludeVideo() { return includeVideo; }
    public boolean isRemoveLetterbox() { return removeLetterbox; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionOptions)) return false;
        ExtractionOptions that = (ExtractionOptions) o;
        return audioOnly == that.audioOnly
            && subtitleOnly == that.subtitleOnly
            && videoOnly == that.videoOnly
            && includeVideo == that.includeVideo
            && removeLetterbox == that.removeLetterbox;
    }

    @Override
    public int hashCode() {
        return Objects.hash(audioOnly, subtitleOnly, videoOnly, includeVideo, removeLetterbox);
    }

    @Override
    public String toString() {
        return String.format("ExtractionOptions{audioOnly=%s, subtitleOnly=%s, videoOnly=%s, includeVideo=%s, removeLetterbox=%s}",
            audioOnly, subtitleOnly, videoOnly, includeVideo, removeLetterbox);
    }
}
