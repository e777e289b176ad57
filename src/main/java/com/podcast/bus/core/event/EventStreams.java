package com.podcast.bus.core.event;

/**
 * Stream names shared by publishers and group registration, one per logical event type.
 *
 * <p>Defaults match the names the episode services have always used; deployments may override them
 * through configuration, but every service of one deployment must agree.</p>
 */
public record EventStreams(String transcribed, String summarized, String ingested) {

    public static final String DEFAULT_TRANSCRIBED = "episodes:transcribed";
    public static final String DEFAULT_SUMMARIZED = "episodes:summarized";
    public static final String DEFAULT_INGESTED = "episodes:ingested";

    public static EventStreams defaults() {
        return new EventStreams(DEFAULT_TRANSCRIBED, DEFAULT_SUMMARIZED, DEFAULT_INGESTED);
    }

    /** Stream an event of this type is published to. */
    public String forEvent(EpisodeEvent event) {
        if (event instanceof EpisodeTranscribed) {
            return transcribed;
        }
        if (event instanceof EpisodeSummarized) {
            return summarized;
        }
        if (event instanceof EpisodeIngested) {
            return ingested;
        }
        throw new IllegalArgumentException("No stream mapped for event type " + event.getClass().getName());
    }
}
