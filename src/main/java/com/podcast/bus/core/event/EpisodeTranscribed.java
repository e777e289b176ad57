package com.podcast.bus.core.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published by the transcription worker once an episode transcript is on disk.
 */
public record EpisodeTranscribed(
        String eventId,
        Instant timestamp,
        String service,
        String episodeId,
        List<String> filePaths,
        String episodeTitle,
        String podcastName,
        String audioUrl,
        Double durationSeconds,
        boolean diarizationFailed) implements EpisodeEvent {

    public static final String TYPE = "transcribed";

    public EpisodeTranscribed {
        filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
    }

    public static EpisodeTranscribed of(String service, String episodeId, String episodeTitle,
                                        String podcastName, List<String> filePaths) {
        return new EpisodeTranscribed("evt_" + UUID.randomUUID(), Instant.now(), service, episodeId,
                filePaths, episodeTitle, podcastName, null, null, false);
    }
}
