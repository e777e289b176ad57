package com.podcast.bus.core.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Published by the summarization service. {@code summaryData} is free-form JSON.
 */
public record EpisodeSummarized(
        String eventId,
        Instant timestamp,
        String service,
        String episodeId,
        List<String> filePaths,
        String episodeTitle,
        String podcastName,
        String summaryPath,
        Map<String, Object> summaryData) implements EpisodeEvent {

    public static final String TYPE = "summarized";

    public EpisodeSummarized {
        filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
        summaryData = summaryData == null ? Map.of() : summaryData;
    }

    public static EpisodeSummarized of(String service, String episodeId, String episodeTitle,
                                       String podcastName, String summaryPath, Map<String, Object> summaryData) {
        return new EpisodeSummarized("evt_" + UUID.randomUUID(), Instant.now(), service, episodeId,
                summaryPath == null ? List.of() : List.of(summaryPath), episodeTitle, podcastName,
                summaryPath, summaryData);
    }
}
