package com.podcast.bus.core.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published by the retrieval-indexing service after an episode's chunks are indexed.
 */
public record EpisodeIngested(
        String eventId,
        Instant timestamp,
        String service,
        String episodeId,
        List<String> filePaths,
        String episodeTitle,
        String podcastName,
        int chunksCreated) implements EpisodeEvent {

    public static final String TYPE = "ingested";

    public EpisodeIngested {
        filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
    }

    public static EpisodeIngested of(String service, String episodeId, String episodeTitle,
                                     String podcastName, int chunksCreated) {
        return new EpisodeIngested("evt_" + UUID.randomUUID(), Instant.now(), service, episodeId,
                List.of(), episodeTitle, podcastName, chunksCreated);
    }
}
