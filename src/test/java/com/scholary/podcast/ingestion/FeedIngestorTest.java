package com.scholary.podcast.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.podcast.episode.Episode;
import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.episode.IdempotencyKey;
import com.scholary.podcast.episode.TranscriptStatus;
import com.scholary.podcast.feed.EpisodeItem;
import com.scholary.podcast.feed.FeedException;
import com.scholary.podcast.feed.FeedParser;
import com.scholary.podcast.feed.ParsedFeed;
import com.scholary.podcast.feed.PodcastMetadata;
import com.scholary.podcast.podcast.Podcast;
import com.scholary.podcast.testutil.InMemoryEpisodeRepository;
import com.scholary.podcast.testutil.InMemoryPodcastRepository;
import com.scholary.podcast.workflow.WorkflowHandle;
import com.scholary.podcast.workflow.WorkflowTrigger;
import com.scholary.podcast.workflow.WorkflowTriggerException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class FeedIngestorTest {

  private static final String BUCKET = "bucket";
  private static final WorkflowHandle HANDLE = new WorkflowHandle("exec", Instant.EPOCH);

  @Mock private FeedParser feedParser;
  @Mock private WorkflowTrigger workflowTrigger;

  private final InMemoryEpisodeRepository episodeRepository = new InMemoryEpisodeRepository();
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void ingest_shouldRegisterNewEpisodesAndStartTheirWorkflow() {
    Podcast podcast = podcast("p1", "https://feeds/p1");
    when(feedParser.parse("https://feeds/p1"))
        .thenReturn(feed("Show One", audioItem("https://cdn/p1/a.mp3"), audioItem("https://cdn/p1/b.mp3")));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET))).thenReturn(HANDLE);

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.totalPodcasts()).isEqualTo(1);
    assertThat(result.processedPodcasts()).isEqualTo(1);
    assertThat(result.totalNewEpisodes()).isEqualTo(2);
    assertThat(result.errors()).isEmpty();
    assertThat(result.podcastResults())
        .containsExactly(new PodcastIngestionResult("p1", "Show One", 2, 0, List.of()));

    String episodeId = IdempotencyKey.forAudioUrl("https://cdn/p1/a.mp3");
    Episode stored = episodeRepository.get(episodeId);
    assertThat(stored.getTranscriptStatus()).isEqualTo(TranscriptStatus.PENDING);
    assertThat(stored.getPodcastId()).isEqualTo("p1");
    verify(workflowTrigger).start(episodeId, "https://cdn/p1/a.mp3", BUCKET);
    assertThat(podcast.getLastPolledAt()).isNotNull();
  }

  @Test
  void ingest_shouldSkipAlreadyRegisteredAudioUrl() {
    episodeRepository.insert(Episode.discovered("p1", "old", null, "https://cdn/p1/a.mp3", null));
    Podcast podcast = podcast("p1", "https://feeds/p1");
    when(feedParser.parse("https://feeds/p1"))
        .thenReturn(feed("Show", audioItem("https://cdn/p1/a.mp3"), audioItem("https://cdn/p1/b.mp3")));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET))).thenReturn(HANDLE);

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.totalNewEpisodes()).isEqualTo(1);
    assertThat(result.podcastResults().get(0).duplicateEpisodes()).isEqualTo(1);
    verify(workflowTrigger, times(1)).start(anyString(), anyString(), eq(BUCKET));
  }

  @Test
  void ingest_shouldCountLostInsertRaceAsDuplicate() {
    episodeRepository.failNextInsert(new DuplicateKeyException("E11000 duplicate key"));
    Podcast podcast = podcast("p1", "https://feeds/p1");
    when(feedParser.parse("https://feeds/p1")).thenReturn(feed("Show", audioItem("https://cdn/p1/a.mp3")));

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.totalNewEpisodes()).isZero();
    assertThat(result.errors()).isEmpty();
    assertThat(result.podcastResults().get(0).duplicateEpisodes()).isEqualTo(1);
    verify(workflowTrigger, never()).start(anyString(), anyString(), anyString());
  }

  @Test
  void ingest_shouldRecordOtherWriteErrorsPerPodcast() {
    episodeRepository.failNextInsert(new DataAccessResourceFailureException("store down"));
    Podcast podcast = podcast("p1", "https://feeds/p1");
    when(feedParser.parse("https://feeds/p1")).thenReturn(feed("Show", audioItem("https://cdn/p1/a.mp3")));

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.totalNewEpisodes()).isZero();
    assertThat(result.errors()).singleElement().asString().contains("store down");
  }

  @Test
  void ingest_shouldKeepEpisodeAsFailedWhenTriggerFails() {
    Podcast podcast = podcast("p1", "https://feeds/p1");
    when(feedParser.parse("https://feeds/p1")).thenReturn(feed("Show", audioItem("https://cdn/p1/a.mp3")));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET)))
        .thenThrow(new WorkflowTriggerException("execution limit exceeded", null));

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    Episode stored = episodeRepository.get(IdempotencyKey.forAudioUrl("https://cdn/p1/a.mp3"));
    assertThat(stored.getTranscriptStatus()).isEqualTo(TranscriptStatus.FAILED);
    assertThat(stored.getErrorMessage()).isEqualTo("execution limit exceeded");
    assertThat(result.totalNewEpisodes()).isEqualTo(1);
    assertThat(result.errors()).singleElement().asString().contains("Failed to trigger workflow");
  }

  @Test
  void ingest_shouldIsolateOnePodcastsFeedFailure() {
    Podcast broken = podcast("broken", "https://feeds/broken");
    Podcast healthy = podcast("healthy", "https://feeds/healthy");
    when(feedParser.parse("https://feeds/broken"))
        .thenThrow(new FeedException(FeedException.Kind.FETCH, "connect timed out"));
    when(feedParser.parse("https://feeds/healthy")).thenReturn(feed("Healthy", audioItem("https://cdn/h/1.mp3")));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET))).thenReturn(HANDLE);

    IngestionResult result =
        ingestor(new InMemoryPodcastRepository(broken, healthy), 10).ingest(List.of(broken, healthy));

    assertThat(result.processedPodcasts()).isEqualTo(2);
    assertThat(result.totalNewEpisodes()).isEqualTo(1);
    assertThat(result.errors())
        .containsExactly("Failed to parse feed https://feeds/broken: connect timed out");
  }

  @Test
  void ingest_shouldReportPodcastWithoutFeedUrl() {
    Podcast podcast = podcast("p1", " ");

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.errors()).containsExactly("No feed URL found for podcast p1");
  }

  @Test
  void ingest_shouldOnlyConsiderFirstTenItems() {
    Podcast podcast = podcast("p1", "https://feeds/p1");
    List<EpisodeItem> items = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      items.add(audioItem("https://cdn/p1/" + i + ".mp3"));
    }
    when(feedParser.parse("https://feeds/p1"))
        .thenReturn(new ParsedFeed(metadata("Show"), items));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET))).thenReturn(HANDLE);

    IngestionResult result = ingestor(new InMemoryPodcastRepository(podcast), 10).ingest(List.of(podcast));

    assertThat(result.totalNewEpisodes()).isEqualTo(10);
    assertThat(episodeRepository.findByAudioUrl("https://cdn/p1/9.mp3")).isPresent();
    assertThat(episodeRepository.findByAudioUrl("https://cdn/p1/10.mp3")).isEmpty();
  }

  @Test
  void ingest_shouldRegisterSharedAudioUrlExactlyOnce() {
    List<Podcast> podcasts = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      podcasts.add(podcast("p" + i, "https://feeds/shared"));
    }
    when(feedParser.parse("https://feeds/shared")).thenReturn(feed("Shared", audioItem("https://cdn/same.mp3")));
    when(workflowTrigger.start(anyString(), anyString(), eq(BUCKET))).thenReturn(HANDLE);

    IngestionResult result =
        ingestor(new InMemoryPodcastRepository(podcasts.toArray(new Podcast[0])), 4).ingest(podcasts);

    assertThat(episodeRepository.all()).hasSize(1);
    assertThat(result.totalNewEpisodes()).isEqualTo(1);
    verify(workflowTrigger, times(1)).start(anyString(), anyString(), eq(BUCKET));
  }

  @Test
  void ingest_shouldNeverRunMorePodcastsThanMaxConcurrency() {
    List<Podcast> podcasts = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      podcasts.add(podcast("p" + i, "https://feeds/p" + i));
    }
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    when(feedParser.parse(anyString()))
        .thenAnswer(
            invocation -> {
              int now = inFlight.incrementAndGet();
              maxInFlight.accumulateAndGet(now, Math::max);
              Thread.sleep(30);
              inFlight.decrementAndGet();
              return feed("Show");
            });

    IngestionResult result =
        ingestor(new InMemoryPodcastRepository(podcasts.toArray(new Podcast[0])), 3).ingest(podcasts);

    assertThat(result.processedPodcasts()).isEqualTo(8);
    assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
  }

  @Test
  void ingest_shouldIgnoreInactivePodcasts() {
    Podcast inactive = new Podcast("p1", "https://feeds/p1", "Off", false);

    IngestionResult result = ingestor(new InMemoryPodcastRepository(inactive), 10).ingest(List.of(inactive));

    assertThat(result.totalPodcasts()).isZero();
    verify(feedParser, never()).parse(anyString());
  }

  @Test
  void ingestById_shouldThrowForUnknownPodcast() {
    FeedIngestor ingestor = ingestor(new InMemoryPodcastRepository(podcast("p1", "https://feeds/p1")), 10);

    assertThatThrownBy(() -> ingestor.ingest("missing"))
        .isInstanceOf(PodcastNotFoundException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void ingestById_shouldReturnEmptyResultWhenNothingIsActive() {
    IngestionResult result = ingestor(new InMemoryPodcastRepository(), 10).ingest((String) null);

    assertThat(result.message()).isEqualTo("No active podcasts to process");
    assertThat(result.totalPodcasts()).isZero();
  }

  @Test
  void ingestById_shouldPollOnlyTheRequestedPodcast() {
    Podcast first = podcast("p1", "https://feeds/p1");
    Podcast second = podcast("p2", "https://feeds/p2");
    when(feedParser.parse("https://feeds/p2")).thenReturn(feed("Second"));

    IngestionResult result = ingestor(new InMemoryPodcastRepository(first, second), 10).ingest("p2");

    assertThat(result.message()).isEqualTo("Polling completed for podcast p2");
    assertThat(result.totalPodcasts()).isEqualTo(1);
    verify(feedParser, never()).parse("https://feeds/p1");
  }

  private FeedIngestor ingestor(InMemoryPodcastRepository podcastRepository, int maxConcurrency) {
    IngestionProperties properties =
        new IngestionProperties(
            maxConcurrency, 10, 10, 30, new IngestionProperties.ScheduleProperties(false, 60));
    return new FeedIngestor(
        podcastRepository,
        episodeRepository,
        new EpisodeStatusUpdater(episodeRepository),
        feedParser,
        workflowTrigger,
        executor,
        properties,
        BUCKET);
  }

  private static Podcast podcast(String id, String rssUrl) {
    return new Podcast(id, rssUrl, "Podcast " + id, true);
  }

  private static ParsedFeed feed(String title, EpisodeItem... items) {
    return new ParsedFeed(metadata(title), List.of(items));
  }

  private static PodcastMetadata metadata(String title) {
    return new PodcastMetadata(title, null, null, null, null, null);
  }

  private static EpisodeItem audioItem(String audioUrl) {
    return new EpisodeItem(
        "Episode " + audioUrl,
        null,
        null,
        List.of(new EpisodeItem.Enclosure(audioUrl, "audio/mpeg")),
        null,
        null);
  }
}
