package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.AdRecord;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.NewAdEvent;
import com.delta.adfeed.monitor.persistence.AdJdbcRepository;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdFeedServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-08T09:30:00Z");

    @Mock
    private AdJdbcRepository repository;
    @Mock
    private MonitorConfigService configService;

    private AdFeedService feedService;

    @BeforeEach
    void setUp() {
        feedService = new AdFeedService(
            repository,
            configService,
            new MonitorProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void rendersRecentAdsAsRssItems() throws Exception {
        AdRecord sofa = new AdRecord(
            "0cc175b9c0f1b6a831c399e269772661",
            "Leather Sofa",
            "$300",
            "https://facebook.com/marketplace/item/1/",
            NOW.minusSeconds(7200),
            NOW.minusSeconds(60)
        );
        when(repository.findRecent(Instant.parse("2026-03-01T09:30:00Z"), 100)).thenReturn(List.of(sofa));
        when(configService.getSnapshot()).thenReturn(
            new ConfigSnapshot("127.0.0.1", 5000, "$", 15, "monitor.log", "ads.db", List.of())
        );

        String xml = feedService.render();

        SyndFeed feed = new SyndFeedInput().build(new StringReader(xml));
        assertThat(feed.getFeedType()).isEqualTo("rss_2.0");
        assertThat(feed.getTitle()).isEqualTo("Marketplace Ad Feed");
        assertThat(feed.getLink()).isEqualTo("http://127.0.0.1:5000/rss");
        assertThat(feed.getEntries()).hasSize(1);
        SyndEntry entry = feed.getEntries().get(0);
        assertThat(entry.getTitle()).isEqualTo("Leather Sofa - $300");
        assertThat(entry.getLink()).isEqualTo("https://facebook.com/marketplace/item/1/");
        assertThat(entry.getUri()).isEqualTo("0cc175b9c0f1b6a831c399e269772661");
        assertThat(entry.getDescription().getValue()).isEqualTo("Price: $300 | Title: Leather Sofa");
        assertThat(entry.getPublishedDate()).isEqualTo(Date.from(NOW.minusSeconds(60)));
    }

    @Test
    void controlCharactersInStoredAdsDoNotBreakTheFeed() throws Exception {
        AdRecord good = new AdRecord("id-good", "Good sofa", "$1", "https://facebook.com/marketplace/item/1/",
            NOW.minusSeconds(120), NOW.minusSeconds(120));
        AdRecord bad = new AdRecord("id-bad", "Bad\u0008 chair", "$2\u0001", "https://facebook.com/marketplace/item/2/",
            NOW.minusSeconds(60), NOW.minusSeconds(60));
        when(repository.findRecent(Instant.parse("2026-03-01T09:30:00Z"), 100)).thenReturn(List.of(bad, good));
        when(configService.getSnapshot()).thenReturn(ConfigSnapshot.defaults());

        SyndFeed feed = new SyndFeedInput().build(new StringReader(feedService.render()));

        assertThat(feed.getEntries())
            .extracting(SyndEntry::getTitle)
            .containsExactly("Bad chair - $2", "Good sofa - $1");
        assertThat(feed.getEntries().get(0).getDescription().getValue()).isEqualTo("Price: $2 | Title: Bad chair");
    }

    @Test
    void channelCarriesRenderTimeAsLastBuildDate() {
        when(repository.findRecent(Instant.parse("2026-03-01T09:30:00Z"), 100)).thenReturn(List.of());
        when(configService.getSnapshot()).thenReturn(ConfigSnapshot.defaults());
        feedService.onNewAd(new NewAdEvent(ad(NOW.minusSeconds(3600)), "https://facebook.com/marketplace/nyc/search"));

        String xml = feedService.render();

        assertThat(xml).contains("<lastBuildDate>Sun, 08 Mar 2026 09:30:00 GMT</lastBuildDate>");
        assertThat(xml).contains("<pubDate>Sun, 08 Mar 2026 08:30:00 GMT</pubDate>");
    }

    @Test
    void emptyStoreRendersEmptyChannel() throws Exception {
        when(repository.findRecent(Instant.parse("2026-03-01T09:30:00Z"), 100)).thenReturn(List.of());
        when(configService.getSnapshot()).thenReturn(ConfigSnapshot.defaults());

        SyndFeed feed = new SyndFeedInput().build(new StringReader(feedService.render()));

        assertThat(feed.getEntries()).isEmpty();
        assertThat(feed.getLink()).isEqualTo("http://0.0.0.0:5000/rss");
    }

    @Test
    void arrivalEventsTrackLatestSighting() {
        Instant earlier = NOW.minusSeconds(600);
        Instant later = NOW.minusSeconds(30);

        feedService.onNewAd(new NewAdEvent(ad(later), "https://facebook.com/marketplace/nyc/search"));
        feedService.onNewAd(new NewAdEvent(ad(earlier), "https://facebook.com/marketplace/nyc/search"));

        assertThat(feedService.getLastArrivalAt()).isEqualTo(later);
    }

    private static AdRecord ad(Instant seenAt) {
        return new AdRecord("id-" + seenAt.getEpochSecond(), "Lamp", "$5", "https://facebook.com/marketplace/item/9/",
            seenAt, seenAt);
    }
}
