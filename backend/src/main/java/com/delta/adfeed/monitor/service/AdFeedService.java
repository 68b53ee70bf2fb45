package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.AdRecord;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.NewAdEvent;
import com.delta.adfeed.monitor.persistence.AdJdbcRepository;
import com.delta.adfeed.monitor.util.XmlTextUtils;
import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndContentImpl;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndEntryImpl;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Renders the RSS document. Items always come from the ad table; the arrival events only move the
 * channel publication date.
 */
@Service
public class AdFeedService {
    static final String FEED_TYPE = "rss_2.0";

    private static final Logger log = LoggerFactory.getLogger(AdFeedService.class);

    private final AdJdbcRepository repository;
    private final MonitorConfigService configService;
    private final MonitorProperties properties;
    private final Clock clock;
    private final AtomicReference<Instant> lastArrivalAt = new AtomicReference<>();

    public AdFeedService(
        AdJdbcRepository repository,
        MonitorConfigService configService,
        MonitorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.configService = configService;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener
    public void onNewAd(NewAdEvent event) {
        Instant seenAt = event.ad().lastChecked();
        lastArrivalAt.accumulateAndGet(seenAt, (current, candidate) ->
            current == null || candidate.isAfter(current) ? candidate : current);
    }

    public Instant getLastArrivalAt() {
        return lastArrivalAt.get();
    }

    public List<AdRecord> recentAds() {
        MonitorProperties.Feed feed = properties.getFeed();
        Instant since = Instant.now(clock).minus(Duration.ofDays(feed.getWindowDays()));
        return repository.findRecent(since, feed.getMaxItems());
    }

    public String render() {
        List<AdRecord> ads = recentAds();
        SyndFeed feed = buildFeed(ads, configService.getSnapshot());
        Channel channel = (Channel) feed.createWireFeed();
        channel.setLastBuildDate(Date.from(Instant.now(clock)));
        try {
            return new WireFeedOutput().outputString(channel);
        } catch (FeedException e) {
            throw new IllegalStateException("Unable to render RSS feed", e);
        }
    }

    SyndFeed buildFeed(List<AdRecord> ads, ConfigSnapshot config) {
        MonitorProperties.Feed settings = properties.getFeed();
        SyndFeed feed = new SyndFeedImpl();
        feed.setFeedType(FEED_TYPE);
        feed.setTitle(settings.getTitle());
        feed.setLink("http://" + config.serverIp() + ":" + config.serverPort() + "/rss");
        feed.setDescription(settings.getDescription());
        feed.setLanguage("en-us");
        Instant arrival = lastArrivalAt.get();
        feed.setPublishedDate(Date.from(arrival == null ? Instant.now(clock) : arrival));

        List<SyndEntry> entries = new ArrayList<>(ads.size());
        for (AdRecord ad : ads) {
            entries.add(toEntry(ad));
        }
        feed.setEntries(entries);
        log.debug("Rendering RSS feed with {} items", entries.size());
        return feed;
    }

    // Rows stored before extraction sanitised text may still hold control characters.
    private SyndEntry toEntry(AdRecord ad) {
        String title = XmlTextUtils.stripIllegalXmlChars(ad.title());
        String price = XmlTextUtils.stripIllegalXmlChars(ad.price());
        SyndEntry entry = new SyndEntryImpl();
        entry.setTitle(title + " - " + price);
        entry.setLink(ad.url());
        entry.setUri(ad.id());
        if (ad.lastChecked() != null) {
            entry.setPublishedDate(Date.from(ad.lastChecked()));
        }
        SyndContent description = new SyndContentImpl();
        description.setType("text/plain");
        description.setValue("Price: " + price + " | Title: " + title);
        entry.setDescription(description);
        return entry;
    }
}
