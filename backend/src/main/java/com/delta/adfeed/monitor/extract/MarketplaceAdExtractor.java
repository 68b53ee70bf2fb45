package com.delta.adfeed.monitor.extract;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.CandidateRecord;
import com.delta.adfeed.monitor.model.Target;
import com.delta.adfeed.monitor.util.AdUrlUtils;
import com.delta.adfeed.monitor.util.XmlTextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls listing cards out of a marketplace search page. A card is an anchor pointing at an item page
 * that carries a line-clamped title span and a price span; cards without both are skipped, as are
 * cards whose price is neither in the configured currency nor marked free.
 */
@Component
public class MarketplaceAdExtractor implements AdExtractor {
    private static final String TITLE_SELECTOR = "span[style*=-webkit-line-clamp]";
    private static final String PRICE_SELECTOR = "span[dir=auto]";

    private final String itemBaseUrl;
    private final String itemPathPrefix;

    public MarketplaceAdExtractor(MonitorProperties properties) {
        this.itemBaseUrl = properties.getExtraction().getItemBaseUrl();
        this.itemPathPrefix = properties.getExtraction().getItemPathPrefix();
    }

    @Override
    public List<CandidateRecord> extract(String html, Target target, String currency) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html);
        String originTarget = target == null ? null : target.url();
        String safeCurrency = currency == null ? "" : currency;
        Set<String> seenUrls = new LinkedHashSet<>();
        List<CandidateRecord> candidates = new ArrayList<>();

        for (Element anchor : doc.select("a[href^=" + itemPathPrefix + "]")) {
            String sourceUrl = AdUrlUtils.toAbsolute(itemBaseUrl, anchor.attr("href"));
            if (sourceUrl == null || !seenUrls.add(sourceUrl)) {
                continue;
            }
            Element titleSpan = anchor.selectFirst(TITLE_SELECTOR);
            Element priceSpan = anchor.selectFirst(PRICE_SELECTOR);
            if (titleSpan == null || priceSpan == null) {
                continue;
            }
            String title = XmlTextUtils.stripIllegalXmlChars(titleSpan.text()).trim();
            String price = XmlTextUtils.stripIllegalXmlChars(priceSpan.text()).trim();
            if (title.isEmpty() || !isAcceptablePrice(price, safeCurrency)) {
                continue;
            }
            candidates.add(new CandidateRecord(title, price, sourceUrl, originTarget));
        }
        return candidates;
    }

    static boolean isAcceptablePrice(String price, String currency) {
        if (price == null || price.isEmpty()) {
            return false;
        }
        return price.startsWith(currency) || price.toLowerCase(Locale.ROOT).contains("free");
    }
}
