package com.tradingassistant.strategy;

import com.tradingassistant.model.CatalystEvent;
import com.tradingassistant.model.NewsItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Infers a catalyst from headlines by case-insensitive keyword match.
 */
public final class CatalystDetector {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "beat",
            "launch",
            "expansion",
            "partnership",
            "acquisition"
    );

    private final List<String> keywords;

    public CatalystDetector() {
        this(DEFAULT_KEYWORDS);
    }

    public CatalystDetector(List<String> keywords) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword == null) {
                    continue;
                }
                String k = keyword.trim().toLowerCase(Locale.ROOT);
                if (!k.isEmpty()) {
                    normalized.add(k);
                }
            }
        }
        this.keywords = Collections.unmodifiableList(new ArrayList<>(normalized));
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * First keyword found in any headline, or {@code null}. Keywords are tried in configured order.
     */
    public String firstMatch(List<NewsItem> news) {
        if (news == null || news.isEmpty() || keywords.isEmpty()) {
            return null;
        }
        for (NewsItem item : news) {
            String headline = item.headline.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (headline.contains(keyword)) {
                    return keyword;
                }
            }
        }
        return null;
    }

    /**
     * Any match yields exactly one synthetic event dated today.
     */
    public List<CatalystEvent> detect(List<NewsItem> news) {
        String match = firstMatch(news);
        if (match == null) {
            return List.of();
        }
        return List.of(CatalystEvent.recent(match));
    }
}
