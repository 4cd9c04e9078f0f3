package com.tickerlink.source;

import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds chart links in message content and embeds, and passes attachments through.
 */
public final class ContentLinkExtractor implements LinkExtractor {
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>()\"']+", Pattern.CASE_INSENSITIVE);
    private static final Set<String> CHART_HOSTS = Set.of(
            "tradingview.com", "finviz.com", "stockcharts.com", "marketchameleon.com",
            "barchart.com", "tradingeconomics.com", "prnt.sc", "imgur.com"
    );
    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".gif", ".webp");

    @Override
    public MessageLinks extract(ChannelMessage message) {
        if (message == null) {
            return MessageLinks.NONE;
        }
        List<String> charts = new ArrayList<>();
        Matcher matcher = URL.matcher(message.safeText());
        while (matcher.find()) {
            addIfChart(charts, trimTrailingPunctuation(matcher.group()));
        }
        for (String embed : message.getEmbedUrls()) {
            addIfChart(charts, embed);
        }
        List<String> attachments = new ArrayList<>();
        for (String url : message.getAttachmentUrls()) {
            if (url != null && !url.isBlank() && !attachments.contains(url)) {
                attachments.add(url);
            }
        }
        return new MessageLinks(charts, attachments);
    }

    static boolean isChartUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String host;
        String path;
        try {
            URI uri = URI.create(url.trim());
            host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return false;
        }
        for (String chartHost : CHART_HOSTS) {
            if (host.equals(chartHost) || host.endsWith("." + chartHost)) {
                return true;
            }
        }
        for (String ext : IMAGE_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private static void addIfChart(List<String> out, String url) {
        if (isChartUrl(url) && !out.contains(url)) {
            out.add(url);
        }
    }

    private static String trimTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && ".,;:!?".indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
