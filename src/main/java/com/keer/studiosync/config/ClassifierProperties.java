package com.keer.studiosync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Tenant specific markers and keywords used by the mail classifier.
 * Every list falls back to the HALLEL Shibuya values when left unset.
 */
@ConfigurationProperties(prefix = "app.classifier")
public record ClassifierProperties(
        List<String> brandMarkers,
        List<String> includedLocations,
        List<String> excludedLocations,
        List<String> bookingKeywords,
        List<String> cancellationKeywords,
        @DefaultValue("渋谷店") String studioLocation,
        @DefaultValue("0.7") double minConfidence,
        @DefaultValue("false") boolean acceptUnlabeledLocation,
        @DefaultValue("false") boolean allowCrossMidnight) {

    public static final List<String> DEFAULT_BRAND_MARKERS = List.of("HALLEL");
    public static final List<String> DEFAULT_INCLUDED_LOCATIONS = List.of("渋谷店", "shibuya");
    public static final List<String> DEFAULT_EXCLUDED_LOCATIONS = List.of("半蔵門店", "hanzomon");
    public static final List<String> DEFAULT_BOOKING_KEYWORDS = List.of(
            "ご予約ありがとうございます",
            "以下の内容を承りました",
            "ご確認ください",
            "予約が完了",
            "承りました",
            "ご予約をいただきました");
    public static final List<String> DEFAULT_CANCELLATION_KEYWORDS = List.of(
            "キャンセルいたしました",
            "予約をキャンセル",
            "キャンセルしました",
            "取り消し",
            "キャンセル完了");

    public ClassifierProperties {
        brandMarkers = orDefault(brandMarkers, DEFAULT_BRAND_MARKERS);
        includedLocations = orDefault(includedLocations, DEFAULT_INCLUDED_LOCATIONS);
        excludedLocations = orDefault(excludedLocations, DEFAULT_EXCLUDED_LOCATIONS);
        bookingKeywords = orDefault(bookingKeywords, DEFAULT_BOOKING_KEYWORDS);
        cancellationKeywords = orDefault(cancellationKeywords, DEFAULT_CANCELLATION_KEYWORDS);
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("app.classifier.min-confidence must be within [0, 1]: " + minConfidence);
        }
    }

    public static ClassifierProperties defaults() {
        return new ClassifierProperties(null, null, null, null, null, "渋谷店", 0.7, false, false);
    }

    private static List<String> orDefault(List<String> values, List<String> fallback) {
        return values == null || values.isEmpty() ? fallback : List.copyOf(values);
    }
}
