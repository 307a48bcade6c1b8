package com.example.orchestrator.command;

import com.example.orchestrator.intent.TextPatterns;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Report sub-types in matching priority. A phrase matches when all of its words occur in the message.
 */
public enum ReportType {
    WHATSAPP_ANALYTICS("whatsapp_analytics",
            "whatsapp ai analytics", "whatsapp ai", "whatsapp analytics", "analitik whatsapp"),
    SALES_TRENDS("sales_trends",
            "tren penjualan", "trends penjualan", "sales trends", "sales trend"),
    CUSTOMER_METRICS("customer_metrics",
            "metrix pelanggan", "metrics pelanggan", "customer metrics", "customer metric"),
    OPERATIONAL_METRICS("operational_metrics",
            "metrix operational", "metrics operational", "operational metrics", "operational metric"),
    STAFF_PERFORMANCE("staff_performance",
            "staff performance", "performa staff", "kinerja staff", "kinerja sales"),
    LOW_STOCK("low_stock",
            "low stock", "stok menipis"),
    TOTAL_INVENTORY("total_inventory",
            "total inventory", "stock report", "total stok", "stok total", "total stock"),
    AVERAGE_PRICE("average_price",
            "average price", "avg price", "rata-rata harga", "rata rata harga"),
    SALES_METRICS("sales_metrics",
            "metrix penjualan", "metrics penjualan", "sales metrics", "sales metric",
            "total penjualan", "total sales", "total revenue"),
    SALES_SUMMARY("sales_summary",
            "sales summary", "laporan penjualan", "ringkasan penjualan"),
    REPORT_MENU("report_menu");

    private final String wireName;
    private final List<String> phrases;

    ReportType(String wireName, String... phrases) {
        this.wireName = wireName;
        this.phrases = List.of(phrases);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public List<String> phrases() {
        return phrases;
    }

    /** The most specific report named in the message, if any. */
    public static Optional<ReportType> detect(Set<String> tokens) {
        for (ReportType type : values()) {
            for (String phrase : type.phrases) {
                if (TextPatterns.containsAllWords(tokens, phrase)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<ReportType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReportType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
