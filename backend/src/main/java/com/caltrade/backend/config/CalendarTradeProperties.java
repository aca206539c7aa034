package com.caltrade.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "caltrade")
@Data
@Validated
public class CalendarTradeProperties {

    @Valid
    private Trading trading = new Trading();
    @Valid
    private Window window = new Window();
    @Valid
    private Poll poll = new Poll();
    private Push push = new Push();
    @Valid
    private Ledger ledger = new Ledger();
    @Valid
    private Calendar calendar = new Calendar();
    @Valid
    private Execution execution = new Execution();
    private Notification notification = new Notification();
    private Admin admin = new Admin();

    @Data
    public static class Trading {
        @Pattern(regexp = "[A-Za-z]{1,5}")
        private String defaultSymbol = "BYD";

        @Positive
        private int defaultQuantity = 1;

        @NotEmpty
        private List<String> keywords = new ArrayList<>(List.of("BUY", "SELL", "TRADE"));
    }

    @Data
    public static class Window {
        // Wide scan used by the push path
        private Duration widePast = Duration.ofHours(24);
        private Duration wideFuture = Duration.ofHours(24);
        // Narrow look-ahead used by the poll path
        private Duration lookAhead = Duration.ofMinutes(2);
    }

    @Data
    public static class Poll {
        private boolean enabled = true;

        @Min(1000)
        private long intervalMs = 300_000;

        private long initialDelayMs = 30_000;
    }

    @Data
    public static class Push {
        private String channelToken = "";
    }

    @Data
    public static class Ledger {
        @Positive
        private int capacity = 100;

        @NotBlank
        private String storeKey = "EXECUTED_EVENTS";
    }

    @Data
    public static class Calendar {
        private String baseUrl = "https://www.googleapis.com/calendar/v3";
        private String calendarId = "primary";
        private String accessToken = "";
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Execution {
        private String baseUrl = "";
        private String apiKey = "";
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 30000;
        private Circuit circuit = new Circuit();
    }

    @Data
    public static class Circuit {
        private float failureRateThreshold = 50;
        private long waitOpenSeconds = 60;
        private int slidingWindowSize = 10;
    }

    @Data
    public static class Notification {
        private String discordWebhookUrl = "";
        private String title = "Trading Bot Notification";
    }

    @Data
    public static class Admin {
        private String token = "";
    }
}
