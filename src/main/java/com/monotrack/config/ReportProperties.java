package com.monotrack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monotrack.report")
public record ReportProperties(String defaultTimezone, String displayCurrency) {}
