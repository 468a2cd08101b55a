package com.nevis.reports.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Settings under {@code app.reports}. A missing {@code root} is not a startup
 * failure: every scan reports it until the directory is configured.
 */
@Validated
@ConfigurationProperties(prefix = "app.reports")
public record ReportsProperties(
	Path root,
	@NotNull @Min(20) @Max(1000) @DefaultValue("80") Integer snippetRadius,
	@NotNull @Min(1) @Max(1000) @DefaultValue("50") Integer maxSnippetsPerDocument
) {}
