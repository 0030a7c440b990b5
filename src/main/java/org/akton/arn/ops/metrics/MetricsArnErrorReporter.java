package org.akton.arn.ops.metrics;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import org.akton.arn.ArnError;
import org.akton.arn.ops.ArnErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports ARN errors as JSON-lines metrics via SLF4J.
 *
 * <p>Each error becomes one JSON object suitable for a metrics pipeline. The tracking key
 * is the operation name, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"arn_rejected","timestamp":"2024-01-20T10:30:00Z","trackingKey":"billing.ArnCodec.parse","code":"arn:invalid_segment","severity":"INPUT","position":"1",...}
 * }</pre>
 */
public class MetricsArnErrorReporter implements ArnErrorReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.akton.arn.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsArnErrorReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsArnErrorReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsArnErrorReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	// Package-private for testing.
	MetricsArnErrorReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(String operation, ArnError error) {
		logger.info(buildJson(operation, error));
	}

	String buildJson(String operation, ArnError error) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", eventType(error), true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "trackingKey", buildTrackingKey(operation), false);
		appendField(sb, "code", error.code().toString(), false);
		appendField(sb, "severity", error.severity().name(), false);
		appendField(sb, "operation", operation, false);
		if (error instanceof ArnError.InvalidSegment segment) {
			appendField(sb, "position", String.valueOf(segment.position()), false);
		}
		appendField(sb, "message", error.message(), false);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private static String eventType(ArnError error) {
		return error instanceof ArnError.GenerationFailed ? "arn_generation_failed" : "arn_rejected";
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}
}
