package org.akton.arn.ops.log4j;

import org.akton.arn.ArnError;
import org.akton.arn.Cause;
import org.akton.arn.Severity;
import org.akton.arn.ops.ArnErrorReporter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Reports ARN errors using Log4j2.
 *
 * <p>Rejected input is routine for a parser of untrusted strings, so it is logged at
 * DEBUG with the {@code ARN_REJECTED} marker. Generation failures mean the entropy
 * source is broken and are logged at ERROR with {@code ARN_GENERATION_FAILED}.</p>
 */
public class Log4jArnErrorReporter implements ArnErrorReporter {

	static final Marker REJECTED_MARKER = MarkerManager.getMarker("ARN_REJECTED");
	static final Marker GENERATION_FAILED_MARKER = MarkerManager.getMarker("ARN_GENERATION_FAILED");

	private final Logger logger;

	public Log4jArnErrorReporter() {
		this(LogManager.getLogger("org.akton.arn.ArnErrorReporter"));
	}

	public Log4jArnErrorReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jArnErrorReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, ArnError error) {
		logger.atLevel(levelFor(error.severity()))
			.withMarker(markerFor(error.severity()))
			.log(formatMessage(operation, error));
	}

	static String formatMessage(String operation, ArnError error) {
		return "%s rejected: %s | code=%s, severity=%s%s".formatted(
				operation,
				neutralizeLineBreaks(error.message()),
				error.code(),
				error.severity(),
				formatCause(error));
	}

	// Rejected input is untrusted; a raw CR or LF would start a forged log line.
	static String neutralizeLineBreaks(String text) {
		return text.replace("\r", "\\r").replace("\n", "\\n");
	}

	private static String formatCause(ArnError error) {
		if (error instanceof ArnError.GenerationFailed failed && failed.cause() != null) {
			Cause cause = failed.cause();
			return ", cause=" + cause.type() + ", fingerprint=" + cause.fingerprint();
		}
		return "";
	}

	static Level levelFor(Severity severity) {
		return switch (severity) {
			case INPUT -> Level.DEBUG;
			case SYSTEM -> Level.ERROR;
		};
	}

	static Marker markerFor(Severity severity) {
		return switch (severity) {
			case INPUT -> REJECTED_MARKER;
			case SYSTEM -> GENERATION_FAILED_MARKER;
		};
	}
}
