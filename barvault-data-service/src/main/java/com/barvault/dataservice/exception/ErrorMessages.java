package com.barvault.dataservice.exception;

import java.util.List;

/**
 * User-facing error templates with resolution steps.
 */
public final class ErrorMessages {

    public enum Category {
        DATA,
        CONNECTION,
        INPUT,
        RATE_LIMIT,
        CORRUPTION
    }

    public record ErrorMessage(Category category, String title, String message, List<String> resolutionSteps) {

        /**
         * Render as a multi-line block: title, message, then numbered steps.
         */
        public String format() {
            StringBuilder sb = new StringBuilder();
            sb.append(title).append(": ").append(message);
            if (!resolutionSteps.isEmpty()) {
                sb.append("\nResolution steps:");
                for (int i = 0; i < resolutionSteps.size(); i++) {
                    sb.append("\n  ").append(i + 1).append(". ").append(resolutionSteps.get(i));
                }
            }
            return sb.toString();
        }
    }

    public static final ErrorMessage DATA_NOT_FOUND_NO_PROVIDER = new ErrorMessage(
        Category.DATA,
        "Market data not available",
        "The requested bars are not cached and the remote provider is unavailable.",
        List.of(
            "Start the market data provider and check that provider.baseUrl points at it",
            "Retry the request once the provider is reachable",
            "Import the data manually from CSV",
            "Check that the requested date range is within the provider's history"
        ));

    public static final ErrorMessage DATA_NOT_FOUND_EMPTY = new ErrorMessage(
        Category.DATA,
        "No bars returned",
        "The provider returned no bars for the requested range.",
        List.of(
            "Check that the range covers trading hours for this instrument",
            "Verify the instrument id (SYMBOL.VENUE) and bar spec",
            "Import the data manually from CSV"
        ));

    public static final ErrorMessage PROVIDER_UNAVAILABLE = new ErrorMessage(
        Category.CONNECTION,
        "Provider unavailable",
        "Fetching from the remote provider kept failing and retries are exhausted.",
        List.of(
            "Check the provider logs and network connectivity",
            "Wait a minute and retry",
            "Lower provider.requestsPerSecond if the provider is throttling"
        ));

    public static final ErrorMessage RATE_LIMIT_EXCEEDED = new ErrorMessage(
        Category.RATE_LIMIT,
        "Provider rate limit exceeded",
        "The provider rejected requests because its quota was exceeded.",
        List.of(
            "Wait for the automatic retry with backoff",
            "Reduce concurrent fetches",
            "Use CSV import for bulk loads"
        ));

    public static final ErrorMessage CATALOG_CORRUPTION = new ErrorMessage(
        Category.CORRUPTION,
        "Catalog corruption detected",
        "A partition file could not be read.",
        List.of(
            "Delete or move the reported file out of the bar directory",
            "Re-fetch or re-import the affected range",
            "Check disk health and free space"
        ));

    public static final ErrorMessage INVALID_INSTRUMENT = new ErrorMessage(
        Category.INPUT,
        "Invalid instrument",
        "The instrument id is not recognised.",
        List.of(
            "Use the SYMBOL.VENUE format, e.g. AAPL.NASDAQ",
            "Check the venue code"
        ));

    private ErrorMessages() {
    }
}
