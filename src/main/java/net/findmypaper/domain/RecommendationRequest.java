package net.findmypaper.domain;

import java.util.List;
import java.util.Objects;
import net.findmypaper.model.LibraryEntry;

/**
 * Output constraints shared by every query mode.
 *
 * @param count number of recommendations to keep (N); non-positive yields an empty result
 * @param years inclusive publication-year window
 * @param context library whose titles are never recommended; may be empty
 */
public record RecommendationRequest(int count, YearRange years, List<LibraryEntry> context) {

    public RecommendationRequest {
        years = Objects.requireNonNullElse(years, YearRange.unbounded());
        context = context == null ? List.of() : List.copyOf(context);
    }

    public static RecommendationRequest of(int count, YearRange years) {
        return new RecommendationRequest(count, years, List.of());
    }

    public RecommendationRequest withContext(List<LibraryEntry> library) {
        return new RecommendationRequest(count, years, library);
    }
}
