package net.findmypaper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;
import java.util.List;

/**
 * One entry of the corpus metadata file ({@code papers.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusPaperRecord(
    String id,
    String title,
    @Nullable Integer year,
    @Nullable List<String> authors,
    @Nullable String journal,
    @Nullable String doi,
    @Nullable String url,
    @Nullable String source
) {
}
