package net.findmypaper.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.util.List;

/**
 * One entry of a JSON user library.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LibraryEntryRecord(
    String title,
    @JsonProperty("abstract") @JsonAlias("abstractText") @Nullable String abstractText,
    @Nullable List<String> authors,
    @Nullable Integer year,
    @Nullable String doi
) {
}
