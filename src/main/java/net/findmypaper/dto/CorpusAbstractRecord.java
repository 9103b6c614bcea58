package net.findmypaper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the corpus abstracts file ({@code abstracts.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusAbstractRecord(
    String id,
    @JsonProperty("abstract") String abstractText
) {
}
