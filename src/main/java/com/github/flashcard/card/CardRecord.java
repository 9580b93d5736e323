package com.github.flashcard.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 导入/导出文件中的一行记录：{"term":..,"def":..,"errors":..}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"term", "def", "errors"})
public final class CardRecord {
    private final String term;
    private final String definition;
    private final int errors;

    @JsonCreator
    public CardRecord(@JsonProperty(value = "term", required = true) String term,
                      @JsonProperty(value = "def", required = true) String definition,
                      @JsonProperty("errors") Integer errors) {
        if (term == null || definition == null) {
            throw new IllegalArgumentException("term and def are required");
        }
        if (errors != null && errors < 0) {
            throw new IllegalArgumentException("errors < 0: " + errors);
        }
        this.term = term;
        this.definition = definition;
        this.errors = errors == null ? 0 : errors;
    }

    @JsonProperty("term")
    public String term() { return term; }

    @JsonProperty("def")
    public String definition() { return definition; }

    @JsonProperty("errors")
    public int errors() { return errors; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CardRecord)) return false;
        CardRecord that = (CardRecord) o;
        return errors == that.errors && term.equals(that.term) && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, definition, errors);
    }

    @Override
    public String toString() {
        return String.format("CardRecord{term=%s, def=%s, errors=%d}", term, definition, errors);
    }
}
