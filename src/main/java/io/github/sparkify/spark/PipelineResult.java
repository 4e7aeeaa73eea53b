package io.github.sparkify.spark;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a pipeline run: what each phase wrote and how long it took.
 */
public class PipelineResult {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<TableMetrics> tables = new ArrayList<>();
    private long catalogPhaseMs;
    private long eventPhaseMs;

    void addCatalogPhase(List<TableMetrics> written, long elapsedMs) {
        tables.addAll(written);
        this.catalogPhaseMs = elapsedMs;
    }

    void addEventPhase(List<TableMetrics> written, long elapsedMs) {
        tables.addAll(written);
        this.eventPhaseMs = elapsedMs;
    }

    @JsonProperty("tables")
    public List<TableMetrics> getTables() {
        return Collections.unmodifiableList(tables);
    }

    public Optional<TableMetrics> get(LakeTable table) {
        return tables.stream().filter(m -> m.table() == table).findFirst();
    }

    /**
     * Rows written for a table, or -1 if the table was not written in this run.
     */
    public long rows(LakeTable table) {
        return get(table).map(TableMetrics::getRows).orElse(-1L);
    }

    @JsonProperty("catalogPhaseMs")
    public long getCatalogPhaseMs() { return catalogPhaseMs; }

    @JsonProperty("eventPhaseMs")
    public long getEventPhaseMs() { return eventPhaseMs; }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render pipeline result", e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PipelineResult[");
        for (TableMetrics m : tables) {
            sb.append(m.getTableName()).append('=').append(m.getRows()).append(", ");
        }
        return sb.append(String.format("catalog=%dms, event=%dms]", catalogPhaseMs, eventPhaseMs)).toString();
    }
}
