package com.example.effectivediff.infrastructure;

import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.MoveReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

/**
 * JSON form of the two artifacts a run produces: the effective diff and the move report.
 * Output is indented, omits absent line numbers and is stable across runs.
 */
@Component
public class EffectiveDiffArtifactSerializer {
    private final ObjectMapper objectMapper;

    public EffectiveDiffArtifactSerializer() {
        this(
                JsonMapper.builder()
                        .serializationInclusion(JsonInclude.Include.NON_NULL)
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .build());
    }

    public EffectiveDiffArtifactSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeEffectiveDiff(GitDiff effectiveDiff) {
        return toJson(effectiveDiff);
    }

    public GitDiff readEffectiveDiff(String json) {
        return fromJson(json, GitDiff.class);
    }

    public String writeMoveReport(MoveReport moveReport) {
        return toJson(moveReport);
    }

    public MoveReport readMoveReport(String json) {
        return fromJson(json, MoveReport.class);
    }

    private String toJson(Object artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            throw new ArtifactSerializationException(
                    "Unable to serialize " + artifact.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ArtifactSerializationException(
                    "Unable to deserialize " + type.getSimpleName(), e);
        }
    }
}
