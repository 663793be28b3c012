package com.whereq.tessera.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.QueryValidation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Verdict of a query dry run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryValidationResponse {
    private String engineId;
    private Boolean valid;
    private String queryType;

    /** Messages from the engine when the query was rejected */
    private List<String> errors;

    private String planText;

    /** Set when the check itself could not run */
    private ErrorKind errorKind;
    private String errorMessage;

    public static QueryValidationResponse from(QueryValidation validation) {
        return QueryValidationResponse.builder()
            .engineId(validation.getEngineId())
            .valid(validation.isValid())
            .queryType(validation.getQueryType())
            .errors(validation.getErrors())
            .planText(validation.getPlanText())
            .build();
    }

    public static QueryValidationResponse error(String engineId, ErrorKind kind, String message) {
        return QueryValidationResponse.builder()
            .engineId(engineId)
            .errorKind(kind)
            .errorMessage(message)
            .build();
    }
}
