package com.sweeper.dto;

import com.sweeper.model.ValidationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LayoutValidationDTO {

    boolean ok;
    String rule;
    String message;
    List<List<Integer>> layout;

    public static LayoutValidationDTO fromResult(ValidationResult result) {
        return LayoutValidationDTO.builder()
                .ok(result.isOk())
                .rule(result.getFailedRule() != null ? result.getFailedRule().name() : null)
                .message(result.getMessage())
                .layout(result.isOk() ? result.getLayout().toRows() : null)
                .build();
    }
}
