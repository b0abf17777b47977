package com.siat.siat_backend.model.flow;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowStep {

    private String id;
    private String name;

    // start, transform, database, condition, output, ... (free-form, resolved by StepExecutorRegistry)
    private String type;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    @Builder.Default
    private List<String> nextSteps = new ArrayList<>();

    private List<StepCondition> conditions;
}
