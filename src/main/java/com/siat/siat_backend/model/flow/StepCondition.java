package com.siat.siat_backend.model.flow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Declared branch of a step. Stored with the flow, never evaluated by the runner. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StepCondition {
    private String expression;
    private String nextStep;
}
