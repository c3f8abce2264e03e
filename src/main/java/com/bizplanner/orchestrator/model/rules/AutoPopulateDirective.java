package com.bizplanner.orchestrator.model.rules;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AutoPopulateDirective {
    String targetField;
    PopulateSource source;
    Object value;
    String lookupTable;
    String formula;
}
