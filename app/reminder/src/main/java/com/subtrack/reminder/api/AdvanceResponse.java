package com.subtrack.reminder.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subtrack.reminder.model.AdvanceOutcome;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdvanceResponse(UUID subscriptionId, AdvanceOutcome outcome) {}
