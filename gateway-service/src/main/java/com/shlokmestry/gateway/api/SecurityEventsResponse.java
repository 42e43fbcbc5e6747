package com.shlokmestry.gateway.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shlokmestry.gateway.events.SecurityEvent;
import com.shlokmestry.gateway.events.SecurityEventSummary;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityEventsResponse(List<SecurityEvent> events, SecurityEventSummary summary) {}
