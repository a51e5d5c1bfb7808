package com.example.udahub.pipeline;

import com.example.udahub.model.TicketSession;
import com.example.udahub.routing.RoutingSignal;

public record StageResult(TicketSession session, RoutingSignal signal) {}
