package com.dispatch.sessions;

import com.dispatch.shared.model.RunSession;

public record SessionSummary(RunSession session, boolean live) {}
