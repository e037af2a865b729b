package com.dispatch.sessions;

import java.util.List;
import java.util.Map;

public record RuntimeStats(int liveSessions, Map<String, Long> liveByKind, List<String> registeredKinds) {}
