package com.agentbench.core.service;

import com.agentbench.core.model.Job;

import java.util.List;

public record UserTestsPage(List<Job> tests, boolean hasMore) {
}
