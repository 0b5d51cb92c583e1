package com.feedcron.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JobStore kept in memory. Used by default and in tests; nothing survives a restart.
 */
public class InMemoryJobStore implements JobStore {
    private final Map<String, JobDefinition> definitions = new LinkedHashMap<>();
    private final List<ExecutionLogEntry> executionLog = new ArrayList<>();

    private static String key(String jobKey, String jobGroup) {
        return jobGroup + "." + jobKey;
    }

    @Override
    public synchronized Optional<JobDefinition> get(String jobKey, String jobGroup) {
        return Optional.ofNullable(definitions.get(key(jobKey, jobGroup)));
    }

    @Override
    public synchronized JobDefinition upsert(JobDefinition definition) {
        String k = key(definition.getJobKey(), definition.getJobGroup());
        JobDefinition existing = definitions.get(k);
        JobDefinition.Builder b = definition.toBuilder();
        if (existing != null) {
            b.id(existing.getId()).createdAt(existing.getCreatedAt());
        } else {
            b.id(UUID.randomUUID().toString());
            if (definition.getCreatedAt() == null) {
                b.createdAt(Instant.now());
            }
        }
        JobDefinition stored = b.build();
        definitions.put(k, stored);
        return stored;
    }

    @Override
    public synchronized boolean delete(String jobKey, String jobGroup) {
        return definitions.remove(key(jobKey, jobGroup)) != null;
    }

    @Override
    public synchronized List<JobDefinition> listAll() {
        return new ArrayList<>(definitions.values());
    }

    @Override
    public synchronized boolean updatePauseState(String jobKey, String jobGroup, boolean paused) {
        JobDefinition existing = definitions.get(key(jobKey, jobGroup));
        if (existing == null) {
            return false;
        }
        definitions.put(key(jobKey, jobGroup), existing.toBuilder().paused(paused).build());
        return true;
    }

    @Override
    public synchronized boolean updateCronExpression(String jobKey, String jobGroup, String cronExpression) {
        JobDefinition existing = definitions.get(key(jobKey, jobGroup));
        if (existing == null) {
            return false;
        }
        definitions.put(key(jobKey, jobGroup), existing.toBuilder().cronExpression(cronExpression).build());
        return true;
    }

    @Override
    public synchronized boolean updateLastExecution(String jobKey, String jobGroup,
                                                    Instant executionTime, ExecutionStatus status) {
        JobDefinition existing = definitions.get(key(jobKey, jobGroup));
        if (existing == null) {
            return false;
        }
        definitions.put(key(jobKey, jobGroup), existing.toBuilder()
                .lastExecutionTime(executionTime)
                .lastStatus(status)
                .build());
        return true;
    }

    @Override
    public synchronized void appendExecutionLog(ExecutionLogEntry entry) {
        executionLog.add(entry);
    }

    @Override
    public synchronized List<ExecutionLogEntry> queryExecutionLog(String jobKey, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        return executionLog.stream()
                .filter(e -> e.getJobKey().equals(jobKey))
                .sorted(Comparator.comparing(ExecutionLogEntry::getStartTime).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
