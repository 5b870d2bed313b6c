package ai.loopcanvas.dispatch.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the workers that talk to this queue: when they were last seen and what they did.
 * Workers never register explicitly; they appear on first contact and are dropped once they
 * have not been seen for {@link #WORKER_TTL}.
 *
 * When Redis is configured, entries are mirrored there with the same TTL and lookups merge the
 * mirrored entries, so every API replica lists the workers polling any of them. Idle polls
 * refresh the mirror at most once per {@link #MIRROR_INTERVAL}.
 */
@Slf4j
@Service
public class WorkerRegistryService {

    static final String WORKER_KEY_PREFIX = "dispatch_worker:";
    static final Duration WORKER_TTL = Duration.ofMinutes(10);
    static final Duration MIRROR_INTERVAL = Duration.ofMinutes(1);

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    private final Map<String, WorkerInfo> workers = new ConcurrentHashMap<>();
    private final Map<String, Instant> mirroredAt = new ConcurrentHashMap<>();

    @Autowired
    public WorkerRegistryService(ObjectProvider<RedisTemplate<String, Object>> redisTemplateProvider, Clock clock) {
        this(redisTemplateProvider.getIfAvailable(), clock);
    }

    public WorkerRegistryService(RedisTemplate<String, Object> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        log.info("Worker registry initialized (redis mirror: {})", redisTemplate != null ? "on" : "off");
    }

    /**
     * Records a poll; claimedJobId is null when the worker found nothing to do
     */
    public void recordClaim(String workerId, String workerType, String claimedJobId) {
        if (workerId == null) {
            return;
        }
        WorkerInfo info = workers.compute(workerId, (id, existing) -> {
            Instant now = clock.instant();
            WorkerInfo updated = existing != null ? existing : WorkerInfo.builder()
                    .workerId(id)
                    .firstSeen(now)
                    .build();
            if (workerType != null) {
                updated.setWorkerType(workerType);
            }
            updated.setLastSeen(now);
            updated.setPolls(updated.getPolls() + 1);
            if (claimedJobId != null) {
                updated.setClaims(updated.getClaims() + 1);
                updated.setCurrentJobId(claimedJobId);
            }
            return updated;
        });
        Instant lastMirrored = mirroredAt.get(workerId);
        if (claimedJobId != null || lastMirrored == null
                || !info.getLastSeen().isBefore(lastMirrored.plus(MIRROR_INTERVAL))) {
            mirror(info);
        }
    }

    public void recordCompletion(String workerId, String jobId) {
        recordOutcome(workerId, jobId, true);
    }

    public void recordFailure(String workerId, String jobId) {
        recordOutcome(workerId, jobId, false);
    }

    /**
     * Workers seen within the TTL, most recently seen first. Includes workers mirrored by other
     * replicas when Redis is configured.
     */
    public List<WorkerInfo> getWorkers() {
        Map<String, WorkerInfo> merged = new LinkedHashMap<>();
        readMirrored().forEach(info -> merged.put(info.getWorkerId(), info));
        workers.values().forEach(info -> merged.merge(info.getWorkerId(), info.toBuilder().build(),
                WorkerRegistryService::mostRecent));

        Instant cutoff = clock.instant().minus(WORKER_TTL);
        List<WorkerInfo> snapshot = new ArrayList<>();
        merged.values().stream()
                .filter(info -> !isExpired(info, cutoff))
                .forEach(snapshot::add);
        snapshot.sort(Comparator.comparing(WorkerInfo::getLastSeen, Comparator.nullsLast(Comparator.reverseOrder())));
        return snapshot;
    }

    public Optional<WorkerInfo> getWorker(String workerId) {
        WorkerInfo local = Optional.ofNullable(workers.get(workerId)).map(info -> info.toBuilder().build()).orElse(null);
        WorkerInfo mirrored = readMirrored(WORKER_KEY_PREFIX + workerId);
        WorkerInfo found = local == null ? mirrored : mirrored == null ? local : mostRecent(mirrored, local);
        Instant cutoff = clock.instant().minus(WORKER_TTL);
        return Optional.ofNullable(found).filter(info -> !isExpired(info, cutoff));
    }

    /**
     * Drops workers not seen within the TTL
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelay = 60000)
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(WORKER_TTL);
        int removed = 0;
        for (WorkerInfo info : workers.values()) {
            if (isExpired(info, cutoff) && workers.remove(info.getWorkerId(), info)) {
                mirroredAt.remove(info.getWorkerId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted {} worker(s) not seen since {}", removed, cutoff);
        }
        return removed;
    }

    int size() {
        return workers.size();
    }

    private void recordOutcome(String workerId, String jobId, boolean success) {
        if (workerId == null) {
            return;
        }
        WorkerInfo info = workers.computeIfPresent(workerId, (id, existing) -> {
            existing.setLastSeen(clock.instant());
            if (success) {
                existing.setCompleted(existing.getCompleted() + 1);
            } else {
                existing.setFailed(existing.getFailed() + 1);
            }
            if (jobId != null && jobId.equals(existing.getCurrentJobId())) {
                existing.setCurrentJobId(null);
            }
            return existing;
        });
        if (info == null) {
            log.debug("Outcome for job {} from unknown worker {}", jobId, workerId);
            return;
        }
        mirror(info);
    }

    private void mirror(WorkerInfo info) {
        if (redisTemplate == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(WORKER_KEY_PREFIX + info.getWorkerId(), info.asMap(), WORKER_TTL);
            mirroredAt.put(info.getWorkerId(), info.getLastSeen());
        } catch (Exception e) {
            log.warn("Failed to mirror worker {} to Redis: {}", info.getWorkerId(), e.getMessage());
        }
    }

    private List<WorkerInfo> readMirrored() {
        List<WorkerInfo> mirrored = new ArrayList<>();
        if (redisTemplate == null) {
            return mirrored;
        }
        try {
            Set<String> keys = redisTemplate.keys(WORKER_KEY_PREFIX + "*");
            if (keys == null) {
                return mirrored;
            }
            for (String key : keys) {
                WorkerInfo info = readMirrored(key);
                if (info != null) {
                    mirrored.add(info);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to read mirrored workers from Redis: {}", e.getMessage());
        }
        return mirrored;
    }

    private WorkerInfo readMirrored(String key) {
        if (redisTemplate == null) {
            return null;
        }
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value instanceof Map) {
                return WorkerInfo.fromMap((Map<?, ?>) value);
            }
            if (value != null) {
                log.warn("Ignoring unexpected Redis value under {}", key);
            }
        } catch (Exception e) {
            log.warn("Failed to read mirrored worker {}: {}", key, e.getMessage());
        }
        return null;
    }

    private static WorkerInfo mostRecent(WorkerInfo a, WorkerInfo b) {
        if (a.getLastSeen() == null) {
            return b;
        }
        if (b.getLastSeen() == null) {
            return a;
        }
        return b.getLastSeen().isBefore(a.getLastSeen()) ? a : b;
    }

    private static boolean isExpired(WorkerInfo info, Instant cutoff) {
        return info.getLastSeen() == null || info.getLastSeen().isBefore(cutoff);
    }

    /**
     * Worker as last seen by this API process or, through the Redis mirror, by another replica
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkerInfo {
        private String workerId;
        private String workerType;
        private Instant firstSeen;
        private Instant lastSeen;
        private long polls;
        private long claims;
        private long completed;
        private long failed;
        private String currentJobId;

        Map<String, Object> asMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("workerId", workerId);
            map.put("workerType", workerType);
            map.put("firstSeen", firstSeen != null ? firstSeen.toString() : null);
            map.put("lastSeen", lastSeen != null ? lastSeen.toString() : null);
            map.put("polls", polls);
            map.put("claims", claims);
            map.put("completed", completed);
            map.put("failed", failed);
            map.put("currentJobId", currentJobId);
            return map;
        }

        static WorkerInfo fromMap(Map<?, ?> map) {
            Object id = map.get("workerId");
            if (id == null) {
                return null;
            }
            return WorkerInfo.builder()
                    .workerId(id.toString())
                    .workerType(map.get("workerType") != null ? map.get("workerType").toString() : null)
                    .firstSeen(parseInstant(map.get("firstSeen")))
                    .lastSeen(parseInstant(map.get("lastSeen")))
                    .polls(toLong(map.get("polls")))
                    .claims(toLong(map.get("claims")))
                    .completed(toLong(map.get("completed")))
                    .failed(toLong(map.get("failed")))
                    .currentJobId(map.get("currentJobId") != null ? map.get("currentJobId").toString() : null)
                    .build();
        }

        private static Instant parseInstant(Object value) {
            return value != null ? Instant.parse(value.toString()) : null;
        }

        private static long toLong(Object value) {
            return value instanceof Number ? ((Number) value).longValue() : 0L;
        }
    }
}
