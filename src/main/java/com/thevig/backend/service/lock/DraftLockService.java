package com.thevig.backend.service.lock;

import com.thevig.backend.config.AppProperties;
import com.thevig.backend.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serializes pick attempts on one draft across instances with a Redisson lock.
 * The conditional update on the draft row stays the correctness guarantee; the
 * lock only keeps contending requests from reaching the database together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftLockService {

    private static final String PICK_LOCK_PREFIX = "lock:draft:";
    private static final String PICK_LOCK_SUFFIX = ":pick";

    private final RedissonClient redissonClient;
    private final AppProperties appProperties;

    public <T> T withDraftLock(String draftId, Supplier<T> action) {
        AppProperties.Lock config = appProperties.getDraft().getLock();
        RLock lock = redissonClient.getLock(PICK_LOCK_PREFIX + draftId + PICK_LOCK_SUFFIX);

        try {
            if (!lock.tryLock(config.getWaitMs(), config.getLeaseMs(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ [DraftLock] Could not acquire pick lock for draft {} within {}ms",
                        draftId, config.getWaitMs());
                throw new ConcurrencyConflictException("Draft " + draftId + " is busy, try again");
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("❌ [DraftLock] Interrupted while waiting for lock on draft {}", draftId, e);
            throw new ConcurrencyConflictException("Interrupted while waiting for draft " + draftId, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
