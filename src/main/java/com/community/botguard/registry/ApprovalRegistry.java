package com.community.botguard.registry;

import com.community.botguard.exception.AlreadyResolvedException;
import com.community.botguard.exception.ApprovalNotFoundException;
import com.community.botguard.exception.DuplicateEntryException;
import com.community.botguard.model.ApprovalKey;
import com.community.botguard.model.ApprovalStatus;
import com.community.botguard.model.PendingApproval;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Authoritative in-memory state of every participant still awaiting a decision.
 *
 * <p>Entries are keyed by {@link ApprovalKey}. {@link #resolve} is linearizable per key:
 * the terminal transition and the removal from the live map happen in one
 * {@code compute} step, so exactly one caller wins and every other caller gets
 * {@link AlreadyResolvedException}. Resolved entries are kept as tombstones for a
 * retention window so late callers can be told who won instead of "not found".
 *
 * <p>The registry never calls the audit log, the notifier or the platform.
 */
@Component
public class ApprovalRegistry {

    private static final Logger log = LoggerFactory.getLogger(ApprovalRegistry.class);

    private final ConcurrentHashMap<ApprovalKey, PendingApproval> live = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ApprovalKey, PendingApproval> resolved = new ConcurrentHashMap<>();
    private final Clock clock;

    public ApprovalRegistry(Clock clock) {
        this.clock = clock;
    }

    public PendingApproval create(String communityId, String participantId, long deadline) {
        return create(PendingApproval.builder()
                .communityId(communityId)
                .participantId(participantId)
                .deadline(deadline)
                .build());
    }

    /**
     * Register a new pending entry from the given template. The registry assigns the
     * approval ID and status; identifiers and deadline come from the template.
     *
     * @throws DuplicateEntryException if the participant is already pending in the community
     */
    public PendingApproval create(PendingApproval template) {
        ApprovalKey key = template.key();
        PendingApproval entry = template.toBuilder()
                .approvalId(UUID.randomUUID().toString())
                .detectedAt(template.getDetectedAt() > 0 ? template.getDetectedAt() : clock.millis())
                .status(ApprovalStatus.PENDING)
                .resolvedBy(null)
                .resolvedAt(0)
                .timerHandle(null)
                .build();

        if (live.putIfAbsent(key, entry) != null) {
            throw new DuplicateEntryException(key);
        }
        // A re-added participant starts a brand-new lifecycle.
        resolved.remove(key);
        return snapshot(entry);
    }

    public Optional<PendingApproval> get(String communityId, String participantId) {
        return Optional.ofNullable(live.get(new ApprovalKey(communityId, participantId))).map(this::snapshot);
    }

    /**
     * Hand the countdown timer to the entry it belongs to. If the entry was resolved
     * before the timer could be attached, the timer is cancelled right away.
     *
     * @return true if the entry now owns the timer
     */
    public boolean attachTimer(ApprovalKey key, String approvalId, ScheduledFuture<?> timerHandle) {
        AtomicBoolean attached = new AtomicBoolean(false);
        live.computeIfPresent(key, (k, entry) -> {
            if (entry.getApprovalId().equals(approvalId)) {
                entry.setTimerHandle(timerHandle);
                attached.set(true);
            }
            return entry;
        });
        if (!attached.get()) {
            timerHandle.cancel(false);
        }
        return attached.get();
    }

    /**
     * Remember how many reviewers received the review request.
     */
    public void recordNotified(ApprovalKey key, String approvalId, int delivered) {
        live.computeIfPresent(key, (k, entry) -> {
            if (entry.getApprovalId().equals(approvalId)) {
                entry.setNotifiedReviewers(delivered);
            }
            return entry;
        });
    }

    public PendingApproval resolve(String communityId, String participantId,
                                   ApprovalStatus outcome, String actorId) {
        return resolve(new ApprovalKey(communityId, participantId), null, outcome, actorId);
    }

    /**
     * Move a pending entry to a terminal status, remove it from the live map and
     * cancel its timer.
     *
     * @param expectedApprovalId when set, only the lifecycle with this ID may be resolved;
     *                           used by timers so a stale one cannot resolve a newer entry
     * @throws AlreadyResolvedException  if the entry was resolved by someone else
     * @throws ApprovalNotFoundException if nothing is known about the key
     */
    public PendingApproval resolve(ApprovalKey key, String expectedApprovalId,
                                   ApprovalStatus outcome, String actorId) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Outcome must be terminal, got " + outcome);
        }

        AtomicReference<PendingApproval> winner = new AtomicReference<>();
        live.computeIfPresent(key, (k, entry) -> {
            if (expectedApprovalId != null && !expectedApprovalId.equals(entry.getApprovalId())) {
                return entry;
            }
            entry.setStatus(outcome);
            entry.setResolvedBy(outcome == ApprovalStatus.TIMED_OUT ? null : actorId);
            entry.setResolvedAt(clock.millis());
            resolved.put(k, entry);
            winner.set(entry);
            return null;
        });

        PendingApproval won = winner.get();
        if (won == null) {
            PendingApproval previous = resolved.get(key);
            if (previous != null) {
                throw new AlreadyResolvedException(key, snapshot(previous));
            }
            if (expectedApprovalId != null && live.containsKey(key)) {
                throw new AlreadyResolvedException(key, null);
            }
            throw new ApprovalNotFoundException(key);
        }

        cancelTimer(won);
        return snapshot(won);
    }

    public List<PendingApproval> listPending(String communityId) {
        return live.values().stream()
                .filter(entry -> communityId == null || communityId.equals(entry.getCommunityId()))
                .map(this::snapshot)
                .sorted(Comparator.comparingLong(PendingApproval::getDetectedAt))
                .toList();
    }

    public int pendingCount() {
        return live.size();
    }

    /**
     * Pending entries whose deadline is earlier than {@code cutoff}.
     */
    public List<PendingApproval> overdue(long cutoff) {
        return live.values().stream()
                .filter(entry -> entry.getDeadline() < cutoff)
                .map(this::snapshot)
                .toList();
    }

    /**
     * Drop tombstones of entries resolved before {@code resolvedBefore}.
     *
     * @return number of tombstones removed
     */
    public int pruneResolved(long resolvedBefore) {
        int before = resolved.size();
        resolved.values().removeIf(entry -> entry.getResolvedAt() < resolvedBefore);
        return before - resolved.size();
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = 0;
        for (PendingApproval entry : live.values()) {
            if (cancelTimer(entry)) {
                cancelled++;
            }
        }
        live.clear();
        resolved.clear();
        if (cancelled > 0) {
            log.info("Approval registry shut down; cancelled {} outstanding timers", cancelled);
        }
    }

    private boolean cancelTimer(PendingApproval entry) {
        ScheduledFuture<?> handle = entry.getTimerHandle();
        return handle != null && handle.cancel(false);
    }

    private PendingApproval snapshot(PendingApproval entry) {
        PendingApproval copy = entry.toBuilder().build();
        copy.setSecondsRemaining(copy.getStatus() == ApprovalStatus.PENDING ? copy.remainingSeconds(clock.millis()) : 0);
        return copy;
    }
}
