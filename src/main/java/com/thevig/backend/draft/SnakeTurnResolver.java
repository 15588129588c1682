package com.thevig.backend.draft;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves whose turn it is in a snake draft. Odd rounds walk the draft order
 * forward, even rounds walk it backward, so the last picker of a round is the
 * first picker of the next one.
 *
 * <p>The pick index (number of committed picks) is the only input; nothing
 * else about the current turn is stored.
 */
@Component
public class SnakeTurnResolver {

    public Optional<String> whoseTurn(Draft draft) {
        if (draft == null || draft.getStatus() != DraftStatus.IN_PROGRESS) {
            return Optional.empty();
        }
        if (draft.getCurrentPick() >= draft.getTotalPicks() || draft.participantCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(participantAt(draft.getDraftOrder(), draft.getCurrentPick()));
    }

    /**
     * Participant picking at the given 0-based pick index, regardless of draft
     * status.
     */
    public String participantAt(List<String> draftOrder, int pickIndex) {
        int n = draftOrder.size();
        if (n == 0) {
            throw new IllegalArgumentException("Draft order is empty");
        }
        if (pickIndex < 0) {
            throw new IllegalArgumentException("Pick index must not be negative: " + pickIndex);
        }
        int round = roundOf(pickIndex, n);
        int position = pickIndex % n;
        int index = round % 2 == 1 ? position : n - 1 - position;
        return draftOrder.get(index);
    }

    /**
     * 1-based round of a 0-based pick index.
     */
    public int roundOf(int pickIndex, int participantCount) {
        return pickIndex / participantCount + 1;
    }

    /**
     * Round stored on the draft once {@code pickIndex} picks are committed;
     * stays on the last round after the final pick.
     */
    public int currentRoundAfter(int pickIndex, int participantCount, int totalRounds) {
        return Math.min(roundOf(pickIndex, participantCount), totalRounds);
    }

    public boolean isRoundBoundary(int pickIndex, int participantCount) {
        return pickIndex > 0 && pickIndex % participantCount == 0;
    }
}
