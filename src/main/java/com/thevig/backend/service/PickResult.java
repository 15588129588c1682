package com.thevig.backend.service;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;

import java.time.Instant;

/**
 * Outcome of a committed pick or skip.
 *
 * @param nextPicker   participant whose turn it is now, null once completed
 * @param nextDeadline deadline of the next turn, null once completed
 */
public record PickResult(DraftPick pick, Draft draft, String nextPicker, Instant nextDeadline, boolean completed) {
}
