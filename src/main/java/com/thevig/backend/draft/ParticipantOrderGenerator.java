package com.thevig.backend.draft;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class ParticipantOrderGenerator {

    private final Random random;

    /**
     * Returns a random permutation of the given participants. The input list
     * is not modified.
     */
    public List<String> generate(List<String> participantIds) {
        if (participantIds == null || participantIds.isEmpty()) {
            throw new IllegalArgumentException("At least one participant is required");
        }
        Set<String> seen = new HashSet<>();
        List<String> order = new ArrayList<>(participantIds.size());
        for (String id : participantIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Participant id must not be blank");
            }
            String trimmed = id.trim();
            if (!seen.add(trimmed)) {
                throw new IllegalArgumentException("Duplicate participant id: " + trimmed);
            }
            order.add(trimmed);
        }
        Collections.shuffle(order, random);
        return List.copyOf(order);
    }
}
