package com.collab.service;

import com.collab.config.CollaborationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Round-robin over a fixed palette, indexed by the member count at join time.
 */
@Component
public class ColorAllocator {
    private final List<String> palette;

    @Autowired
    public ColorAllocator(CollaborationProperties properties) {
        if (properties.getPalette().isEmpty()) {
            throw new IllegalArgumentException("collab.palette must not be empty");
        }
        this.palette = List.copyOf(properties.getPalette());
    }

    public String colorFor(int memberIndex) {
        return palette.get(Math.floorMod(memberIndex, palette.size()));
    }
}
