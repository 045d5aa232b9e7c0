package org.pragmatica.macro.expander;

import org.pragmatica.macro.error.ExpansionFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Frames of the expansions currently in progress, bounded by a fixed depth.
 * One stack serves one top-level expansion call and is never shared between threads.
 */
public final class ExpansionStack {

    private final int limit;
    private final List<ExpansionFrame> frames = new ArrayList<>();

    public ExpansionStack(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Recursion limit must be at least 1, got " + limit);
        }
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    public int depth() {
        return frames.size();
    }

    public boolean canPush() {
        return frames.size() < limit;
    }

    public void push(ExpansionFrame frame) {
        if (!canPush()) {
            throw new IllegalStateException("Expansion stack is full (limit " + limit + ")");
        }
        frames.add(frame);
    }

    /**
     * Record the rule chosen for the innermost expansion.
     */
    public void selectRule(int ruleIndex) {
        var top = frames.size() - 1;
        frames.set(top, frames.get(top).withRule(ruleIndex));
    }

    public ExpansionFrame pop() {
        return frames.remove(frames.size() - 1);
    }

    /**
     * Copy of the active frames, oldest first.
     */
    public List<ExpansionFrame> snapshot() {
        return List.copyOf(frames);
    }
}
