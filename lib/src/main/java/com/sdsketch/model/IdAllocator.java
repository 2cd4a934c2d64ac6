package com.sdsketch.model;

/**
 * Hands out sequential ids. Each parse, write or patch session owns its own allocator, so no id
 * state is shared between files.
 */
public final class IdAllocator {
    private int next;

    private IdAllocator(int next) {
        this.next = next;
    }

    public static IdAllocator startingAfter(int maxUsedId) {
        return new IdAllocator(Math.max(0, maxUsedId) + 1);
    }

    public int allocate() {
        return next++;
    }

    public int peek() {
        return next;
    }

    /** Makes sure ids handed out later stay above {@code usedId}. */
    public void reserve(int usedId) {
        if (usedId >= next) {
            next = usedId + 1;
        }
    }
}
