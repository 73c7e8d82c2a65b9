package com.mtg.sim.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The stack: last in, first out. Items are never reordered.
 */
public class PriorityStack {
    private final Deque<StackItem> items = new ArrayDeque<>();

    public void push(StackItem item) {
        items.push(item);
    }

    /**
     * Remove and return the top item.
     * @throws IllegalStateException if the stack is empty
     */
    public StackItem pop() {
        StackItem item = items.poll();
        if (item == null) {
            throw new IllegalStateException("Cannot pop from an empty stack");
        }
        return item;
    }

    public Optional<StackItem> peek() {
        return Optional.ofNullable(items.peek());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<StackItem> find(long id) {
        for (StackItem item : items) {
            if (item.getId() == id) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public boolean contains(long id) {
        return find(id).isPresent();
    }

    /**
     * Snapshot of the stack, top first.
     */
    public List<StackItem> getItems() {
        return new ArrayList<>(items);
    }
}
