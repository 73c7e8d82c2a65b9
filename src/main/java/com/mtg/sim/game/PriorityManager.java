package com.mtg.sim.game;

/**
 * Tracks which player holds priority and how many players have passed in a row.
 * Seats are numbered in turn order.
 */
public class PriorityManager {
    private final PriorityStack stack;
    private final int playerCount;

    private int activeSeat;
    private int holderSeat;
    private int consecutivePasses;

    public PriorityManager(PriorityStack stack, int playerCount) {
        if (playerCount < 1) {
            throw new IllegalArgumentException("Need at least one player");
        }
        this.stack = stack;
        this.playerCount = playerCount;
    }

    /**
     * Start a step: the active player receives priority.
     */
    public void beginStep(int activeSeat) {
        this.activeSeat = activeSeat;
        this.holderSeat = activeSeat;
        this.consecutivePasses = 0;
    }

    /**
     * Pass priority.
     * @throws IllegalStateException if the seat does not hold priority
     */
    public PassOutcome passPriority(int seat) {
        if (seat != holderSeat) {
            throw new IllegalStateException("Seat " + seat + " passed without holding priority (holder is "
                    + holderSeat + ")");
        }
        consecutivePasses++;
        if (consecutivePasses >= playerCount) {
            consecutivePasses = 0;
            holderSeat = activeSeat;
            return stack.isEmpty() ? PassOutcome.STEP_ENDS : PassOutcome.RESOLVE_TOP;
        }
        holderSeat = (holderSeat + 1) % playerCount;
        return PassOutcome.PRIORITY_PASSED;
    }

    /**
     * A player cast a spell or activated an ability: the pass run restarts and
     * priority returns to the active player, whoever acted.
     */
    public void actionTaken(int seat) {
        if (seat < 0 || seat >= playerCount) {
            throw new IllegalArgumentException("No seat " + seat);
        }
        consecutivePasses = 0;
        holderSeat = activeSeat;
    }

    /**
     * After the top of the stack resolves the active player receives priority.
     */
    public void resetToActivePlayer() {
        consecutivePasses = 0;
        holderSeat = activeSeat;
    }

    public int getHolderSeat() {
        return holderSeat;
    }

    public int getActiveSeat() {
        return activeSeat;
    }

    public boolean holdsPriority(int seat) {
        return holderSeat == seat;
    }

    public int getConsecutivePasses() {
        return consecutivePasses;
    }
}
