package org.pcfgstego.codec.encode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one derivation attempt. Created fresh for every attempt and discarded afterwards.
 */
final class DerivationState {

    /**
     * Where an attempt is in its lifecycle.
     */
    enum Phase {
        /** Symbols are left to expand. */
        PENDING,
        /** Every pending symbol has been resolved to terminals. */
        TERMINAL_COLLECTION,
        /** The sentence passed the naturalness check. */
        ACCEPTED,
        /** The sentence failed the naturalness check. */
        RETRY
    }

    private final String payload;
    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> used = new HashSet<>();
    private final List<String> words = new ArrayList<>();
    private final List<Choice> choices = new ArrayList<>();
    private int cursor;
    private boolean halted;
    private Phase phase = Phase.PENDING;

    DerivationState(String startSymbol, String payload) {
        this.payload = payload;
        this.pending.addFirst(startSymbol);
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    String popPending() {
        return pending.removeFirst();
    }

    /**
     * Puts tokens in front of the queue so that the leftmost token is expanded next.
     */
    void pushFront(List<String> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            pending.addFirst(tokens.get(i));
        }
    }

    /**
     * @return {@code true} once the cursor reached the end of the payload or embedding was halted.
     */
    boolean payloadExhausted() {
        return halted || cursor >= payload.length();
    }

    /**
     * Stops consuming payload for the rest of the attempt. Bits after the cursor are not embedded.
     */
    void haltPayload() {
        this.halted = true;
    }

    boolean isUsed(String symbol) {
        return used.contains(symbol);
    }

    /**
     * @return {@code true} if the payload continues with {@code codeword} at the cursor.
     */
    boolean payloadMatches(String codeword) {
        return !codeword.isEmpty() && payload.startsWith(codeword, cursor);
    }

    void consume(String symbol, String codeword) {
        cursor += codeword.length();
        used.add(symbol);
    }

    void emit(String word) {
        words.add(word);
    }

    void record(Choice choice) {
        choices.add(choice);
    }

    int cursor() {
        return cursor;
    }

    List<String> words() {
        return words;
    }

    List<Choice> choices() {
        return choices;
    }

    Phase phase() {
        return phase;
    }

    /**
     * @throws IllegalStateException if {@code next} does not follow the current phase.
     */
    void transition(Phase next) {
        boolean legal = switch (next) {
            case PENDING -> false;
            case TERMINAL_COLLECTION -> phase == Phase.PENDING;
            case ACCEPTED, RETRY -> phase == Phase.TERMINAL_COLLECTION;
        };
        if (!legal) {
            throw new IllegalStateException("Illegal derivation transition " + phase + " -> " + next);
        }
        this.phase = next;
    }
}
