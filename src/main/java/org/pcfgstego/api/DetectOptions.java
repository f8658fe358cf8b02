package org.pcfgstego.api;

import org.pcfgstego.codec.search.Wordlists;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional inputs of a detection call.
 *
 * @param keys Candidate keys to rank; empty skips the key search.
 * @param messages Candidate messages; empty uses the configured defaults.
 * @param slotSymbols Slot order overriding the configured one; empty keeps the configuration.
 */
public record DetectOptions(List<String> keys, List<String> messages, List<String> slotSymbols) {

    public DetectOptions {
        keys = List.copyOf(keys);
        messages = List.copyOf(messages);
        slotSymbols = List.copyOf(slotSymbols);
    }

    public static DetectOptions none() {
        return new DetectOptions(List.of(), List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> keys = new ArrayList<>();
        private final List<String> messages = new ArrayList<>();
        private final List<String> slotSymbols = new ArrayList<>();

        public Builder withKeys(List<String> keys) {
            this.keys.addAll(keys);
            return this;
        }

        public Builder withMessages(List<String> messages) {
            this.messages.addAll(messages);
            return this;
        }

        /**
         * Adds the messages of a wordlist file.
         *
         * @param wordlist One message per line.
         * @return This builder.
         * @throws IOException if the file cannot be read.
         */
        public Builder withWordlist(Path wordlist) throws IOException {
            this.messages.addAll(Wordlists.load(wordlist));
            return this;
        }

        public Builder withSlotSymbols(List<String> slotSymbols) {
            this.slotSymbols.addAll(slotSymbols);
            return this;
        }

        public DetectOptions build() {
            return new DetectOptions(keys, messages, slotSymbols);
        }
    }
}
