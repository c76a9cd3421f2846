package io.github.drompincen.durableagent.runtime.support;

/** Outcome of tone polishing: either the model's rewrite or the draft unchanged, with the reason. */
public record PolishResult(String text, Source source, String fallbackReason) {

    public enum Source {
        ENRICHED("enriched"),
        FALLBACK("fallback");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static PolishResult enriched(String text) {
        return new PolishResult(text, Source.ENRICHED, null);
    }

    public static PolishResult fallback(String draft, String reason) {
        return new PolishResult(draft, Source.FALLBACK, reason);
    }

    public boolean isFallback() {
        return source == Source.FALLBACK;
    }
}
