package com.flagship.value_ledger.rewards;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Opaque single-use codes of the form {@code RWD-<base36 millis>-<4 chars>}.
 * Uniqueness is enforced by the database; the random suffix keeps collisions
 * within the same millisecond unlikely.
 */
@Component
public class RedemptionCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 4;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RedemptionCodeGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        StringBuilder code = new StringBuilder("RWD-")
                .append(Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
