package com.raditha.pyrefactor.history;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates fix record ids: {@code fix-} followed by the local time to the
 * second and a four digit random suffix.
 */
public final class FixIds {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private FixIds() {
    }

    public static String generate() {
        return generate(Clock.systemDefaultZone());
    }

    public static String generate(Clock clock) {
        int suffix = ThreadLocalRandom.current().nextInt(1000, 10000);
        return "fix-" + LocalDateTime.now(clock).format(STAMP) + "-" + suffix;
    }
}
