package org.dxworks.markframe.transform;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of block-group ids. Ids only need to be unique within one document.
 */
@FunctionalInterface
public interface GroupIdGenerator {

    String nextId(String prefix);

    /** {@code <prefix><epoch millis>_<9 random base-36 chars>}. */
    static GroupIdGenerator random() {
        return prefix -> {
            ThreadLocalRandom random = ThreadLocalRandom.current();
            StringBuilder suffix = new StringBuilder(9);
            for (int i = 0; i < 9; i++) {
                suffix.append(Character.forDigit(random.nextInt(36), 36));
            }
            return prefix + System.currentTimeMillis() + "_" + suffix;
        };
    }
}
