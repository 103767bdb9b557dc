package io.swarmhive.util;

import java.util.concurrent.ThreadLocalRandom;

public final class Ids {
    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    private Ids() {
    }

    /**
     * {@code <prefix>-<hash6>-<base36 time><3 random>}; the hash ties ids to their project.
     */
    public static String newCellId(String prefix, String projectKey, long nowMs) {
        String hash = Long.toString(Integer.toUnsignedLong(projectKey.hashCode()), 36);
        if (hash.length() > 6) {
            hash = hash.substring(0, 6);
        }
        return prefix + "-" + hash + "-" + Long.toString(nowMs, 36) + randomSuffix(3);
    }

    public static String newCommentId(long nowMs) {
        return "cmt-" + Long.toString(nowMs, 36) + randomSuffix(5);
    }

    private static String randomSuffix(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return sb.toString();
    }
}
