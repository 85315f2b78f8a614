package com.crossfire.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Computes a host's private queue names and picks one for each submitted job.
 *
 * <p>A host only ever assigns into its own queues. Duplicate submissions are not detected here.
 */
public class ShardAssigner {
    private final Random random;

    /**
     * Create a shard assigner.
     *
     * @param random source for queue selection; pass a seeded instance for reproducible picks
     */
    public ShardAssigner(Random random) {
        this.random = random;
    }

    /**
     * Queue names for a host: {@code max(1, workerCount / 2)} entries named
     * {@code queue-for-<host>-<i>}, lower-cased.
     *
     * @param workerCount worker threads configured on the host
     * @param hostId host name
     * @return ordered queue names
     */
    public static List<String> queues(int workerCount, String hostId) {
        int count = Math.max(1, workerCount / 2);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(("queue-for-" + hostId + "-" + i).toLowerCase(Locale.ROOT));
        }
        return out;
    }

    /**
     * Picks a queue uniformly at random.
     *
     * @param queues candidate queues
     * @return chosen queue name
     */
    public String assign(List<String> queues) {
        if (queues == null || queues.isEmpty()) {
            throw new IllegalArgumentException("queues must not be empty");
        }
        return queues.get(random.nextInt(queues.size()));
    }
}
