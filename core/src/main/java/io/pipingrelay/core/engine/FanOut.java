package io.pipingrelay.core.engine;

import io.pipingrelay.core.transfer.ChunkPipe;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies one sender body to many receiver pipes in lock-step.
 *
 * <p>
 * Each chunk is read once, offered to every live pipe, and the next read only
 * happens after every live receiver acknowledged the chunk, so the sender is
 * throttled to its slowest receiver. A receiver whose pipe fails is dropped;
 * once none is left the rest of the body is read and discarded so the sender
 * can still finish its upload.
 *
 * <p>
 * Runs on the sender's thread. Not reusable.
 */
final class FanOut {

    private static final Logger LOG = LoggerFactory.getLogger(FanOut.class);

    private final String path;
    private final List<ChunkPipe> live;
    private final int chunkSize;
    private long bytesRelayed;
    private long bytesDiscarded;

    FanOut(String path, List<ChunkPipe> pipes, int chunkSize) {
        this.path = path;
        this.live = new ArrayList<>(pipes);
        this.chunkSize = chunkSize;
    }

    /**
     * Streams the body until end of stream.
     *
     * @throws IOException          if reading the sender's body fails; the
     *                              live pipes are left untouched
     * @throws InterruptedException if interrupted while waiting for receivers
     */
    void run(InputStream body) throws IOException, InterruptedException {
        byte[] buffer = new byte[chunkSize];
        int n;
        while ((n = body.read(buffer)) != -1) {
            if (n == 0) {
                continue;
            }
            if (live.isEmpty()) {
                bytesDiscarded += n;
                continue;
            }
            // one copy shared by every receiver
            byte[] chunk = Arrays.copyOf(buffer, n);
            List<CompletableFuture<Void>> acks = new ArrayList<>(live.size());
            for (ChunkPipe pipe : live) {
                acks.add(pipe.offer(chunk));
            }
            List<ChunkPipe> failed = new ArrayList<>();
            for (int i = 0; i < acks.size(); i++) {
                try {
                    acks.get(i).get();
                } catch (ExecutionException e) {
                    failed.add(live.get(i));
                    LOG.warn("Receiver dropped from transfer on {} after {} bytes: {}",
                            path, bytesRelayed, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                }
            }
            live.removeAll(failed);
            if (live.isEmpty()) {
                LOG.warn("No receiver left on {}, discarding the rest of the body", path);
            } else {
                bytesRelayed += n;
            }
        }
    }

    /** Pipes of the receivers still attached. */
    List<ChunkPipe> livePipes() {
        return List.copyOf(live);
    }

    /** Bytes delivered to every live receiver. */
    long bytesRelayed() {
        return bytesRelayed;
    }

    /** Bytes read after the last receiver dropped. */
    long bytesDiscarded() {
        return bytesDiscarded;
    }
}
