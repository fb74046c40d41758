package io.pipingrelay.core.engine;

import io.pipingrelay.core.error.MalformedMultipartException;
import io.pipingrelay.core.error.TransferAbortedException;
import io.pipingrelay.core.model.HttpHeaders;
import io.pipingrelay.core.model.ReceiverCount;
import io.pipingrelay.core.model.TransferOutcome;
import io.pipingrelay.core.registry.PathRegistry;
import io.pipingrelay.core.registry.ReceiverHandle;
import io.pipingrelay.core.registry.Registration;
import io.pipingrelay.core.registry.Registration.Commit;
import io.pipingrelay.core.registry.Registration.Reject;
import io.pipingrelay.core.registry.Registration.Wait;
import io.pipingrelay.core.registry.SenderHandle;
import io.pipingrelay.core.spi.FirstPart;
import io.pipingrelay.core.spi.MultipartReader;
import io.pipingrelay.core.spi.ResponseSender;
import io.pipingrelay.core.transfer.BodyStream;
import io.pipingrelay.core.transfer.ChunkPipe;
import io.pipingrelay.core.transfer.Transfer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs senders with receivers on a path and streams the body between them.
 *
 * <p>
 * Both entry points run on the request's own worker thread and block until
 * the exchange is over. A sender writes its progress lines to its own response
 * and feeds the body through one {@link ChunkPipe} per receiver; each receiver
 * thread writes its own response from its pipe. The two sides meet through
 * the {@link PathRegistry} and one-shot handoffs; no response is ever written
 * by another request's thread. A side that is still waiting for its peers
 * checks its client's connection every {@code livenessInterval} and withdraws
 * from the path once the client is gone.
 *
 * <p>
 * Thread-safe. One engine serves the whole process.
 */
public final class RendezvousEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RendezvousEngine.class);

    /** Default number of bytes read from a sender per chunk. */
    public static final int DEFAULT_CHUNK_SIZE = 16 * 1024;

    /** Default pause between client connection checks while waiting. */
    public static final Duration DEFAULT_LIVENESS_INTERVAL = Duration.ofSeconds(1);

    static final HttpHeaders PLAIN_TEXT = HttpHeaders.builder()
            .set("Content-Type", "text/plain; charset=utf-8")
            .set("Access-Control-Allow-Origin", "*")
            .build();

    private final PathRegistry registry;
    private final int chunkSize;
    private final MultipartReader multipart;
    private final Duration livenessInterval;

    public RendezvousEngine(PathRegistry registry) {
        this(registry, DEFAULT_CHUNK_SIZE, MultipartReader.NONE, DEFAULT_LIVENESS_INTERVAL);
    }

    /**
     * @param registry         path registry shared by every request
     * @param chunkSize        bytes read from a sender per relayed chunk
     * @param multipart        unwraps form uploads; {@link MultipartReader#NONE}
     *                         relays them as sent
     * @param livenessInterval pause between client connection checks while a
     *                         sender or receiver waits for its peers
     */
    public RendezvousEngine(PathRegistry registry, int chunkSize, MultipartReader multipart,
            Duration livenessInterval) {
        if (registry == null) {
            throw new NullPointerException("registry must not be null");
        }
        if (multipart == null) {
            throw new NullPointerException("multipart must not be null");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (livenessInterval == null || livenessInterval.isZero() || livenessInterval.isNegative()) {
            throw new IllegalArgumentException("livenessInterval must be positive: " + livenessInterval);
        }
        this.registry = registry;
        this.chunkSize = chunkSize;
        this.multipart = multipart;
        this.livenessInterval = livenessInterval;
    }

    public PathRegistry registry() {
        return registry;
    }

    // ── Sender ──

    /**
     * Handles a {@code POST}/{@code PUT} on a rendezvous path.
     *
     * <p>
     * Blocks until the body was relayed, the sender aborted or every receiver
     * dropped. Never throws for transport failures; they are reflected in the
     * returned outcome and in the sender's last status line.
     */
    public TransferOutcome handleSender(SenderRequest request, ResponseSender response) {
        String path = request.path();
        OptionalInt parsed = ReceiverCount.parse(request.receiverCount());
        if (parsed.isEmpty()) {
            reject(response, RelayMessages.INVALID_N);
            return TransferOutcome.REJECTED;
        }
        SenderHandle sender = SenderHandle.create(parsed.getAsInt());
        Registration registration = registry.registerSender(path, sender);
        if (registration instanceof Reject rejected) {
            LOG.debug("Rejected sender on {}: {}", path, rejected.reason());
            reject(response, rejected.reason().senderMessage());
            return TransferOutcome.REJECTED;
        }

        int queued = registration instanceof Commit commit
                ? commit.receivers().size()
                : ((Wait) registration).queuedReceivers();
        try {
            response.sendStatus(200, "OK");
            response.sendHeaders(PLAIN_TEXT);
            writeLine(response, RelayMessages.waitingFor(sender.receiverCount()));
            if (queued > 0) {
                writeLine(response, RelayMessages.alreadyConnected(queued));
            }
        } catch (IOException e) {
            LOG.warn("Sender on {} disconnected before pairing: {}", path, e.getMessage());
            abandon(path, sender, registration, e);
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        }

        List<ReceiverHandle> receivers;
        if (registration instanceof Commit commit) {
            receivers = commit.receivers();
        } else {
            try {
                while (!sender.pairing().await(livenessInterval)) {
                    if (!response.isClientConnected()) {
                        LOG.info("Sender on {} disconnected while waiting for receivers", path);
                        IOException gone = new IOException("Sender disconnected while waiting for receivers");
                        abandon(path, sender, registration, gone);
                        response.abort(gone);
                        return TransferOutcome.SENDER_ABORTED;
                    }
                }
                receivers = sender.pairing().receive().orElseThrow();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(path, sender, registration, e);
                response.abort(e);
                return TransferOutcome.SENDER_ABORTED;
            } catch (TransferAbortedException e) {
                // only this thread aborts its own pairing handoff
                throw new IllegalStateException("Sender pairing aborted unexpectedly", e);
            }
        }

        try {
            return relay(request, sender, receivers, response);
        } finally {
            registry.release(path);
        }
    }

    private TransferOutcome relay(SenderRequest request, SenderHandle sender, List<ReceiverHandle> receivers,
            ResponseSender response) {
        String path = request.path();
        int n = sender.receiverCount();
        LOG.info("Paired sender with {} receiver(s) on {}", n, path);
        try {
            writeLine(response, RelayMessages.connected(n));
        } catch (IOException e) {
            LOG.warn("Sender on {} disconnected at pairing: {}", path, e.getMessage());
            abortAll(receivers, new TransferAbortedException("Sender disconnected", e));
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        }

        InputStream body = request.body();
        HttpHeaders source = request.headers();
        String contentType = source.first(ForwardedHeaders.CONTENT_TYPE);
        FirstPart part = null;
        if (multipart.accepts(contentType)) {
            try {
                part = multipart.open(body, contentType);
                body = part;
                source = part.headers();
            } catch (IOException e) {
                LOG.warn("Sender on {} aborted: unreadable multipart body: {}", path, e.getMessage());
                abortAll(receivers, new TransferAbortedException("Sender body unreadable", e));
                finishSender(response, 0, n, false);
                return TransferOutcome.SENDER_ABORTED;
            }
        }

        HttpHeaders forwarded = ForwardedHeaders.from(source);
        List<ChunkPipe> streaming = new ArrayList<>();
        List<CompletableFuture<Void>> headCompletions = new ArrayList<>();
        int refused = 0;
        int refusedGets = 0;
        for (ReceiverHandle receiver : receivers) {
            ChunkPipe pipe = receiver.headOnly() ? ChunkPipe.closedPipe() : new ChunkPipe();
            if (receiver.transfer().offer(new Transfer(200, forwarded, pipe))) {
                if (receiver.headOnly()) {
                    headCompletions.add(pipe.completion());
                } else {
                    streaming.add(pipe);
                }
            } else {
                refused++;
                if (!receiver.headOnly()) {
                    refusedGets++;
                }
            }
        }
        List<CompletableFuture<Void>> getCompletions = new ArrayList<>();
        for (ChunkPipe pipe : streaming) {
            getCompletions.add(pipe.completion());
        }
        int gets = (int) receivers.stream().filter(receiver -> !receiver.headOnly()).count();

        FanOut fanOut = new FanOut(path, streaming, chunkSize);
        try {
            fanOut.run(body);
        } catch (IOException e) {
            LOG.warn("Sender on {} aborted after {} bytes: {}", path, fanOut.bytesRelayed(), e.getMessage());
            failAll(fanOut.livePipes(), new TransferAbortedException("Sender aborted", e));
            if (e instanceof MalformedMultipartException) {
                finishSender(response, 0, n, false);
            } else {
                response.abort(e);
            }
            return TransferOutcome.SENDER_ABORTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failAll(fanOut.livePipes(), new TransferAbortedException("Sender interrupted", e));
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        }

        for (ChunkPipe pipe : fanOut.livePipes()) {
            pipe.close();
        }
        if (part != null) {
            drain(path, part);
        }

        int failedGets;
        int failedHeads;
        try {
            failedGets = awaitCompletions(getCompletions);
            failedHeads = awaitCompletions(headCompletions);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        }
        int dropped = refused + failedGets + failedHeads;
        // a body counts as delivered only if some GET receiver got all of it
        boolean delivered = gets > 0 ? refusedGets + failedGets < gets : dropped < n;
        TransferOutcome outcome = dropped == 0
                ? TransferOutcome.COMPLETED
                : delivered ? TransferOutcome.PARTIAL : TransferOutcome.RECEIVERS_ABORTED;
        LOG.info("Transfer on {} finished: {} bytes relayed, {} discarded, {} of {} receiver(s) served, outcome {}",
                path, fanOut.bytesRelayed(), fanOut.bytesDiscarded(), n - dropped, n, outcome);
        finishSender(response, dropped, n, delivered);
        return outcome;
    }

    /** Counts receivers that did not finish their response cleanly. */
    private static int awaitCompletions(List<CompletableFuture<Void>> completions) throws InterruptedException {
        int failed = 0;
        for (CompletableFuture<Void> completion : completions) {
            try {
                completion.get();
            } catch (ExecutionException e) {
                failed++;
            }
        }
        return failed;
    }

    private static void finishSender(ResponseSender response, int dropped, int receivers, boolean delivered) {
        try {
            if (dropped > 0) {
                writeLine(response, RelayMessages.partialDelivery(dropped, receivers));
            }
            writeLine(response, delivered ? RelayMessages.SENT_SUCCESSFULLY : RelayMessages.SENDING_ABORTED);
            response.end();
        } catch (IOException e) {
            LOG.debug("Could not write final status to sender: {}", e.getMessage());
            response.abort(e);
        }
    }

    private static void drain(String path, FirstPart part) {
        try {
            long discarded = part.drainRemainder();
            if (discarded > 0) {
                LOG.debug("Discarded {} bytes after the first multipart part on {}", discarded, path);
            }
        } catch (IOException e) {
            LOG.debug("Sender on {} closed while draining remaining parts: {}", path, e.getMessage());
        }
    }

    /**
     * Undoes a sender registration that never reached streaming. Whoever loses
     * the race with a committing receiver cleans up the receivers.
     */
    private void abandon(String path, SenderHandle sender, Registration registration, Throwable cause) {
        TransferAbortedException abort = new TransferAbortedException("Sender left before the transfer started", cause);
        if (registration instanceof Commit commit) {
            abortAll(commit.receivers(), abort);
            registry.release(path);
            return;
        }
        if (registry.withdraw(path, sender)) {
            return;
        }
        if (sender.pairing().abort(abort)) {
            // the committing receiver sees the refused offer and releases the path
            return;
        }
        sender.pairing().delivered().ifPresent(receivers -> abortAll(receivers, abort));
        registry.release(path);
    }

    private static void abortAll(List<ReceiverHandle> receivers, TransferAbortedException cause) {
        for (ReceiverHandle receiver : receivers) {
            if (!receiver.transfer().abort(cause)) {
                receiver.transfer().delivered().ifPresent(transfer -> transfer.body().cancel(cause));
            }
        }
    }

    private static void failAll(List<ChunkPipe> pipes, Throwable cause) {
        for (ChunkPipe pipe : pipes) {
            pipe.fail(cause);
        }
    }

    // ── Receiver ──

    /**
     * Handles a {@code GET}/{@code HEAD} on a rendezvous path.
     *
     * <p>
     * Blocks until the sender's body was relayed to this receiver or the
     * exchange aborted. Never throws for transport failures.
     */
    public TransferOutcome handleReceiver(ReceiverRequest request, ResponseSender response) {
        String path = request.path();
        OptionalInt parsed = ReceiverCount.parse(request.receiverCount());
        if (parsed.isEmpty()) {
            reject(response, RelayMessages.INVALID_N);
            return TransferOutcome.REJECTED;
        }
        ReceiverHandle receiver = request.receiverCount() == null
                ? ReceiverHandle.withoutCount(request.headOnly())
                : ReceiverHandle.create(parsed.getAsInt(), request.headOnly());
        Registration registration = registry.registerReceiver(path, receiver);
        if (registration instanceof Reject rejected) {
            LOG.debug("Rejected receiver on {}: {}", path, rejected.reason());
            reject(response, rejected.reason().receiverMessage());
            return TransferOutcome.REJECTED;
        }
        if (registration instanceof Commit commit && !commit.sender().pairing().offer(commit.receivers())) {
            LOG.warn("Sender on {} left while its receivers were connecting", path);
            abortAll(commit.receivers(), new TransferAbortedException("Sender left before the transfer started"));
            registry.release(path);
        }

        Transfer transfer;
        try {
            while (!receiver.transfer().await(livenessInterval)) {
                if (!response.isClientConnected()) {
                    LOG.info("Receiver on {} disconnected while waiting for the sender", path);
                    IOException gone = new IOException("Receiver disconnected while waiting for the sender");
                    giveUp(path, receiver, gone);
                    response.abort(gone);
                    return TransferOutcome.RECEIVER_ABORTED;
                }
            }
            transfer = receiver.transfer().receive().orElseThrow();
        } catch (TransferAbortedException e) {
            LOG.debug("Receiver on {} released without a transfer: {}", path, e.getMessage());
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            giveUp(path, receiver, e);
            response.abort(e);
            return TransferOutcome.RECEIVER_ABORTED;
        }
        return receive(path, transfer, response);
    }

    private static TransferOutcome receive(String path, Transfer transfer, ResponseSender response) {
        BodyStream body = transfer.body();
        long written = 0;
        try {
            response.sendStatus(transfer.status(), "OK");
            response.sendHeaders(transfer.headers());
            byte[] chunk;
            while ((chunk = body.read()) != null) {
                response.writeChunk(chunk);
                written += chunk.length;
                body.acknowledge();
            }
            response.end();
            body.finish();
            return TransferOutcome.COMPLETED;
        } catch (TransferAbortedException e) {
            LOG.debug("Receiver on {} cut off after {} bytes: {}", path, written, e.getMessage());
            response.abort(e);
            return TransferOutcome.SENDER_ABORTED;
        } catch (IOException e) {
            LOG.warn("Receiver on {} disconnected after {} bytes: {}", path, written, e.getMessage());
            body.cancel(e);
            response.abort(e);
            return TransferOutcome.RECEIVER_ABORTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            body.cancel(e);
            response.abort(e);
            return TransferOutcome.RECEIVER_ABORTED;
        }
    }

    /** Undoes a receiver registration whose thread stopped waiting. */
    private void giveUp(String path, ReceiverHandle receiver, Throwable cause) {
        if (registry.withdraw(path, receiver)) {
            return;
        }
        // already committed: refuse the transfer, or drop out of it if it was delivered
        if (!receiver.transfer().abort(cause)) {
            Optional<Transfer> delivered = receiver.transfer().delivered();
            delivered.ifPresent(transfer -> transfer.body().cancel(cause));
        }
    }

    // ── Shared ──

    private static void reject(ResponseSender response, String message) {
        try {
            response.sendStatus(400, "Bad Request");
            response.sendHeaders(PLAIN_TEXT);
            writeLine(response, message);
            response.end();
        } catch (IOException e) {
            LOG.debug("Could not deliver rejection: {}", e.getMessage());
            response.abort(e);
        }
    }

    private static void writeLine(ResponseSender response, String line) throws IOException {
        response.writeChunk(line.getBytes(StandardCharsets.UTF_8));
    }
}
