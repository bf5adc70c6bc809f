package eu.nebulouscloud.deployr.local;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;

import org.slf4j.MDC;

import eu.nebulouscloud.deployr.backend.JobAbortedException;
import eu.nebulouscloud.deployr.backend.MemorySlot;
import eu.nebulouscloud.deployr.model.Topology;
import lombok.extern.slf4j.Slf4j;

/**
 * A set of participants that live in one JVM, one thread each.  The cluster
 * holds the state the participants share: RPC mailboxes, published memory
 * slots, slot locks, the barrier used for collectives and the abort flag.
 *
 * <p>Participant ids are {@code 0..n-1}; participant 0 is the coordinator.
 * The topology each participant reports is fixed when the cluster is
 * created, which lets one machine emulate a heterogeneous set of hosts.
 */
@Slf4j
public class LocalCluster {

    /** MDC key holding the id of the participant a thread runs for. */
    public static final String PARTICIPANT_MDC_KEY = "participant";

    /** How often blocked participants check whether the job was aborted. */
    private static final long ABORT_POLL_MILLIS = 50;

    private final List<Topology> topologies;
    private final List<Long> participantIds;
    private final List<LocalBackend> backends;
    private final Phaser barrier;
    private final Map<Long, Map<Long, MemorySlot>> globalSlots = new ConcurrentHashMap<>();
    private final Map<MemorySlot, ReentrantLock> locks = new ConcurrentHashMap<>();
    private volatile boolean aborted = false;
    private volatile int abortExitCode = 0;

    /**
     * Create a cluster with one participant per topology.
     *
     * @param topologies the hardware each participant will report, in
     *  participant order.
     */
    public LocalCluster(List<Topology> topologies) {
        if (topologies.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one participant");
        }
        this.topologies = List.copyOf(topologies);
        List<Long> ids = new ArrayList<>();
        for (long i = 0; i < topologies.size(); i++) ids.add(i);
        this.participantIds = Collections.unmodifiableList(ids);
        this.barrier = new Phaser(topologies.size());
        List<LocalBackend> backends = new ArrayList<>();
        for (int i = 0; i < topologies.size(); i++) {
            backends.add(new LocalBackend(this, i));
        }
        this.backends = Collections.unmodifiableList(backends);
    }

    public int size() {
        return backends.size();
    }

    public LocalBackend getBackend(int participant) {
        return backends.get(participant);
    }

    public boolean isAborted() {
        return aborted;
    }

    /** The exit code of the first abort, or 0 if the job was not aborted. */
    public int getAbortExitCode() {
        return abortExitCode;
    }

    /**
     * Run one thread per participant and wait for all of them.  A
     * participant that throws aborts the job and reports exit code 1.
     *
     * @param participantMain the code each participant runs; its result is
     *  the participant's exit code.
     * @return the exit codes, in participant order.
     */
    public List<Integer> run(ToIntFunction<LocalBackend> participantMain) {
        ExecutorService executor = Executors.newFixedThreadPool(size());
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (LocalBackend backend : backends) {
                futures.add(executor.submit(() -> {
                    MDC.put(PARTICIPANT_MDC_KEY, Long.toString(backend.getLocalParticipantId()));
                    try {
                        return participantMain.applyAsInt(backend);
                    } catch (RuntimeException | Error e) {
                        log.error("Participant {} terminated with {}", backend.getLocalParticipantId(),
                            e.getClass().getSimpleName(), e);
                        abort(1, backend.getLocalParticipantId());
                        return 1;
                    } finally {
                        MDC.remove(PARTICIPANT_MDC_KEY);
                    }
                }));
            }
            List<Integer> result = new ArrayList<>();
            for (Future<Integer> future : futures) {
                try {
                    result.add(future.get());
                } catch (ExecutionException e) {
                    log.error("Participant thread failed", e.getCause());
                    result.add(1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    abort(1, -1);
                    result.add(1);
                }
            }
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    // ----------------------------------------
    // Shared state, used by LocalBackend

    List<Long> getParticipantIds() {
        return participantIds;
    }

    Topology getTopology(int participant) {
        return topologies.get(participant);
    }

    synchronized void abort(int exitCode, long source) {
        if (aborted) return;
        log.warn("Participant {} aborted the job with exit code {}", source, exitCode);
        abortExitCode = exitCode;
        aborted = true;
        barrier.forceTermination();
    }

    void checkAborted() {
        if (aborted) throw new JobAbortedException(abortExitCode);
    }

    /** Block until {@code queue} has an element, or the job is aborted. */
    <T> T take(BlockingQueue<T> queue) {
        while (true) {
            checkAborted();
            try {
                T element = queue.poll(ABORT_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (element != null) return element;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobAbortedException(1);
            }
        }
    }

    /** Wait until all participants arrive, or the job is aborted. */
    void await() {
        checkAborted();
        int phase = barrier.arrive();
        while (true) {
            try {
                // Returns at once when terminated by abort
                barrier.awaitAdvanceInterruptibly(phase, ABORT_POLL_MILLIS, TimeUnit.MILLISECONDS);
                checkAborted();
                return;
            } catch (TimeoutException e) {
                checkAborted();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobAbortedException(1);
            }
        }
    }

    void publish(long tag, Map<Long, MemorySlot> slots) {
        Map<Long, MemorySlot> tagSlots = globalSlots.computeIfAbsent(tag, t -> new ConcurrentHashMap<>());
        slots.forEach((key, slot) -> {
            MemorySlot previous = tagSlots.putIfAbsent(key, slot);
            if (previous != null) {
                throw new IllegalStateException("Global memory slot key " + key
                    + " published twice under tag " + tag);
            }
        });
    }

    MemorySlot lookup(long tag, long key) {
        MemorySlot slot = globalSlots.getOrDefault(tag, Map.of()).get(key);
        if (slot == null) {
            throw new IllegalStateException("No global memory slot with key " + key + " under tag " + tag);
        }
        return slot;
    }

    ReentrantLock lockFor(MemorySlot slot) {
        return locks.computeIfAbsent(slot, s -> new ReentrantLock());
    }
}
