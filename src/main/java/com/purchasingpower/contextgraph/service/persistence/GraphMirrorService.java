package com.purchasingpower.contextgraph.service.persistence;

import com.purchasingpower.contextgraph.configuration.PersistenceProperties;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.knowledge.GraphMutationListener;
import com.purchasingpower.contextgraph.knowledge.PersistentGraphStore;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replays graph mutations onto the persistent store.
 *
 * <p>Every mutation is submitted to the mirror executor after the graph has
 * released its lock, so graph callers never wait on the store. Each write is
 * abandoned after {@code call-timeout}; failures are logged and counted, never
 * rethrown. The mirror executor is single-threaded, which keeps writes in
 * mutation order.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "context-graph.persistence", name = "enabled", havingValue = "true")
public class GraphMirrorService implements GraphMutationListener {

    private final ContextGraph graph;
    private final PersistentGraphStore store;
    private final Executor executor;
    private final PersistenceProperties properties;

    private final AtomicLong mirrored = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public GraphMirrorService(ContextGraph graph, PersistentGraphStore store,
                              @Qualifier("mirrorExecutor") Executor executor,
                              PersistenceProperties properties) {
        this.graph = graph;
        this.store = store;
        this.executor = executor;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        graph.addListener(this);
        log.info("Mirroring context graph to persistent store (timeout {})", properties.getCallTimeout());
    }

    @PreDestroy
    public void unregister() {
        graph.removeListener(this);
    }

    @Override
    public void onNodeUpserted(ContextNode node) {
        submit("upsertNode " + node.getId(), () -> store.upsertNode(node));
    }

    @Override
    public void onNodeRemoved(String nodeId) {
        submit("deleteNode " + nodeId, () -> store.deleteNode(nodeId));
    }

    @Override
    public void onEdgeAdded(ContextEdge edge) {
        submit("upsertEdge " + edge.getFrom() + "->" + edge.getTo(), () -> store.upsertEdge(edge));
    }

    @Override
    public void onEdgeRemoved(ContextEdge edge) {
        submit("deleteEdge " + edge.getFrom() + "->" + edge.getTo(), () -> store.deleteEdge(edge));
    }

    /**
     * Push every node and edge currently in the graph.
     *
     * @return number of writes submitted
     */
    public int mirrorAll() {
        int submitted = 0;
        for (ContextNode node : graph.nodes()) {
            onNodeUpserted(node);
            submitted++;
        }
        for (ContextEdge edge : graph.edges()) {
            onEdgeAdded(edge);
            submitted++;
        }
        log.info("Submitted full mirror of {} writes", submitted);
        return submitted;
    }

    public long getMirroredCount() {
        return mirrored.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    private CompletableFuture<Void> submit(String operation, Runnable write) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(write, executor);
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            log.warn("Mirror queue full, dropping {}", operation);
            return CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(properties.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        mirrored.incrementAndGet();
                    } else {
                        failed.incrementAndGet();
                        log.warn("Mirror write failed ({}): {}", operation, error.getMessage());
                    }
                });
    }
}
