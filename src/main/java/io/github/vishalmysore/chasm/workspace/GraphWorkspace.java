package io.github.vishalmysore.chasm.workspace;

import io.github.vishalmysore.chasm.config.ChasmSettings;
import io.github.vishalmysore.chasm.graph.ChasmGraph;
import io.github.vishalmysore.chasm.persistence.GraphSnapshotCodec;
import io.github.vishalmysore.chasm.vector.LinkingResult;
import io.github.vishalmysore.chasm.vector.SemanticLinker;

import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Owns one graph for the lifetime of a process: loads it from the snapshot on
 * open, saves it after every confirmed mutation batch and again on close.
 *
 * The graph is handed to collaborators through this workspace rather than held
 * in a global, so separate workspaces (and tests) never share state.
 */
public class GraphWorkspace implements AutoCloseable {
    private static final Logger log = Logger.getLogger(GraphWorkspace.class.getName());

    private final ChasmGraph graph;
    private final GraphSnapshotCodec codec;
    private final SemanticLinker linker;
    private final Path snapshotPath;

    public GraphWorkspace(ChasmGraph graph, GraphSnapshotCodec codec, SemanticLinker linker, Path snapshotPath) {
        this.graph = graph;
        this.codec = codec;
        this.linker = linker;
        this.snapshotPath = snapshotPath;
    }

    public static GraphWorkspace open(ChasmSettings settings, GraphSnapshotCodec codec, SemanticLinker linker) {
        return open(settings.getExportPath(), codec, linker);
    }

    public static GraphWorkspace open(Path snapshotPath, GraphSnapshotCodec codec, SemanticLinker linker) {
        ChasmGraph graph = codec.load(snapshotPath);
        return new GraphWorkspace(graph, codec, linker, snapshotPath);
    }

    public ChasmGraph getGraph() {
        return graph;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    /**
     * Applies a batch of mutations under the graph's write lock and saves a
     * checkpoint once it completes. A batch that throws is not saved, but the
     * mutations it already made stay in memory.
     */
    public void commit(Consumer<ChasmGraph> batch) {
        graph.inWriteBatch(batch);
        checkpoint();
    }

    /**
     * Applies the insights of a finished interview and links them right away.
     * Every unembedded insight in the graph is embedded first, not only the new
     * ones, so each call costs time proportional to the whole insight population.
     * The interview batch is checkpointed before linking starts, so a failing
     * embedding provider cannot lose it.
     */
    public LinkingResult ingestInterview(Consumer<ChasmGraph> batch) {
        commit(batch);
        int embedded = linker.embedMissing(graph);
        LinkingResult result = linker.runIncrementalPass(graph, linker.getDefaultThreshold());
        log.info("Interview ingested: " + embedded + " embedding(s), " + result.getEdgesWritten()
                + " semantic match(es)");
        checkpoint();
        return result;
    }

    /**
     * End-of-pipeline step: embed everything still missing, relink the whole
     * insight population and save.
     */
    public LinkingResult runBulkLinking() {
        int embedded = linker.embedMissing(graph);
        LinkingResult result = linker.runFullPass(graph, linker.getDefaultThreshold());
        log.info("Bulk linking done: " + embedded + " embedding(s), " + result.getEdgesWritten()
                + " semantic match(es)");
        checkpoint();
        return result;
    }

    public void checkpoint() {
        codec.save(graph, snapshotPath);
    }

    /**
     * Node-link JSON of the current graph, without touching the snapshot file.
     */
    public String dump() {
        return codec.toJson(graph);
    }

    @Override
    public void close() {
        checkpoint();
        log.info("Workspace closed, graph saved to " + snapshotPath);
    }
}
