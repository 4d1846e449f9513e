package com.inboxsearch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.inboxsearch.identity.TokenIdentityResolver;
import com.inboxsearch.identity.UnauthenticatedException;
import com.inboxsearch.index.IndexOptions;
import com.inboxsearch.index.PartitionedVectorIndex;
import com.inboxsearch.ingest.Chunker;
import com.inboxsearch.ingest.EmbeddingGateway;
import com.inboxsearch.ingest.EmbeddingProviders;
import com.inboxsearch.ingest.IngestionPipeline;
import com.inboxsearch.ingest.JsonDirectoryMessageSource;
import com.inboxsearch.model.SyncState;
import com.inboxsearch.runtime.AppConfig;
import com.inboxsearch.runtime.ConfigurationException;
import com.inboxsearch.store.InMemoryMessageStore;
import com.inboxsearch.sync.SyncAlreadyRunningException;
import com.inboxsearch.sync.SyncReport;
import com.inboxsearch.sync.SyncService;
import com.inboxsearch.sync.SyncStateTracker;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "inbox-search",
        mixinStandardHelpOptions = true,
        version = "inbox-search 0.1.0",
        description = "Sync and semantically search your own message history.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--token", description = "Bearer token identifying the acting user", required = true)
    String token;

    @Option(names = "--source", description = "Message source name", defaultValue = "linkedin")
    String source;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Maximum results to return (defaults to search.defaultMatchCount)")
    Integer topK;

    @Option(names = "--threshold", description = "Minimum cosine similarity (defaults to search.defaultSimilarityThreshold)")
    Double threshold;

    enum Mode {
        sync,
        search,
        status
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = loadConfig(configPath).validate();
        } catch (ConfigurationException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return 2;
        }
        log.info("Starting inbox-search in {} mode with config {}", mode, configPath);

        Clock clock = Clock.systemUTC();
        Path dataDir = Path.of(config.getStorage().getDataDir());
        Path storePath = dataDir.resolve("messages.json");
        Path syncStatePath = dataDir.resolve("sync-state.json");

        InMemoryMessageStore store = InMemoryMessageStore.load(storePath, clock);
        SyncStateTracker tracker = SyncStateTracker.load(syncStatePath, clock);
        PartitionedVectorIndex index = new PartitionedVectorIndex(config.getEmbedding().getDimension(), IndexOptions.fromConfig(config.getIndex()));
        OkHttpClient httpClient = new OkHttpClient();

        try (EmbeddingGateway gateway = EmbeddingGateway.fromConfig(EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient), config.getEmbedding())) {
            log.info("Embedding provider {} with dimension {}", gateway.providerVersion(), gateway.dimension());
            Chunker chunker = new Chunker(
                    config.getChunking().getMaxChunkChars(),
                    config.getChunking().getOverlapChars(),
                    config.getChunking().getBoundaryLookback());
            IngestionPipeline pipeline = new IngestionPipeline(store, index, chunker, gateway, clock);
            JsonDirectoryMessageSource fetcher = new JsonDirectoryMessageSource(Path.of(config.getStorage().getSourceDir()), config.getSync().getPageSize());
            try (SyncService syncService = SyncService.fromConfig(fetcher, pipeline, tracker, config)) {
                MessageSearchEngine engine = new MessageSearchEngine(
                        new TokenIdentityResolver(config.getIdentity().getTokens()),
                        store,
                        index,
                        gateway,
                        syncService,
                        config.getSearch());
                engine.rebuildIndex();
                return run(engine, config, store, tracker, storePath, syncStatePath);
            }
        } catch (UnauthenticatedException e) {
            log.error("Authentication failed: {}", e.getMessage());
            return 3;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return 2;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
        }
    }

    private int run(
            MessageSearchEngine engine,
            AppConfig config,
            InMemoryMessageStore store,
            SyncStateTracker tracker,
            Path storePath,
            Path syncStatePath) throws IOException {
        if (mode == Mode.sync) {
            try {
                SyncReport report = engine.runSync(token, source);
                log.info("Sync finished status={} cursor={} fetched={} ingested={} duplicates={} embedded={} pending={} rejected={} error={}",
                        report.state().status().wireName(),
                        report.state().cursor(),
                        report.fetched(),
                        report.ingested(),
                        report.duplicates(),
                        report.chunksEmbedded(),
                        report.chunksPending(),
                        report.chunksRejected(),
                        report.state().lastError() == null ? "none" : report.state().lastError());
                return report.succeeded() ? 0 : 1;
            } catch (SyncAlreadyRunningException e) {
                log.error(e.getMessage());
                return 1;
            } finally {
                store.save(storePath);
                tracker.save(syncStatePath);
            }
        }
        if (mode == Mode.search) {
            if (query == null || query.isBlank()) {
                log.error("--query is required in search mode");
                return 2;
            }
            int k = topK == null ? config.getSearch().getDefaultMatchCount() : topK;
            double minSimilarity = threshold == null ? config.getSearch().getDefaultSimilarityThreshold() : threshold;
            List<SearchResult> results = engine.search(token, query, k, minSimilarity);
            for (int i = 0; i < results.size(); i++) {
                SearchResult result = results.get(i);
                log.info("Result #{} similarity={} message={} chunk={} content={}",
                        i + 1,
                        String.format("%.4f", result.similarity()),
                        result.messageId(),
                        result.chunkId(),
                        result.content().replaceAll("\\s+", " "));
            }
            if (results.isEmpty()) {
                log.info("No results at threshold {}", minSimilarity);
            }
            return 0;
        }
        SyncState state = engine.getSyncStatus(token, source);
        log.info("Sync status source={} status={} cursor={} lastSyncedAt={} lastError={}",
                state.source(),
                state.status().wireName(),
                state.cursor(),
                state.lastSyncedAt(),
                state.lastError() == null ? "none" : state.lastError());
        return 0;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
