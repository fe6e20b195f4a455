package org.dxworks.apislice.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.apislice.ApiSliceConfig;
import org.dxworks.apislice.analyzer.ParseException;
import org.dxworks.apislice.analyzer.SymbolExtractor;
import org.dxworks.apislice.analyzer.TreeSitterHelper;
import org.dxworks.apislice.cache.InventoryCache;
import org.dxworks.apislice.cache.InventorySnapshot;
import org.dxworks.apislice.endpoint.EndpointDetector;
import org.dxworks.apislice.model.EndpointRecord;
import org.dxworks.apislice.model.FileInventory;
import org.dxworks.apislice.slice.ContextBundle;
import org.dxworks.apislice.slice.DependencySlicer;
import org.dxworks.apislice.swagger.OperationGenerator;
import org.dxworks.apislice.swagger.RepositoryMetadata;
import org.dxworks.apislice.swagger.SwaggerDocument;
import org.dxworks.apislice.swagger.SwaggerMerger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the whole flow over one source tree: inventory every file into the cache, detect the
 * endpoints, slice and document each endpoint on a bounded worker pool, and merge the
 * fragments into one document. Only the coordinating thread touches the document.
 */
public class ApiSlicePipeline {

    private final ApiSliceConfig config;
    private final OperationGenerator generator;
    private final SymbolExtractor extractor;
    private final EndpointDetector detector;
    private final DependencySlicer slicer;
    private final SwaggerMerger merger;
    private final PrintStream out;
    private final PrintStream err;

    public ApiSlicePipeline(ApiSliceConfig config, OperationGenerator generator, PrintStream out, PrintStream err) {
        this.config = config;
        this.generator = generator;
        this.extractor = new SymbolExtractor();
        this.detector = new EndpointDetector();
        this.slicer = new DependencySlicer();
        this.merger = new SwaggerMerger();
        this.out = out;
        this.err = err;
    }

    public SwaggerDocument run(Path input) throws IOException {
        Path root = Files.isDirectory(input) ? input.toAbsolutePath().normalize()
                : input.toAbsolutePath().normalize().getParent();
        RepositoryMetadata repository = readRepository(root);
        String title = config.getTitle() != null ? config.getTitle()
                : repository.getName() != null ? repository.getName() : root.getFileName().toString();
        SwaggerDocument document = SwaggerDocument.create(title, config.getVersion(), config.getHost(),
                repository, Instant.now());

        InventoryCache cache = new InventoryCache(root);
        try {
            List<Path> files = new SourceWalker(config.getIgnoredDirs(), config.getMaxFileLines(), err)
                    .walk(input);
            out.println("Found " + files.size() + " source files");

            buildInventories(files, root, cache);
            InventorySnapshot snapshot = cache.snapshot();

            List<EndpointRecord> endpoints = detectEndpoints(files);
            out.println("Found " + endpoints.size() + " endpoints");
            if (endpoints.isEmpty()) {
                return document;
            }

            documentEndpoints(endpoints, snapshot, document);
            merger.postProcess(document);
            return document;
        } finally {
            try {
                cache.delete();
            } catch (IOException e) {
                err.println("Could not delete " + cache.getDirectory() + ": " + e.getMessage());
            }
        }
    }

    private RepositoryMetadata readRepository(Path root) {
        try {
            return RepositoryMetadata.read(root);
        } catch (IOException e) {
            err.println("Could not read git metadata for " + root + ": " + e.getMessage());
            return RepositoryMetadata.none();
        }
    }

    // Single-threaded: the cache is complete before any worker reads it.
    private void buildInventories(List<Path> files, Path root, InventoryCache cache) {
        int current = 0;
        for (Path file : files) {
            current++;
            out.println("[" + current + "/" + files.size() + "] Indexing " + root.relativize(file));
            try {
                FileInventory inventory = extractor.extract(file, root);
                cache.write(inventory);
            } catch (IOException | ParseException e) {
                err.println("  Error indexing " + file.getFileName() + ": " + e.getMessage());
            }
        }
    }

    List<EndpointRecord> detectEndpoints(List<Path> files) {
        List<EndpointRecord> endpoints = new ArrayList<>();
        for (Path file : files) {
            String source;
            try {
                source = TreeSitterHelper.readSource(file);
            } catch (IOException e) {
                err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                continue;
            }
            if (!EndpointDetector.looksLikeApiFile(source)) {
                continue;
            }
            for (EndpointRecord endpoint : detector.detect(file, source)) {
                endpoint.route = SwaggerMerger.normalize(endpoint.route);
                endpoints.add(endpoint);
            }
        }
        return endpoints;
    }

    private void documentEndpoints(List<EndpointRecord> endpoints, InventorySnapshot snapshot,
                                   SwaggerDocument document) {
        int workers = Math.min(config.getMaxWorkers(), endpoints.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        Instant start = Instant.now();
        try {
            ExecutorCompletionService<ObjectNode> completion = new ExecutorCompletionService<>(executor);
            for (EndpointRecord endpoint : endpoints) {
                completion.submit(() -> {
                    ContextBundle bundle = slicer.slice(endpoint, snapshot);
                    return generator.generate(bundle.getHandlerLines(), bundle.contextBlocks(), endpoint.route);
                });
            }

            int completed = 0;
            for (int i = 0; i < endpoints.size(); i++) {
                try {
                    merger.merge(document, completion.take().get());
                    completed++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    err.println("  Error documenting endpoint: " + cause.getMessage());
                }
            }
            out.println("Documented " + completed + " of " + endpoints.size() + " endpoints in "
                    + Duration.between(start, Instant.now()).getSeconds() + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while documenting endpoints");
        } finally {
            executor.shutdownNow();
        }
    }
}
