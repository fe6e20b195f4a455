package org.dxworks.apislice;

import org.dxworks.apislice.pipeline.ApiSlicePipeline;
import org.dxworks.apislice.swagger.SkeletonOperationGenerator;
import org.dxworks.apislice.swagger.SwaggerDocument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

public class App {

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar apislice.jar <input-folder> <output-file> [host]");
            System.err.println("  <input-folder>: Path to a JavaScript/TypeScript source tree");
            System.err.println("  <output-file>:  Path to the OpenAPI JSON file to write");
            System.err.println("  [host]:         Server URL advertised in the document");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }
        Path output = Paths.get(args[1]);

        ApiSliceConfig config = ApiSliceConfig.load();
        if (args.length > 2 && !args[2].isBlank()) {
            config = ApiSliceConfig.with(config.getIgnoredDirs(), config.getMaxWorkers(), config.getMaxFileLines(),
                    args[2].trim(), config.getTitle(), config.getVersion());
        }

        System.out.println("Starting endpoint discovery...");
        System.out.println("Input: " + input.toAbsolutePath());
        Instant startTime = Instant.now();

        ApiSlicePipeline pipeline = new ApiSlicePipeline(config, new SkeletonOperationGenerator(),
                System.out, System.err);
        SwaggerDocument document = pipeline.run(input);
        document.write(output);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Generation complete!");
        System.out.println("Paths documented: " + document.paths().size());
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).getSeconds() + " seconds");
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }
}
