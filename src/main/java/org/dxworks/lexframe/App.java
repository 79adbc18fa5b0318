package org.dxworks.lexframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.lexframe.model.ParseResult;
import org.dxworks.lexframe.parser.EuLexParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {

    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar lexframe.jar <input> <output-file>");
            System.err.println("  <input>:       EUR-Lex HTML file or a directory of them");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting document parsing...");
        System.out.println("Input: " + input.toAbsolutePath());

        EuLexParser parser = new EuLexParser(LexframeConfig.load());
        List<Path> files = collectHtmlFiles(input);
        System.out.println("Found " + files.size() + " HTML documents");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Parsing " + file.getFileName());
                }

                try {
                    ParseResult result = parser.parse(file);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (IOException | RuntimeException e) {
                    LOGGER.error("Failed to parse {}", file, e);
                    writeError(writer, file, e);
                    errorCount.incrementAndGet();
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_parsed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Parsing complete!");
        System.out.println("Successfully parsed: " + successCount.get() + " documents");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void writeError(BufferedWriter writer, Path file, Exception e) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error", e.getMessage());
        try {
            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(error));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException ioException) {
            LOGGER.error("Failed to write error record for {}", file, ioException);
        }
    }

    static List<Path> collectHtmlFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isHtml)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && isHtml(input)) {
            files.add(input);
        }
        return files;
    }

    static boolean isHtml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm");
    }
}
