package org.dxworks.ommlatex;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.ommlatex.converter.MathConverter;
import org.dxworks.ommlatex.converter.OmmlLatexConverter;
import org.dxworks.ommlatex.model.ExpressionConversion;
import org.dxworks.ommlatex.model.FileConversion;
import org.dxworks.ommlatex.model.MathNode;
import org.dxworks.ommlatex.reader.OmmlParseException;
import org.dxworks.ommlatex.reader.OmmlReader;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final OmmlReader READER = new OmmlReader();
    private static final MathConverter CONVERTER = new OmmlLatexConverter();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar ommlatex.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a directory of OMML fragments or a single fragment file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported files: .xml, .omml");
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

        System.out.println("Starting equation conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        OmmlatexConfig config = OmmlatexConfig.load();
        List<Path> files = collectFragmentFiles(input, config.getMaxFileBytes());
        System.out.println("Found " + files.size() + " fragment files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger expressionCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    FileConversion conversion = convertFile(file, config);

                    // one writer shared by all workers
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(conversion));
                        writer.newLine();
                        writer.flush();
                    }

                    expressionCount.addAndGet(conversion.expressions.size());
                    successCount.incrementAndGet();
                } catch (IOException | OmmlParseException | RuntimeException e) {
                    Map<String, String> error = new HashMap<>();
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
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("expressions", expressionCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files, "
                + expressionCount.get() + " expressions");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectFragmentFiles(Path input, long maxFileBytes) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(FragmentFileDetector::isFragmentFile)
                      .filter(p -> withinMaxBytes(p, maxFileBytes))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (FragmentFileDetector.isFragmentFile(input) && withinMaxBytes(input, maxFileBytes)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxBytes(Path path, long maxFileBytes) {
        try {
            return Files.size(path) <= maxFileBytes;
        } catch (IOException e) {
            // unreadable files surface as error records when converted
            return true;
        }
    }

    public static FileConversion convertFile(Path filePath, OmmlatexConfig config) throws IOException, OmmlParseException {
        FileConversion conversion = new FileConversion();
        conversion.filePath = filePath.toString();

        List<MathNode> expressions;
        try (InputStream in = Files.newInputStream(filePath)) {
            expressions = READER.readExpressions(in);
        }
        for (int i = 0; i < expressions.size(); i++) {
            conversion.expressions.add(convertExpression(CONVERTER, i + 1, expressions.get(i), config));
        }
        return conversion;
    }

    static ExpressionConversion convertExpression(MathConverter converter, int index, MathNode expression,
                                                  OmmlatexConfig config) {
        ExpressionConversion result = new ExpressionConversion();
        result.index = index;
        result.text = expression.plainText();

        try {
            result.latex = converter.convert(expression);
        } catch (RuntimeException e) {
            if (!config.isPlainTextFallback()) {
                throw e;
            }
            synchronized (System.err) {
                System.err.println("  Expression " + index + " falls back to plain text: " + e);
            }
            result.latex = result.text;
            result.fallback = true;
        }
        return result;
    }
}
