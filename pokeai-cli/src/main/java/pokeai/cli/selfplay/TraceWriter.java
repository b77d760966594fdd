package pokeai.cli.selfplay;

import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Records every decision of one battle plus its outcome as JSONL (one JSON object per line).
 * One writer and one file per battle; the file is created on the first record.
 */
public class TraceWriter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TraceWriter.class);

    private final Path file;
    private BufferedWriter fileWriter;
    private boolean closed;

    public TraceWriter(Path outputDir, String battleId) {
        this.file = outputDir.resolve("battle_" + battleId + ".jsonl");
    }

    public Path getFile() {
        return file;
    }

    private void ensureOpen() throws IOException {
        if (fileWriter == null) {
            Files.createDirectories(file.getParent());
            fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        }
    }

    public synchronized void recordDecision(int turn, String side, String policy, float[] state,
                                            List<String> options, float[][] optionFeatures,
                                            int chosenIndex, boolean fallback) {
        if (closed) return;
        try {
            StringWriter sw = new StringWriter(1024);
            JsonWriter jw = new JsonWriter(sw);
            jw.beginObject();
            jw.name("type").value("decision");
            jw.name("turn").value(turn);
            jw.name("side").value(side);
            jw.name("policy").value(policy);

            jw.name("state");
            jw.beginArray();
            for (float v : state) {
                jw.value(v);
            }
            jw.endArray();

            jw.name("options");
            jw.beginArray();
            for (String option : options) {
                jw.value(option);
            }
            jw.endArray();

            jw.name("optionFeatures");
            jw.beginArray();
            for (float[] option : optionFeatures) {
                jw.beginArray();
                for (float v : option) {
                    jw.value(v);
                }
                jw.endArray();
            }
            jw.endArray();

            jw.name("chosenIndex").value(chosenIndex);
            jw.name("fallback").value(fallback);
            jw.endObject();
            jw.close();
            writeLine(sw.toString());
        } catch (IOException e) {
            log.warn("Failed to record decision in {}: {}", file, e.getMessage());
        }
    }

    /**
     * @param result 1 for a p1 win, 0 for a p2 win, 0.5 for a tie or an unfinished battle
     */
    public synchronized void recordOutcome(double result, int turns, String reason) {
        if (closed) return;
        try {
            StringWriter sw = new StringWriter(128);
            JsonWriter jw = new JsonWriter(sw);
            jw.beginObject();
            jw.name("type").value("outcome");
            jw.name("result").value(result);
            jw.name("turns").value(turns);
            jw.name("reason").value(reason);
            jw.endObject();
            jw.close();
            writeLine(sw.toString());
        } catch (IOException e) {
            log.warn("Failed to record outcome in {}: {}", file, e.getMessage());
        }
    }

    private void writeLine(String line) throws IOException {
        ensureOpen();
        fileWriter.write(line);
        fileWriter.newLine();
        fileWriter.flush();
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (fileWriter == null) return;
        try {
            fileWriter.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", file, e.getMessage());
        }
    }
}
