package com.syncline.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.core.dispatch.DispatchResult;
import com.syncline.core.dispatch.EventDispatcher;
import com.syncline.core.events.EventEnvelope;
import com.syncline.core.model.Session;
import com.syncline.core.store.Projection;
import com.syncline.core.store.StreamSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: syncline replay &lt;file&gt; [--stream &lt;id&gt;]
 * <p>
 * Feeds a JSON-lines recording of envelopes through the pipeline and prints the resulting
 * projection. Blank lines are skipped; unparseable lines are reported and counted as invalid.
 * Streams still waiting on a gap at the end of the file are force-released unless
 * {@code --no-flush} is given.
 */
@Command(name = "replay", mixinStandardHelpOptions = true,
        description = "Replay a JSON-lines file of envelopes and print the projection")
@Component
public class ReplayCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON-lines file with one envelope per line")
    private Path file;

    @Option(names = "--stream", description = "Only print this stream")
    private String streamId;

    @Option(names = "--no-flush", description = "Leave streams that still wait on a sequence gap unreleased")
    private boolean noFlush;

    private final EventDispatcher dispatcher;
    private final Projection projection;
    private final ObjectMapper objectMapper;

    public ReplayCommand(EventDispatcher dispatcher, Projection projection, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.projection = projection;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (!Files.isReadable(file)) {
            ConsoleOutput.error("Cannot read " + file);
            return 1;
        }

        Map<DispatchResult.Outcome, Integer> outcomes = new EnumMap<>(DispatchResult.Outcome.class);
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                DispatchResult.Outcome outcome;
                try {
                    EventEnvelope envelope = objectMapper.readValue(line, EventEnvelope.class);
                    outcome = dispatcher.dispatch(envelope).outcome();
                } catch (JsonProcessingException e) {
                    ConsoleOutput.warn("Line " + lineNumber + ": " + e.getOriginalMessage());
                    outcome = DispatchResult.Outcome.INVALID;
                }
                outcomes.merge(outcome, 1, Integer::sum);
            }
        } catch (IOException e) {
            ConsoleOutput.error("Failed to read " + file + ": " + e.getMessage());
            return 1;
        }

        if (!noFlush) {
            int flushed = dispatcher.flushBacklog();
            if (flushed > 0) {
                ConsoleOutput.warn("Force-released " + flushed + " envelope(s) past sequence gaps");
            }
        }

        ConsoleOutput.info("Replayed " + lineNumber + " line(s)");
        for (DispatchResult.Outcome outcome : DispatchResult.Outcome.values()) {
            System.out.println("  " + outcome.tag() + ": " + outcomes.getOrDefault(outcome, 0));
        }

        List<String> streams = streamId != null
                ? List.of(streamId)
                : projection.read(p -> p.sessions().all().stream().map(Session::id).toList());
        for (String id : streams) {
            StreamSnapshot snapshot = projection.snapshot(id);
            if (!snapshot.exists()) {
                ConsoleOutput.error("Stream not found: " + id);
                return 1;
            }
            ConsoleOutput.stream(snapshot);
        }
        return 0;
    }
}
