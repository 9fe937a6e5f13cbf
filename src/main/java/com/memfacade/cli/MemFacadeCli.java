package com.memfacade.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.memfacade.memory.Identity;
import com.memfacade.memory.NewMemory;
import com.memfacade.memory.SortField;
import com.memfacade.memory.SortOrder;
import com.memfacade.memory.Timestamps;
import com.memfacade.observability.MemoryMetrics;
import com.memfacade.service.MemoryService;
import com.memfacade.service.MemoryServiceException;
import com.memfacade.shared.config.ConfigLoader;
import com.memfacade.store.LuceneMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Admin command line over {@link MemoryService}.
 *
 * <pre>
 * memfacade [--user U] [--agent A] [--run R] &lt;command&gt; [args]
 *   add &lt;content&gt; | get &lt;id&gt; | list [limit] | delete &lt;id&gt; | purge
 *   users | stats [cutoff] | quality [cutoff]
 * </pre>
 */
public class MemFacadeCli {

    private static final Logger log = LoggerFactory.getLogger(MemFacadeCli.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final MemoryService service;
    private final PrintStream out;

    public MemFacadeCli(MemoryService service, PrintStream out) {
        this.service = service;
        this.out = out;
    }

    public static void main(String[] args) throws Exception {
        var config = ConfigLoader.load();
        var store = new LuceneMemoryStore(config.indexPath());
        Runtime.getRuntime().addShutdownHook(new Thread(store::close, "memory-close"));
        log.info("Memory store opened at {}", config.indexPath());

        var service = new MemoryService(store, config, new MemoryMetrics());
        System.exit(new MemFacadeCli(service, System.out).run(args));
    }

    public int run(String[] args) {
        String user = null, agent = null, run = null;
        var positional = new ArrayList<String>();
        for (int i = 0; i < args.length; i++) {
            var flag = args[i].startsWith("--") && i + 1 < args.length;
            switch (flag ? args[i] : "") {
                case "--user" -> user = args[++i];
                case "--agent" -> agent = args[++i];
                case "--run" -> run = args[++i];
                default -> positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            out.println("usage: memfacade [--user U] [--agent A] [--run R] "
                    + "<add|get|list|delete|purge|users|stats|quality> [args]");
            return 2;
        }

        var identity = new Identity(user, agent, run);
        try {
            out.println(MAPPER.writeValueAsString(dispatch(positional, identity)));
            return 0;
        } catch (MemoryServiceException e) {
            out.println("[" + e.kind() + "] " + e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            log.error("Failed to render result", e);
            return 1;
        }
    }

    private Object dispatch(List<String> positional, Identity identity) {
        var command = positional.get(0);
        var arg = positional.size() > 1 ? positional.get(1) : null;
        return switch (command) {
            case "add" -> service.createMemory(NewMemory.of(require(arg, "content")), identity, true);
            case "get" -> service.getMemory(require(arg, "memory id"), identity);
            case "list" -> service.listMemories(identity, arg != null ? parseLimit(arg) : 100, 0,
                    SortField.CREATED_AT, SortOrder.DESC);
            case "delete" -> {
                var memoryId = require(arg, "memory id");
                service.deleteMemory(memoryId, identity);
                yield Map.of("deleted", memoryId);
            }
            case "purge" -> Map.of("deleted", service.deleteAllMemories(identity));
            case "users" -> service.getUsers();
            case "stats" -> service.getStatistics(identity, cutoff(arg));
            case "quality" -> service.analyzeQuality(identity, cutoff(arg));
            default -> throw MemoryServiceException.invalid("Unknown command: " + command);
        };
    }

    private static Instant cutoff(String arg) {
        if (arg == null) return null;
        var parsed = Timestamps.parse(arg);
        if (!Timestamps.isKnown(parsed)) {
            throw MemoryServiceException.invalid("Invalid cutoff date: " + arg);
        }
        return parsed;
    }

    private static int parseLimit(String arg) {
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw MemoryServiceException.invalid("limit must be a number: " + arg);
        }
    }

    private static String require(String arg, String name) {
        if (arg == null || arg.isBlank()) throw MemoryServiceException.invalid(name + " is required");
        return arg;
    }
}
