package net.findmycard.runner;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.NoSuchElementException;
import net.findmycard.service.CatalogIngestionService;
import net.findmycard.service.IngestionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Imports a Scryfall bulk data file at startup when started with
 * {@code --import.scryfall.file=<path>}. The file is streamed one card object at a time.
 */
@Component
public class ScryfallBulkImportRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ScryfallBulkImportRunner.class);
    static final String FILE_OPTION = "import.scryfall.file";

    private final ApplicationArguments arguments;
    private final CatalogIngestionService ingestionService;
    private final ObjectMapper objectMapper;

    public ScryfallBulkImportRunner(ApplicationArguments arguments,
                                    CatalogIngestionService ingestionService,
                                    ObjectMapper objectMapper) {
        this.arguments = arguments;
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        if (!arguments.containsOption(FILE_OPTION)) {
            return;
        }
        Path file = Paths.get(arguments.getOptionValues(FILE_OPTION).get(0));
        if (!Files.isReadable(file)) {
            throw new IllegalArgumentException("Scryfall bulk file is not readable: " + file);
        }
        log.info("Starting Scryfall bulk import from {}", file);
        try (JsonParser parser = objectMapper.getFactory().createParser(file.toFile())) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new IllegalArgumentException("Scryfall bulk file must contain a JSON array: " + file);
            }
            IngestionResult result = ingestionService.importStream(new CardObjectIterator(parser), file.toString());
            log.info("Scryfall bulk import from {} finished: {} read, {} stored, {} skipped",
                file, result.received(), result.stored(), result.skipped());
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
    }

    /**
     * Yields the objects of an array the parser is positioned in.
     */
    static final class CardObjectIterator implements Iterator<JsonNode> {

        private final JsonParser parser;
        private JsonNode next;

        CardObjectIterator(JsonParser parser) {
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            try {
                JsonToken token = parser.nextToken();
                while (token != null && token != JsonToken.END_ARRAY) {
                    JsonNode node = parser.readValueAsTree();
                    if (node != null && node.isObject()) {
                        next = node;
                        return true;
                    }
                    token = parser.nextToken();
                }
                return false;
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read Scryfall bulk data", ex);
            }
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode current = next;
            next = null;
            return current;
        }
    }
}
