package it.aw.legalgraph.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.aw.legalgraph.model.IngestionSummary;
import it.aw.legalgraph.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * Ingestione da riga di comando: ogni opzione {@code --ingest=<percorso>} è
 * ingestita nell'ordine dato e il suo riepilogo stampato in JSON su stdout.
 * Senza opzioni non fa nulla.
 */
@Component
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    static final String INGEST_OPTION = "ingest";

    private final IngestionService ingestionService;
    private final ObjectMapper mapper;
    private final PrintStream out;

    @Autowired
    public IngestionRunner(IngestionService ingestionService, ObjectMapper mapper) {
        this(ingestionService, mapper, System.out);
    }

    IngestionRunner(IngestionService ingestionService, ObjectMapper mapper, PrintStream out) {
        this.ingestionService = ingestionService;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> paths = args.getOptionValues(INGEST_OPTION);
        if (paths == null || paths.isEmpty()) return;

        log.info("IngestionRunner: {} documenti da ingestire", paths.size());
        for (String path : paths) {
            IngestionSummary summary = ingestionService.ingest(Paths.get(path));
            out.println(mapper.writeValueAsString(summary));
        }
    }
}
